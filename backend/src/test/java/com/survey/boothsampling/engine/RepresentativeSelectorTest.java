package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteredBooth;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.survey.boothsampling.BoothFixtures.booth;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepresentativeSelectorTest {

    @Mock
    private RepresentativePolicy policy;

    @Test
    void testAsksPolicyForTwoPerCluster() {
        // Given
        Cluster first = Cluster.builder().id(0).centroid(new Coordinate(0, 0))
                .members(List.of(booth(0, "001", 0, 0), booth(1, "002", 0.1, 0))).build();
        Cluster second = Cluster.builder().id(1).centroid(new Coordinate(5, 5))
                .members(List.of(booth(2, "003", 5, 5))).build();
        when(policy.pick(any(Cluster.class), eq(2))).thenAnswer(invocation -> {
            Cluster cluster = invocation.getArgument(0);
            return cluster.getMembers().stream()
                    .map(member -> new ClusteredBooth(member, cluster.getId(), 0.0))
                    .limit(2)
                    .collect(java.util.stream.Collectors.toList());
        });

        // When
        List<ClusteredBooth> selected = new RepresentativeSelector(policy).select(List.of(first, second));

        // Then: short clusters are not topped up
        assertEquals(3, selected.size());
        assertEquals(0, selected.get(0).getClusterId());
        assertEquals(1, selected.get(2).getClusterId());
        verify(policy, times(2)).pick(any(Cluster.class), eq(2));
    }

    @Test
    void testNeverMoreThanTwoPerCluster() {
        Cluster cluster = Cluster.builder().id(0).centroid(new Coordinate(0, 0))
                .members(List.of(booth(0, "001", 0, 0), booth(1, "002", 1, 0),
                        booth(2, "003", 2, 0), booth(3, "004", 3, 0))).build();

        List<ClusteredBooth> selected = new RepresentativeSelector(new NearestToCentroidPolicy()).select(List.of(cluster));

        assertEquals(2, selected.size());
    }
}
