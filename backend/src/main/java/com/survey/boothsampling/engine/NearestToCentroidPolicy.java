package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteredBooth;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the members closest to the cluster centroid. Equal distances fall back to the booth
 * code in lexical order, then to the booth's position in its source layer.
 */
@Component
public class NearestToCentroidPolicy implements RepresentativePolicy {

    static final Comparator<ClusteredBooth> ORDER = Comparator
            .comparingDouble(ClusteredBooth::getDistanceToCentroid)
            .thenComparing(candidate -> candidate.getBooth().getBoothCode(),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(candidate -> candidate.getBooth().getIndex());

    @Override
    public List<ClusteredBooth> pick(Cluster cluster, int limit) {
        return cluster.getMembers().stream()
                .map(booth -> new ClusteredBooth(booth, cluster.getId(), distance(booth, cluster.getCentroid())))
                .sorted(ORDER)
                .limit(limit)
                .collect(Collectors.toList());
    }

    static double distance(Booth booth, Coordinate centroid) {
        double dx = booth.getLongitude() - centroid.x;
        double dy = booth.getLatitude() - centroid.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
