package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteredBooth;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects up to {@value ClusterCountAllocator#BOOTHS_PER_CLUSTER} booths from every cluster.
 * A short cluster contributes what it has; it is never topped up from a neighbour.
 */
@Component
@RequiredArgsConstructor
public class RepresentativeSelector {

    private final RepresentativePolicy policy;

    public List<ClusteredBooth> select(List<Cluster> clusters) {
        List<ClusteredBooth> selected = new ArrayList<>();
        for (Cluster cluster : clusters) {
            selected.addAll(policy.pick(cluster, ClusterCountAllocator.BOOTHS_PER_CLUSTER));
        }
        return selected;
    }
}
