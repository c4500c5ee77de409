package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteredBooth;
import com.survey.boothsampling.model.ClusteringOutcome;
import com.survey.boothsampling.model.CompletenessReason;
import com.survey.boothsampling.model.ReferenceCheck;
import com.survey.boothsampling.model.SelectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Samples one region from its valid booths: cluster, pick representatives, judge completeness.
 * Holds no state between calls, so regions can be sampled concurrently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegionSampler {

    private final ClusterCountAllocator allocator;
    private final SpatialClusteringEngine clusteringEngine;
    private final RepresentativeSelector selector;
    private final CompletenessEvaluator evaluator;

    public SelectionResult sample(List<Booth> validBooths, int requestedSamples, ReferenceCheck referenceCheck) {
        int requestedClusters = allocator.clustersFor(requestedSamples);
        int target = allocator.targetSelected(requestedClusters);

        if (validBooths == null || validBooths.isEmpty()) {
            return noBooths(requestedClusters, target, referenceCheck);
        }

        ClusteringOutcome clustering = clusteringEngine.cluster(validBooths, requestedClusters);
        List<ClusteredBooth> selected = selector.select(clustering.getClusters());
        CompletenessReason reason = evaluator.evaluate(validBooths.size(), selected.size(), target, clustering);

        log.debug("Selected {} of {} booths across {} clusters ({})",
                selected.size(), validBooths.size(), clustering.getEffectiveClusters(), reason);

        return SelectionResult.builder()
                .totalBooths(validBooths.size())
                .requestedClusters(requestedClusters)
                .effectiveClusters(clustering.getEffectiveClusters())
                .targetSelected(target)
                .selectedBooths(Collections.unmodifiableList(selected))
                .clusteredBooths(annotate(clustering.getClusters()))
                .clusterCenters(clustering.getClusters().stream()
                        .map(Cluster::getCentroid)
                        .map(Coordinate::new)
                        .collect(Collectors.toUnmodifiableList()))
                .complete(reason == CompletenessReason.COMPLETE)
                .reasonCode(reason)
                .referenceCheck(referenceCheck)
                .build();
    }

    /**
     * Result for a region whose boundary holds no booths. Clustering is not attempted.
     */
    public SelectionResult noBooths(int requestedSamples, ReferenceCheck referenceCheck) {
        int requestedClusters = allocator.clustersFor(requestedSamples);
        return noBooths(requestedClusters, allocator.targetSelected(requestedClusters), referenceCheck);
    }

    private SelectionResult noBooths(int requestedClusters, int target, ReferenceCheck referenceCheck) {
        return SelectionResult.builder()
                .totalBooths(0)
                .requestedClusters(requestedClusters)
                .effectiveClusters(0)
                .targetSelected(target)
                .selectedBooths(List.of())
                .clusteredBooths(List.of())
                .clusterCenters(List.of())
                .complete(false)
                .reasonCode(CompletenessReason.NO_BOOTHS_IN_BOUNDARY)
                .referenceCheck(referenceCheck)
                .build();
    }

    // Every member in input order with its cluster id, for map rendering
    private List<ClusteredBooth> annotate(List<Cluster> clusters) {
        List<ClusteredBooth> annotated = new ArrayList<>();
        for (Cluster cluster : clusters) {
            for (Booth member : cluster.getMembers()) {
                annotated.add(new ClusteredBooth(member, cluster.getId(),
                        NearestToCentroidPolicy.distance(member, cluster.getCentroid())));
            }
        }
        annotated.sort((a, b) -> Integer.compare(a.getBooth().getIndex(), b.getBooth().getIndex()));
        return Collections.unmodifiableList(annotated);
    }
}
