package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partition produced by the clustering engine for one region
 */
@Value
@Builder
@AllArgsConstructor
public class ClusteringOutcome {
    List<Cluster> clusters;
    int requestedClusters;
    int iterations;
    double inertia;

    public int getEffectiveClusters() {
        return clusters.size();
    }

    public boolean isReduced() {
        return clusters.size() < requestedClusters;
    }
}
