package com.survey.boothsampling.engine;

import org.springframework.stereotype.Component;

/**
 * Turns a requested sample size into a cluster count: 25 samples make one cluster,
 * and each cluster contributes two booths.
 */
@Component
public class ClusterCountAllocator {

    public static final int SAMPLES_PER_CLUSTER = 25;
    public static final int BOOTHS_PER_CLUSTER = 2;

    /**
     * Number of clusters per region, rounded to the nearest whole cluster and never below one.
     * 62 samples give 2 clusters, 63 give 3.
     */
    public int clustersFor(int requestedSamples) {
        long rounded = (long) Math.rint((double) requestedSamples / SAMPLES_PER_CLUSTER);
        return (int) Math.max(1, rounded);
    }

    public int targetSelected(int clusters) {
        return clusters * BOOTHS_PER_CLUSTER;
    }
}
