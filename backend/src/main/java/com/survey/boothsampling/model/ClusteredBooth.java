package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A valid booth annotated with the cluster it was assigned to
 */
@Value
@Builder
@AllArgsConstructor
public class ClusteredBooth {
    Booth booth;
    int clusterId;
    double distanceToCentroid;
}
