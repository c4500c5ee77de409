package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Outcome of sampling one region. Built fresh for every region and request, never reused.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class SelectionResult {
    int totalBooths;
    int requestedClusters;
    int effectiveClusters;
    int targetSelected;

    List<ClusteredBooth> selectedBooths;
    List<ClusteredBooth> clusteredBooths;
    List<Coordinate> clusterCenters;

    boolean complete;
    CompletenessReason reasonCode;
    ReferenceCheck referenceCheck;

    public String getReason() {
        return reasonCode.getText();
    }

    public int getSelectedCount() {
        return selectedBooths.size();
    }
}
