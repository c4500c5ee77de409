package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistics returned once a run has finished
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SamplingRunResponse {
    private String status;
    private String runId;
    private String state;
    private String selectionType;
    private int samplesPerRegion;
    private int clustersPerRegion;
    private int boothsPerRegion;
    private int totalRegions;
    private long completed;
    private long totalBooths;
    private long totalSelected;
    private String message;
}
