package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the run summary table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionSummaryRow {
    public static final String COMPLETED = "Completed";
    public static final String NOT_COMPLETED = "Not completed";

    private String code;
    private String name;
    private int totalBooths;
    private int selectedBooths;
    private String status;
    private String reason;
    private String reasonCode;
    private String referenceCheck;
    private int samplesRequested;
}
