package com.survey.boothsampling.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Export row for one selected booth. Identifier values are copied as found in the booth layer,
 * and are empty when the layer has no matching column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectedBoothRecord {
    private String state;
    private String district;
    @JsonProperty("district_n")
    private String districtName;
    private String pc;
    @JsonProperty("pc_name")
    private String pcName;
    private String ac;
    @JsonProperty("ac_name")
    private String acName;
    private String booth;
    @JsonProperty("booth_name")
    private String boothName;
    private int cluster;
    private double latitude;
    private double longitude;
}
