package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything a map client needs to draw one sampled region
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionMapDTO {
    private String code;
    private String name;
    private List<ClusterDTO> clusters;

    // GeoJSON FeatureCollection of every clustered booth plus the cluster centers
    private Map<String, Object> features;
}
