package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * A fully materialized table of features sharing one coordinate reference system.
 * A null {@code crs} means the source declared none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpatialLayer {
    private String name;
    private String crs;
    private Set<String> columns;
    private List<LayerFeature> features;

    public boolean isEmpty() {
        return features == null || features.isEmpty();
    }

    public boolean hasCrs() {
        return crs != null && !crs.isBlank();
    }
}
