package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

import java.util.Map;

/**
 * One row of a spatial layer: a geometry plus its attribute columns
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerFeature {
    private Geometry geometry;

    // Insertion-ordered attribute columns as found in the source file
    private Map<String, Object> attributes;

    public String attributeAsString(String column) {
        if (column == null || attributes == null) {
            return "";
        }
        Object value = attributes.get(column);
        return value != null ? String.valueOf(value) : "";
    }
}
