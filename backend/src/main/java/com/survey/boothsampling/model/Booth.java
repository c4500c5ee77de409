package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Point;

import java.util.Map;

/**
 * A polling location. {@code location} stays in the booth layer's own reference system,
 * {@code latitude}/{@code longitude} are always geographic (EPSG:4326).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Booth {
    // Position of the booth within its source layer, used for stable ordering
    private int index;

    private Point location;
    private Map<String, Object> attributes;

    // Resolved booth number, empty when the layer has no booth column
    private String boothCode;

    private double latitude;
    private double longitude;
}
