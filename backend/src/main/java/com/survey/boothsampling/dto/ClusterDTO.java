package com.survey.boothsampling.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One cluster of a region as drawn by the map client
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterDTO {
    private int id;

    // Center coordinates in [longitude, latitude] format (GeoJSON compatible)
    private double[] center;

    // Booths assigned to this cluster
    private int count;

    // Booths picked from it
    private int selected;

    // Bounding box for the cluster [west, south, east, north]
    private double[] bounds;
}
