package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * A spatial group of valid booths inside one region. Ids are only stable within one run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {
    private int id;

    // Mean of the member coordinates, x = longitude, y = latitude
    private Coordinate centroid;

    private List<Booth> members;

    public int size() {
        return members != null ? members.size() : 0;
    }
}
