package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.ReferenceCheck;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.locationtech.jts.geom.Point;

import java.util.List;

/**
 * Booth points expressed in a boundary layer's reference system, ready for containment tests.
 * {@code points.get(i)} is the position of {@code booths.get(i)}.
 */
@Value
@AllArgsConstructor
public class AlignedBooths {
    List<Booth> booths;
    List<Point> points;
    String crs;
    ReferenceCheck referenceCheck;

    public int size() {
        return booths.size();
    }
}
