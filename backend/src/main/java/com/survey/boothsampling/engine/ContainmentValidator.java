package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.BoothLayer;
import com.survey.boothsampling.model.ContainmentResult;
import com.survey.boothsampling.model.LayerFeature;
import com.survey.boothsampling.model.ReferenceCheck;
import com.survey.boothsampling.model.SpatialLayer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keeps the booths that physically lie inside a region boundary.
 * The boundary layer is authoritative: booths are moved into its reference system, never the reverse.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContainmentValidator {

    private final CoordinateReprojector reprojector;

    private final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Validate booths against the polygon whose {@code codeColumn} equals {@code regionCode}.
     *
     * @param booths      booth layer in any reference system
     * @param regions     region boundary layer
     * @param codeColumn  resolved region code column of {@code regions}
     * @param regionCode  code of the region to validate against
     * @return booths strictly inside the boundary, empty if no polygon carries the code
     */
    public ContainmentResult validate(BoothLayer booths, SpatialLayer regions,
                                      String codeColumn, String regionCode) {
        return validate(align(booths, regions.getCrs()), regions, codeColumn, regionCode);
    }

    /**
     * Same as {@link #validate(BoothLayer, SpatialLayer, String, String)} for booths already
     * aligned with {@link #align(BoothLayer, String)}, so a batch reprojects the layer once.
     */
    public ContainmentResult validate(AlignedBooths aligned, SpatialLayer regions,
                                      String codeColumn, String regionCode) {
        Optional<Geometry> boundary = findBoundary(regions, codeColumn, regionCode);
        if (boundary.isEmpty()) {
            log.debug("No boundary with {}={} in layer {}", codeColumn, regionCode, regions.getName());
            return ContainmentResult.regionMissing(aligned.getReferenceCheck());
        }

        PreparedGeometry prepared = PreparedGeometryFactory.prepare(boundary.get());
        List<Booth> inside = new ArrayList<>();
        for (int i = 0; i < aligned.size(); i++) {
            // contains() excludes points lying on the boundary itself
            if (prepared.contains(aligned.getPoints().get(i))) {
                inside.add(aligned.getBooths().get(i));
            }
        }

        log.debug("Region {}: {} of {} booths inside boundary", regionCode, inside.size(), aligned.size());
        return ContainmentResult.builder()
                .validBooths(inside)
                .regionFound(true)
                .referenceCheck(aligned.getReferenceCheck())
                .build();
    }

    /**
     * Expresses every booth point in {@code targetCrs}. When either side declares no system the
     * raw coordinates are kept and the result is marked {@link ReferenceCheck#UNVERIFIED}.
     */
    public AlignedBooths align(BoothLayer booths, String targetCrs) {
        List<Booth> source = booths.getBooths() != null ? booths.getBooths() : List.of();
        List<Point> points = new ArrayList<>(source.size());

        if (!booths.hasCrs() || targetCrs == null || targetCrs.isBlank()) {
            log.warn("Booth layer for {} ({}) or boundary layer ({}) declares no coordinate reference system; "
                    + "containment is tested in raw coordinates", booths.getState(), booths.getCrs(), targetCrs);
            source.forEach(booth -> points.add(booth.getLocation()));
            return new AlignedBooths(source, points, targetCrs, ReferenceCheck.UNVERIFIED);
        }

        if (CoordinateReprojector.sameReference(booths.getCrs(), targetCrs)) {
            source.forEach(booth -> points.add(booth.getLocation()));
            return new AlignedBooths(source, points, targetCrs, ReferenceCheck.MATCHED);
        }

        log.info("Reprojecting {} booths from {} to {}", source.size(), booths.getCrs(), targetCrs);
        UnaryOperator<Coordinate> transform = reprojector.transformer(booths.getCrs(), targetCrs);
        for (Booth booth : source) {
            points.add(geometryFactory.createPoint(transform.apply(booth.getLocation().getCoordinate())));
        }
        return new AlignedBooths(source, points, targetCrs, ReferenceCheck.REPROJECTED);
    }

    private Optional<Geometry> findBoundary(SpatialLayer regions, String codeColumn, String regionCode) {
        if (regions == null || regions.isEmpty() || codeColumn == null || regionCode == null) {
            return Optional.empty();
        }
        for (LayerFeature feature : regions.getFeatures()) {
            if (regionCode.equals(feature.attributeAsString(codeColumn)) && feature.getGeometry() != null) {
                return Optional.of(feature.getGeometry());
            }
        }
        return Optional.empty();
    }
}
