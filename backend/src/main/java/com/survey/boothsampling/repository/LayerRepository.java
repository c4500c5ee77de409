package com.survey.boothsampling.repository;

import com.survey.boothsampling.engine.CoordinateReprojector;
import com.survey.boothsampling.engine.SchemaResolver;
import com.survey.boothsampling.engine.SemanticField;
import com.survey.boothsampling.exception.LayerFormatException;
import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.BoothLayer;
import com.survey.boothsampling.model.LayerFeature;
import com.survey.boothsampling.model.SelectionType;
import com.survey.boothsampling.model.SpatialLayer;
import com.survey.boothsampling.storage.LayerKind;
import com.survey.boothsampling.storage.LayerStorage;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Loads state layers from the configured store and keeps them in memory between runs.
 */
@Repository
@Slf4j
public class LayerRepository {

    private final LayerStorage storage;
    private final GeoJsonLayerReader reader;
    private final SchemaResolver schemaResolver;
    private final CoordinateReprojector reprojector;
    private final String fallbackCrs;

    public LayerRepository(LayerStorage storage,
                           GeoJsonLayerReader reader,
                           SchemaResolver schemaResolver,
                           CoordinateReprojector reprojector,
                           @Value("${sampling.crs.fallback:}") String fallbackCrs) {
        this.storage = storage;
        this.reader = reader;
        this.schemaResolver = schemaResolver;
        this.reprojector = reprojector;
        this.fallbackCrs = CoordinateReprojector.normalize(fallbackCrs);
    }

    public List<String> listStates() {
        return storage.listStates();
    }

    /**
     * Region boundaries of a state for the given constituency type
     */
    @Cacheable(value = "regionLayers", key = "{#state, #selectionType}")
    public SpatialLayer loadRegionLayer(String state, SelectionType selectionType) {
        SpatialLayer layer = read(state, LayerKind.boundariesFor(selectionType));
        layer.setCrs(withFallback(layer.getCrs(), layer.getName()));
        return layer;
    }

    /**
     * Booths of a state with geographic latitude and longitude derived from each point
     */
    @Cacheable(value = "boothLayers", key = "#state")
    public BoothLayer loadBoothLayer(String state) {
        SpatialLayer layer = read(state, LayerKind.BOOTH);
        String crs = withFallback(layer.getCrs(), layer.getName());

        Optional<String> boothColumn = schemaResolver.resolve(layer.getColumns(), SemanticField.BOOTH_CODE);
        if (boothColumn.isEmpty()) {
            log.warn("Booth layer {} has no booth number column, ties are broken by file order", layer.getName());
        }

        UnaryOperator<Coordinate> toGeographic = crs != null
                ? reprojector.transformer(crs, CoordinateReprojector.WGS84)
                : UnaryOperator.identity();

        List<Booth> booths = new ArrayList<>(layer.getFeatures().size());
        int index = 0;
        for (LayerFeature feature : layer.getFeatures()) {
            Point location = asPoint(feature.getGeometry());
            Coordinate geographic = toGeographic.apply(location.getCoordinate());
            booths.add(Booth.builder()
                    .index(index++)
                    .location(location)
                    .attributes(feature.getAttributes())
                    .boothCode(feature.attributeAsString(boothColumn.orElse(null)))
                    .longitude(geographic.x)
                    .latitude(geographic.y)
                    .build());
        }

        log.info("Prepared {} booths for {} (crs={})", booths.size(), state, crs);
        return BoothLayer.builder()
                .state(state)
                .crs(crs)
                .columns(layer.getColumns())
                .booths(booths)
                .build();
    }

    private SpatialLayer read(String state, LayerKind kind) {
        String layerName = state + "." + kind.getFileToken();
        try (InputStream input = storage.openLayer(state, kind)) {
            return reader.read(layerName, input);
        } catch (IOException e) {
            throw new LayerFormatException("Failed to read layer " + layerName + " from " + storage.describe(), e);
        }
    }

    private String withFallback(String crs, String layerName) {
        if (crs != null) {
            return crs;
        }
        if (fallbackCrs != null) {
            log.warn("Layer {} declares no coordinate reference system, assuming configured {}", layerName, fallbackCrs);
            return fallbackCrs;
        }
        log.warn("Layer {} declares no coordinate reference system and no fallback is configured", layerName);
        return null;
    }

    private static Point asPoint(Geometry geometry) {
        if (geometry instanceof Point) {
            return (Point) geometry;
        }
        // Multi-points and the occasional polygon booth footprint are reduced to one position
        return geometry.getInteriorPoint();
    }
}
