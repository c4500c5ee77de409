package com.survey.boothsampling.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.boothsampling.engine.CoordinateReprojector;
import com.survey.boothsampling.exception.LayerFormatException;
import com.survey.boothsampling.model.LayerFeature;
import com.survey.boothsampling.model.SpatialLayer;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a GeoJSON FeatureCollection into a {@link SpatialLayer}.
 * The legacy {@code crs} member names the reference system; without it the layer has none.
 */
@Component
@Slf4j
public class GeoJsonLayerReader {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GeometryFactory geometryFactory = new GeometryFactory();

    public SpatialLayer read(String layerName, InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new LayerFormatException("Layer " + layerName + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new LayerFormatException("Layer " + layerName + " is not a GeoJSON FeatureCollection");
        }

        // GeoJsonReader is not thread-safe
        GeoJsonReader geometryReader = new GeoJsonReader(geometryFactory);
        Set<String> columns = new LinkedHashSet<>();
        List<LayerFeature> features = new ArrayList<>();
        int skipped = 0;

        for (JsonNode featureNode : root.path("features")) {
            JsonNode geometryNode = featureNode.get("geometry");
            if (geometryNode == null || geometryNode.isNull()) {
                skipped++;
                continue;
            }
            Geometry geometry;
            try {
                geometry = geometryReader.read(geometryNode.toString());
            } catch (ParseException e) {
                log.warn("Skipping feature with unreadable geometry in {}: {}", layerName, e.getMessage());
                skipped++;
                continue;
            }

            Map<String, Object> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> properties = featureNode.path("properties").fields();
            while (properties.hasNext()) {
                Map.Entry<String, JsonNode> property = properties.next();
                columns.add(property.getKey());
                attributes.put(property.getKey(), toValue(property.getValue()));
            }
            features.add(new LayerFeature(geometry, attributes));
        }

        if (skipped > 0) {
            log.warn("Skipped {} features without usable geometry in {}", skipped, layerName);
        }
        String crs = CoordinateReprojector.normalize(root.path("crs").path("properties").path("name").asText(null));
        log.info("Read layer {}: {} features, {} columns, crs={}", layerName, features.size(), columns.size(), crs);

        return SpatialLayer.builder()
                .name(layerName)
                .crs(crs)
                .columns(columns)
                .features(features)
                .build();
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.asText();
    }
}
