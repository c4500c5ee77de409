package com.survey.boothsampling.repository;

import com.survey.boothsampling.exception.LayerFormatException;
import com.survey.boothsampling.model.LayerFeature;
import com.survey.boothsampling.model.SpatialLayer;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeoJsonLayerReaderTest {

    private final GeoJsonLayerReader reader = new GeoJsonLayerReader();

    @Test
    void testReadsFeaturesAndColumns() {
        String json = "{\"type\":\"FeatureCollection\","
                + "\"crs\":{\"type\":\"name\",\"properties\":{\"name\":\"urn:ogc:def:crs:EPSG::32643\"}},"
                + "\"features\":["
                + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[500000,1105412]},"
                + "\"properties\":{\"booth\":\"12\",\"ac_no\":101,\"area\":1.5,\"urban\":true}},"
                + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[1,0],[1,1],[0,0]]]},"
                + "\"properties\":{\"booth\":\"13\",\"remarks\":null}}"
                + "]}";

        SpatialLayer layer = reader.read("Goa.booth", stream(json));

        assertEquals("Goa.booth", layer.getName());
        assertEquals("EPSG:32643", layer.getCrs());
        assertEquals(List.of("booth", "ac_no", "area", "urban", "remarks"), List.copyOf(layer.getColumns()));
        assertEquals(2, layer.getFeatures().size());

        LayerFeature first = layer.getFeatures().get(0);
        assertInstanceOf(Point.class, first.getGeometry());
        assertEquals(101L, first.getAttributes().get("ac_no"));
        assertEquals(1.5, first.getAttributes().get("area"));
        assertEquals(true, first.getAttributes().get("urban"));
        assertEquals("101", first.attributeAsString("ac_no"));

        LayerFeature second = layer.getFeatures().get(1);
        assertInstanceOf(Polygon.class, second.getGeometry());
        assertNull(second.getAttributes().get("remarks"));
        assertEquals("", second.attributeAsString("remarks"));
    }

    @Test
    void testMissingCrsIsNull() {
        String json = "{\"type\":\"FeatureCollection\",\"features\":[]}";

        SpatialLayer layer = reader.read("Goa.assembly", stream(json));

        assertNull(layer.getCrs());
        assertEquals(0, layer.getFeatures().size());
    }

    @Test
    void testFeaturesWithoutGeometryAreSkipped() {
        String json = "{\"type\":\"FeatureCollection\",\"features\":["
                + "{\"type\":\"Feature\",\"geometry\":null,\"properties\":{\"booth\":\"1\"}},"
                + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[74.1,15.2]},"
                + "\"properties\":{\"booth\":\"2\"}}"
                + "]}";

        SpatialLayer layer = reader.read("Goa.booth", stream(json));

        assertEquals(1, layer.getFeatures().size());
        assertEquals("2", layer.getFeatures().get(0).attributeAsString("booth"));
    }

    @Test
    void testRejectsNonGeoJson() {
        assertThrows(LayerFormatException.class, () -> reader.read("bad", stream("{\"type\":\"Feature\"}")));
        assertThrows(LayerFormatException.class, () -> reader.read("bad", stream("not json at all")));
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
