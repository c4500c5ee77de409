package com.survey.boothsampling;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full run against layers written to a temporary folder
 */
@SpringBootTest
@AutoConfigureMockMvc
class BoothSamplingApplicationTest {

    @TempDir
    static Path workDir;

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void layerProperties(DynamicPropertyRegistry registry) {
        registry.add("sampling.storage.local.base-dir", () -> workDir.resolve("layers").toString());
        registry.add("audit.log.file", () -> workDir.resolve("audit/audit-logs.json").toString());
    }

    @BeforeAll
    static void writeLayers() throws IOException {
        Path goa = Files.createDirectories(workDir.resolve("layers/Goa"));
        Files.writeString(goa.resolve("Goa.assembly.geojson"), featureCollection("EPSG:4326", List.of(
                polygon(73.7, 15.5, 73.9, 15.7, "\"ac_no\":\"2\",\"ac_name\":\"Mapusa\""),
                polygon(73.9, 15.3, 74.1, 15.5, "\"ac_no\":\"1\",\"ac_name\":\"Mandrem\""))));

        List<String> booths = new ArrayList<>();
        int number = 1;
        // Two groups of five inside Mapusa, one booth inside Mandrem, one outside both
        for (double[] origin : new double[][]{{73.75, 15.55}, {73.85, 15.65}}) {
            for (int i = 0; i < 5; i++) {
                booths.add(point(origin[0] + 0.002 * i, origin[1] + 0.001 * i, number++, "2"));
            }
        }
        booths.add(point(74.0, 15.4, number++, "1"));
        booths.add(point(75.0, 16.0, number, "9"));
        Files.writeString(goa.resolve("Goa.booth.geojson"),
                featureCollection("urn:ogc:def:crs:OGC:1.3:CRS84", booths));
    }

    @Test
    void testSamplingRunEndToEnd() throws Exception {
        mockMvc.perform(get("/api/sampling/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.states[0]").value("Goa"));

        mockMvc.perform(get("/api/sampling/regions/Goa/AC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.regions[0].code").value("1"));

        mockMvc.perform(post("/api/sampling/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"Goa\",\"selectionType\":\"AC wise\",\"samplesPerRegion\":50,"
                                + "\"requestedBy\":\"field-team\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clustersPerRegion").value(2))
                .andExpect(jsonPath("$.totalRegions").value(2))
                .andExpect(jsonPath("$.completed").value(1))
                .andExpect(jsonPath("$.totalBooths").value(11))
                .andExpect(jsonPath("$.totalSelected").value(5))
                .andExpect(jsonPath("$.message").value("Processing complete! Processed 2 ACs"));

        mockMvc.perform(get("/api/sampling/runs/latest/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].code").value("1"))
                .andExpect(jsonPath("$.data[0].status").value("Not completed"))
                .andExpect(jsonPath("$.data[0].reasonCode").value("CLUSTER_COUNT_REDUCED"))
                .andExpect(jsonPath("$.data[1].code").value("2"))
                .andExpect(jsonPath("$.data[1].status").value("Completed"))
                .andExpect(jsonPath("$.data[1].referenceCheck").value("MATCHED"));

        mockMvc.perform(get("/api/sampling/runs/latest/regions/2/map"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clusters.length()").value(2))
                .andExpect(jsonPath("$.features.type").value("FeatureCollection"));

        mockMvc.perform(get("/api/audit/logs/user").param("username", "field-team"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].action").value(hasItems("SAMPLING_RUN_REQUEST", "SAMPLING_RUN_SUCCESS")));
    }

    @Test
    void testUnknownStateIsNotFound() throws Exception {
        mockMvc.perform(get("/api/sampling/regions/Atlantis/PC"))
                .andExpect(status().isNotFound());
    }

    private static String featureCollection(String crs, List<String> features) {
        return "{\"type\":\"FeatureCollection\",\"crs\":{\"type\":\"name\",\"properties\":{\"name\":\"" + crs + "\"}},"
                + "\"features\":[" + String.join(",", features) + "]}";
    }

    private static String polygon(double minX, double minY, double maxX, double maxY, String properties) {
        return String.format(Locale.ROOT,
                "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Polygon\",\"coordinates\":"
                        + "[[[%f,%f],[%f,%f],[%f,%f],[%f,%f],[%f,%f]]]},\"properties\":{%s}}",
                minX, minY, maxX, minY, maxX, maxY, minX, maxY, minX, minY, properties);
    }

    private static String point(double longitude, double latitude, int booth, String ac) {
        return String.format(Locale.ROOT,
                "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[%f,%f]},"
                        + "\"properties\":{\"booth\":\"%d\",\"ac_no\":\"%s\"}}",
                longitude, latitude, booth, ac);
    }
}
