package com.survey.boothsampling.controller;

import com.survey.boothsampling.dto.MapFileDTO;
import com.survey.boothsampling.dto.RegionSummaryRow;
import com.survey.boothsampling.dto.SamplingRequest;
import com.survey.boothsampling.engine.ClusterCountAllocator;
import com.survey.boothsampling.exception.BatchProcessingException;
import com.survey.boothsampling.exception.GlobalExceptionHandler;
import com.survey.boothsampling.exception.LayerNotFoundException;
import com.survey.boothsampling.exception.LayerStorageException;
import com.survey.boothsampling.exception.ResourceNotFoundException;
import com.survey.boothsampling.model.CompletenessReason;
import com.survey.boothsampling.model.ReferenceCheck;
import com.survey.boothsampling.model.Region;
import com.survey.boothsampling.model.RegionOutcome;
import com.survey.boothsampling.model.SamplingRun;
import com.survey.boothsampling.model.SelectionResult;
import com.survey.boothsampling.model.SelectionType;
import com.survey.boothsampling.service.SamplingReportService;
import com.survey.boothsampling.service.SamplingRunStore;
import com.survey.boothsampling.service.SamplingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SamplingControllerTest {

    @Mock
    private SamplingService samplingService;

    @Mock
    private SamplingReportService reportService;

    private SamplingRunStore runStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        runStore = new SamplingRunStore();
        SamplingController controller = new SamplingController(
                samplingService, reportService, runStore, new ClusterCountAllocator());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testGetStates() throws Exception {
        when(samplingService.getAvailableStates()).thenReturn(List.of("Goa", "Kerala"));

        mockMvc.perform(get("/api/sampling/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.states[0]").value("Goa"))
                .andExpect(jsonPath("$.states[1]").value("Kerala"));
    }

    @Test
    void testGetStatesWhenStoreUnavailable() throws Exception {
        when(samplingService.getAvailableStates())
                .thenThrow(new LayerStorageException("Failed to list states in s3://layers/"));

        mockMvc.perform(get("/api/sampling/states"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Failed to list states in s3://layers/"));
    }

    @Test
    void testGetRegions() throws Exception {
        when(samplingService.getRegions("Goa", SelectionType.ASSEMBLY))
                .thenReturn(List.of(new Region("1", "Mandrem"), new Region("2", "Pernem")));

        mockMvc.perform(get("/api/sampling/regions/Goa/AC"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.regions[1].name").value("Pernem"));
    }

    @Test
    void testGetRegionsWithUnknownType() throws Exception {
        mockMvc.perform(get("/api/sampling/regions/Goa/district"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown selection type: district"));
    }

    @Test
    void testGetRegionsForMissingState() throws Exception {
        when(samplingService.getRegions("Atlantis", SelectionType.PARLIAMENTARY))
                .thenThrow(new LayerNotFoundException("No layer folder found for state: Atlantis"));

        mockMvc.perform(get("/api/sampling/regions/Atlantis/PC"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void testRunSampling() throws Exception {
        // Given
        when(samplingService.runBatch(any(SamplingRequest.class))).thenReturn(sampleRun());

        // When / Then
        mockMvc.perform(post("/api/sampling/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"Goa\",\"selectionType\":\"AC\",\"samplesPerRegion\":300}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.clustersPerRegion").value(12))
                .andExpect(jsonPath("$.boothsPerRegion").value(24))
                .andExpect(jsonPath("$.totalRegions").value(2))
                .andExpect(jsonPath("$.completed").value(1))
                .andExpect(jsonPath("$.message").value("Processing complete! Processed 2 ACs"));

        // The run is kept for the result endpoints
        org.junit.jupiter.api.Assertions.assertEquals("run-42", runStore.getLatest().getRunId());
    }

    @Test
    void testRunSamplingRejectsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/sampling/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"\",\"selectionType\":\"PC\",\"samplesPerRegion\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.state").value("State cannot be empty"))
                .andExpect(jsonPath("$.fieldErrors.samplesPerRegion").exists());

        verify(samplingService, never()).runBatch(any());
    }

    @Test
    void testRunSamplingWithUnknownSelectionType() throws Exception {
        mockMvc.perform(post("/api/sampling/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"Goa\",\"selectionType\":\"ward\",\"samplesPerRegion\":300}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testRunSamplingBatchFailure() throws Exception {
        when(samplingService.runBatch(any(SamplingRequest.class)))
                .thenThrow(new BatchProcessingException("Could not parse AC data for Goa"));

        mockMvc.perform(post("/api/sampling/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"Goa\",\"selectionType\":\"AC\",\"samplesPerRegion\":300}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Could not parse AC data for Goa"));
    }

    @Test
    void testResultsBeforeAnyRun() throws Exception {
        mockMvc.perform(get("/api/sampling/runs/latest/summary"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No results available"));
    }

    @Test
    void testSummary() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        when(reportService.buildSummary(run)).thenReturn(List.of(RegionSummaryRow.builder()
                .code("1").name("Mandrem").status(RegionSummaryRow.COMPLETED).reason("").build()));

        mockMvc.perform(get("/api/sampling/runs/latest/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("Completed"));
    }

    @Test
    void testSummaryCsvDownload() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        when(reportService.summaryCsv(run)).thenReturn("\"AC\",\"AC_Name\"\n");

        mockMvc.perform(get("/api/sampling/runs/latest/summary.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=summary.csv"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(containsString("AC_Name")));
    }

    @Test
    void testSelectedBoothsCsvDownload() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        when(reportService.selectedBoothsCsv(run)).thenReturn("\"state\"\n");

        mockMvc.perform(get("/api/sampling/runs/latest/selected-booths.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=selected_booths.csv"));
    }

    @Test
    void testAvailableMaps() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        when(reportService.listMaps(run)).thenReturn(List.of(new MapFileDTO("1", "Mandrem", "1_Mandrem_map.geojson")));

        mockMvc.perform(get("/api/sampling/runs/latest/maps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maps[0].code").value("1"))
                .andExpect(jsonPath("$.maps[0].filename").value("1_Mandrem_map.geojson"));
    }

    @Test
    void testMapsZipDownload() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        byte[] archive = {0x50, 0x4b, 0x03, 0x04};
        when(reportService.mapsZip(run)).thenReturn(archive);

        mockMvc.perform(get("/api/sampling/runs/latest/maps.zip"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=maps.zip"))
                .andExpect(content().contentType("application/zip"))
                .andExpect(content().bytes(archive));
    }

    @Test
    void testMapsZipWithoutMaps() throws Exception {
        SamplingRun run = sampleRun();
        runStore.save(run);
        when(reportService.mapsZip(run)).thenThrow(new ResourceNotFoundException("No maps available"));

        mockMvc.perform(get("/api/sampling/runs/latest/maps.zip"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No maps available"));
    }

    private static SamplingRun sampleRun() {
        SelectionResult complete = result(24, CompletenessReason.COMPLETE);
        SelectionResult empty = result(0, CompletenessReason.NO_BOOTHS_IN_BOUNDARY);
        return SamplingRun.builder()
                .runId("run-42")
                .startedAt(LocalDateTime.now())
                .state("Goa")
                .selectionType(SelectionType.ASSEMBLY)
                .samplesPerRegion(300)
                .clustersPerRegion(12)
                .outcomes(List.of(
                        new RegionOutcome(new Region("1", "Mandrem"), complete),
                        new RegionOutcome(new Region("2", "Pernem"), empty)))
                .build();
    }

    private static SelectionResult result(int totalBooths, CompletenessReason reason) {
        return SelectionResult.builder()
                .totalBooths(totalBooths)
                .requestedClusters(12)
                .effectiveClusters(totalBooths > 0 ? 12 : 0)
                .targetSelected(24)
                .selectedBooths(List.of())
                .clusteredBooths(List.of())
                .clusterCenters(List.of())
                .complete(reason == CompletenessReason.COMPLETE)
                .reasonCode(reason)
                .referenceCheck(ReferenceCheck.MATCHED)
                .build();
    }
}
