package com.survey.boothsampling.controller;

import com.survey.boothsampling.dto.MapFileDTO;
import com.survey.boothsampling.dto.RegionDTO;
import com.survey.boothsampling.dto.RegionMapDTO;
import com.survey.boothsampling.dto.RegionSummaryRow;
import com.survey.boothsampling.dto.SamplingRequest;
import com.survey.boothsampling.dto.SamplingRunResponse;
import com.survey.boothsampling.dto.SelectedBoothRecord;
import com.survey.boothsampling.engine.ClusterCountAllocator;
import com.survey.boothsampling.model.Region;
import com.survey.boothsampling.model.SamplingRun;
import com.survey.boothsampling.model.SelectionType;
import com.survey.boothsampling.service.SamplingReportService;
import com.survey.boothsampling.service.SamplingRunStore;
import com.survey.boothsampling.service.SamplingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sampling")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class SamplingController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");
    private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final SamplingService samplingService;
    private final SamplingReportService reportService;
    private final SamplingRunStore runStore;
    private final ClusterCountAllocator allocator;

    @GetMapping("/states")
    public ResponseEntity<Map<String, List<String>>> getStates() {
        log.info("Fetching available states");
        return ResponseEntity.ok(Map.of("states", samplingService.getAvailableStates()));
    }

    @GetMapping("/regions/{state}/{selectionType}")
    public ResponseEntity<RegionDTO.Listing> getRegions(@PathVariable String state,
                                                        @PathVariable String selectionType) {
        log.info("Fetching {} regions for {}", selectionType, state);
        List<Region> regions = samplingService.getRegions(state, SelectionType.fromValue(selectionType));
        List<RegionDTO> dtos = regions.stream()
                .map(region -> new RegionDTO(region.getCode(), region.getName()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new RegionDTO.Listing(dtos, dtos.size()));
    }

    /**
     * Sample every region of a state. The finished run replaces the previous one for the
     * result endpoints below.
     *
     * @param request state, selection type and samples per region
     * @return run statistics
     */
    @PostMapping("/runs")
    public ResponseEntity<SamplingRunResponse> runSampling(@Valid @RequestBody SamplingRequest request) {
        log.info("Received sampling request for {} ({}), {} samples per region",
                request.getState(), request.getSelectionType(), request.getSamplesPerRegion());

        SamplingRun run = samplingService.runBatch(request);
        runStore.save(run);

        String plural = run.getSelectionType().getLabel() + "s";
        SamplingRunResponse response = SamplingRunResponse.builder()
                .status("success")
                .runId(run.getRunId())
                .state(run.getState())
                .selectionType(run.getSelectionType().getLabel())
                .samplesPerRegion(run.getSamplesPerRegion())
                .clustersPerRegion(run.getClustersPerRegion())
                .boothsPerRegion(allocator.targetSelected(run.getClustersPerRegion()))
                .totalRegions(run.getOutcomes().size())
                .completed(run.getCompletedCount())
                .totalBooths(run.getTotalBooths())
                .totalSelected(run.getTotalSelected())
                .message(String.format("Processing complete! Processed %d %s", run.getOutcomes().size(), plural))
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/runs/latest/summary")
    public ResponseEntity<Map<String, List<RegionSummaryRow>>> getSummary() {
        return ResponseEntity.ok(Map.of("data", reportService.buildSummary(runStore.getLatest())));
    }

    @GetMapping("/runs/latest/selected-booths")
    public ResponseEntity<Map<String, List<SelectedBoothRecord>>> getSelectedBooths() {
        return ResponseEntity.ok(Map.of("data", reportService.buildSelectedBooths(runStore.getLatest())));
    }

    @GetMapping("/runs/latest/regions/{code}/map")
    public ResponseEntity<RegionMapDTO> getRegionMap(@PathVariable String code) {
        log.info("Fetching map payload for region {}", code);
        return ResponseEntity.ok(reportService.buildRegionMap(runStore.getLatest(), code));
    }

    @GetMapping("/runs/latest/maps")
    public ResponseEntity<Map<String, List<MapFileDTO>>> getAvailableMaps() {
        return ResponseEntity.ok(Map.of("maps", reportService.listMaps(runStore.getLatest())));
    }

    @GetMapping("/runs/latest/maps.zip")
    public ResponseEntity<byte[]> downloadMaps() {
        byte[] archive = reportService.mapsZip(runStore.getLatest());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=maps.zip")
                .contentType(APPLICATION_ZIP)
                .body(archive);
    }

    @GetMapping("/runs/latest/summary.csv")
    public ResponseEntity<String> downloadSummary() {
        return csv("summary.csv", reportService.summaryCsv(runStore.getLatest()));
    }

    @GetMapping("/runs/latest/selected-booths.csv")
    public ResponseEntity<String> downloadSelectedBooths() {
        return csv("selected_booths.csv", reportService.selectedBoothsCsv(runStore.getLatest()));
    }

    private ResponseEntity<String> csv(String fileName, String body) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + fileName)
                .contentType(TEXT_CSV)
                .body(body);
    }
}
