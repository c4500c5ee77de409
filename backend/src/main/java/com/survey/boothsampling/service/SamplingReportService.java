package com.survey.boothsampling.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.boothsampling.dto.MapFileDTO;
import com.survey.boothsampling.dto.RegionMapDTO;
import com.survey.boothsampling.dto.RegionSummaryRow;
import com.survey.boothsampling.dto.SelectedBoothRecord;
import com.survey.boothsampling.engine.SchemaResolver;
import com.survey.boothsampling.engine.SemanticField;
import com.survey.boothsampling.exception.BusinessException;
import com.survey.boothsampling.exception.ResourceNotFoundException;
import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.ClusteredBooth;
import com.survey.boothsampling.model.RegionOutcome;
import com.survey.boothsampling.model.SamplingRun;
import com.survey.boothsampling.model.SelectionResult;
import com.survey.boothsampling.util.CsvExporter;
import com.survey.boothsampling.util.GeoJSONConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Turns a finished run into the tables and map payloads consumed outside the engine
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SamplingReportService {

    private final SchemaResolver schemaResolver;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<RegionSummaryRow> buildSummary(SamplingRun run) {
        return run.getOutcomes().stream()
                .map(outcome -> toSummaryRow(outcome, run.getSamplesPerRegion()))
                .collect(Collectors.toList());
    }

    public List<SelectedBoothRecord> buildSelectedBooths(SamplingRun run) {
        List<SelectedBoothRecord> records = new ArrayList<>();
        for (RegionOutcome outcome : run.getOutcomes()) {
            for (ClusteredBooth selected : outcome.getResult().getSelectedBooths()) {
                records.add(toRecord(selected, run.getState()));
            }
        }
        return records;
    }

    public RegionMapDTO buildRegionMap(SamplingRun run, String regionCode) {
        RegionOutcome outcome = run.findRegion(regionCode)
                .orElseThrow(() -> new ResourceNotFoundException("Region " + regionCode + " is not part of the latest run"));
        SelectionResult result = outcome.getResult();
        return RegionMapDTO.builder()
                .code(outcome.getRegion().getCode())
                .name(outcome.getRegion().getName())
                .clusters(GeoJSONConverter.convertToClusters(result))
                .features(GeoJSONConverter.convertToGeoJSON(result))
                .build();
    }

    /**
     * Regions of the run that selected at least one booth, in run order
     */
    public List<MapFileDTO> listMaps(SamplingRun run) {
        return run.getOutcomes().stream()
                .filter(outcome -> !outcome.getResult().getSelectedBooths().isEmpty())
                .map(outcome -> new MapFileDTO(outcome.getRegion().getCode(), outcome.getRegion().getName(),
                        mapFileName(outcome)))
                .collect(Collectors.toList());
    }

    /**
     * Packs one GeoJSON FeatureCollection per mapped region into a ZIP archive
     *
     * @throws ResourceNotFoundException when no region selected any booth
     */
    public byte[] mapsZip(SamplingRun run) {
        List<RegionOutcome> mapped = run.getOutcomes().stream()
                .filter(outcome -> !outcome.getResult().getSelectedBooths().isEmpty())
                .collect(Collectors.toList());
        if (mapped.isEmpty()) {
            throw new ResourceNotFoundException("No maps available");
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (RegionOutcome outcome : mapped) {
                zip.putNextEntry(new ZipEntry(mapFileName(outcome)));
                zip.write(objectMapper.writeValueAsBytes(GeoJSONConverter.convertToGeoJSON(outcome.getResult())));
                zip.closeEntry();
            }
        } catch (IOException e) {
            log.error("Failed to package maps of run {}", run.getRunId(), e);
            throw new BusinessException("Unable to package maps", e);
        }
        log.info("Packaged {} region maps of run {}", mapped.size(), run.getRunId());
        return buffer.toByteArray();
    }

    public String summaryCsv(SamplingRun run) {
        return CsvExporter.summaryToCsv(buildSummary(run), run.getSelectionType());
    }

    public String selectedBoothsCsv(SamplingRun run) {
        return CsvExporter.selectedBoothsToCsv(buildSelectedBooths(run));
    }

    private RegionSummaryRow toSummaryRow(RegionOutcome outcome, int samplesRequested) {
        SelectionResult result = outcome.getResult();
        return RegionSummaryRow.builder()
                .code(outcome.getRegion().getCode())
                .name(outcome.getRegion().getName())
                .totalBooths(result.getTotalBooths())
                .selectedBooths(result.getSelectedCount())
                .status(result.isComplete() ? RegionSummaryRow.COMPLETED : RegionSummaryRow.NOT_COMPLETED)
                .reason(result.getReason())
                .reasonCode(result.getReasonCode().name())
                .referenceCheck(result.getReferenceCheck().name())
                .samplesRequested(samplesRequested)
                .build();
    }

    private SelectedBoothRecord toRecord(ClusteredBooth selected, String runState) {
        Booth booth = selected.getBooth();
        Map<String, Object> attributes = booth.getAttributes() != null ? booth.getAttributes() : Map.of();
        String state = value(attributes, SemanticField.STATE);
        return SelectedBoothRecord.builder()
                .state(state.isEmpty() ? runState : state)
                .district(value(attributes, SemanticField.DISTRICT))
                .districtName(value(attributes, SemanticField.DISTRICT_NAME))
                .pc(value(attributes, SemanticField.PC_CODE))
                .pcName(value(attributes, SemanticField.PC_NAME))
                .ac(value(attributes, SemanticField.AC_CODE))
                .acName(value(attributes, SemanticField.AC_NAME))
                .booth(value(attributes, SemanticField.BOOTH_CODE))
                .boothName(value(attributes, SemanticField.BOOTH_NAME))
                .cluster(selected.getClusterId())
                .latitude(booth.getLatitude())
                .longitude(booth.getLongitude())
                .build();
    }

    private static String mapFileName(RegionOutcome outcome) {
        String safeName = String.valueOf(outcome.getRegion().getName()).replace(' ', '_').replace('/', '_');
        return outcome.getRegion().getCode() + "_" + safeName + "_map.geojson";
    }

    private String value(Map<String, Object> attributes, SemanticField field) {
        return schemaResolver.resolve(attributes.keySet(), field)
                .map(attributes::get)
                .map(String::valueOf)
                .orElse("");
    }
}
