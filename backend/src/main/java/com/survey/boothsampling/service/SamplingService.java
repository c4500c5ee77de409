package com.survey.boothsampling.service;

import com.survey.boothsampling.dto.SamplingRequest;
import com.survey.boothsampling.engine.AlignedBooths;
import com.survey.boothsampling.engine.ClusterCountAllocator;
import com.survey.boothsampling.engine.ContainmentValidator;
import com.survey.boothsampling.engine.RegionSampler;
import com.survey.boothsampling.engine.SchemaResolver;
import com.survey.boothsampling.engine.SemanticField;
import com.survey.boothsampling.exception.BatchProcessingException;
import com.survey.boothsampling.exception.BusinessException;
import com.survey.boothsampling.model.BoothLayer;
import com.survey.boothsampling.model.CompletenessReason;
import com.survey.boothsampling.model.ContainmentResult;
import com.survey.boothsampling.model.LayerFeature;
import com.survey.boothsampling.model.Region;
import com.survey.boothsampling.model.RegionOutcome;
import com.survey.boothsampling.model.SamplingRun;
import com.survey.boothsampling.model.SelectionResult;
import com.survey.boothsampling.model.SelectionType;
import com.survey.boothsampling.model.SpatialLayer;
import com.survey.boothsampling.repository.LayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs the sampler over every region of a state. Regions share nothing, so they are fanned out
 * on a bounded pool and re-sorted by code once all of them are done.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SamplingService {

    private final LayerRepository layerRepository;
    private final SchemaResolver schemaResolver;
    private final ContainmentValidator containmentValidator;
    private final ClusterCountAllocator allocator;
    private final RegionSampler regionSampler;
    private final Executor samplingExecutor;

    @Value("${sampling.samples.min:25}")
    private int minSamples = 25;

    @Value("${sampling.samples.max:5000}")
    private int maxSamples = 5000;

    public List<String> getAvailableStates() {
        return layerRepository.listStates();
    }

    /**
     * Regions of a state sorted by code, empty when the layer has no recognizable code or name column
     */
    public List<Region> getRegions(String state, SelectionType selectionType) {
        if (state == null || state.isBlank()) {
            throw new BusinessException("State cannot be empty");
        }
        return listRegions(layerRepository.loadRegionLayer(state, selectionType), selectionType);
    }

    /**
     * Samples every region of the requested state.
     *
     * @throws BatchProcessingException when no region can be listed or matched, or the state has no booths
     * @throws com.survey.boothsampling.exception.LayerNotFoundException when a layer is missing
     */
    public SamplingRun runBatch(SamplingRequest request) {
        validate(request);
        String state = request.getState();
        SelectionType selectionType = request.getSelectionType();
        int samples = request.getSamplesPerRegion();

        log.info("Starting sampling run for {} ({}), {} samples per region", state, selectionType, samples);
        LocalDateTime startedAt = LocalDateTime.now();

        SpatialLayer regionLayer = layerRepository.loadRegionLayer(state, selectionType);
        BoothLayer boothLayer = layerRepository.loadBoothLayer(state);

        List<Region> regions = listRegions(regionLayer, selectionType);
        if (regions.isEmpty()) {
            throw new BatchProcessingException(String.format(
                    "Could not parse %s data for %s", selectionType.getLabel(), state));
        }
        String codeColumn = schemaResolver.resolve(regionLayer.getColumns(), selectionType.getCodeAliases())
                .orElseThrow(() -> new BatchProcessingException(String.format(
                        "Could not determine %s code column in %s, expected one of %s",
                        selectionType.getLabel(), regionLayer.getName(), selectionType.getCodeAliases())));
        if (boothLayer.isEmpty()) {
            throw new BatchProcessingException("Booth layer for " + state + " contains no booths");
        }

        AlignedBooths aligned = containmentValidator.align(boothLayer, regionLayer.getCrs());
        int clusters = allocator.clustersFor(samples);

        List<CompletableFuture<RegionOutcome>> futures = new ArrayList<>(regions.size());
        for (Region region : regions) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> sampleRegion(region, aligned, regionLayer, codeColumn, samples), samplingExecutor));
        }
        List<RegionOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparing((RegionOutcome outcome) -> outcome.getRegion().getCode(),
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());

        SamplingRun run = SamplingRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(startedAt)
                .state(state)
                .selectionType(selectionType)
                .samplesPerRegion(samples)
                .clustersPerRegion(clusters)
                .outcomes(outcomes)
                .build();

        log.info("Finished sampling run {} for {}: {}/{} regions complete, {} booths selected of {}",
                run.getRunId(), state, run.getCompletedCount(), outcomes.size(),
                run.getTotalSelected(), run.getTotalBooths());
        return run;
    }

    private RegionOutcome sampleRegion(Region region, AlignedBooths aligned, SpatialLayer regionLayer,
                                       String codeColumn, int samples) {
        SelectionResult result;
        try {
            ContainmentResult containment = containmentValidator.validate(
                    aligned, regionLayer, codeColumn, region.getCode());
            if (containment.isEmpty()) {
                result = regionSampler.noBooths(samples, containment.getReferenceCheck());
            } else {
                result = regionSampler.sample(containment.getValidBooths(), samples, containment.getReferenceCheck());
            }
        } catch (RuntimeException e) {
            log.error("Failed to sample region {} ({})", region.getCode(), region.getName(), e);
            result = failed(samples, aligned);
        }
        return new RegionOutcome(region, result);
    }

    private SelectionResult failed(int samples, AlignedBooths aligned) {
        return regionSampler.noBooths(samples, aligned.getReferenceCheck()).toBuilder()
                .reasonCode(CompletenessReason.REGION_FAILED)
                .build();
    }

    // Type-specific columns win over the generic ones so a layer carrying both AC and PC codes lists the right one
    private List<Region> listRegions(SpatialLayer regionLayer, SelectionType selectionType) {
        if (regionLayer == null || regionLayer.isEmpty()) {
            return List.of();
        }
        SemanticField typedName = selectionType == SelectionType.ASSEMBLY ? SemanticField.AC_NAME : SemanticField.PC_NAME;
        Optional<String> nameColumn = schemaResolver.resolve(regionLayer.getColumns(), typedName)
                .or(() -> schemaResolver.resolve(regionLayer.getColumns(), SemanticField.REGION_NAME));
        Optional<String> codeColumn = schemaResolver.resolve(regionLayer.getColumns(), selectionType.getCodeAliases())
                .or(() -> schemaResolver.resolve(regionLayer.getColumns(), SemanticField.REGION_CODE));
        if (nameColumn.isEmpty() || codeColumn.isEmpty()) {
            log.warn("Region layer {} has no code or name column (columns: {})",
                    regionLayer.getName(), regionLayer.getColumns());
            return List.of();
        }

        List<Region> regions = new ArrayList<>();
        for (LayerFeature feature : regionLayer.getFeatures()) {
            regions.add(new Region(feature.attributeAsString(codeColumn.get()),
                    feature.attributeAsString(nameColumn.get())));
        }
        regions.sort(Comparator.comparing(Region::getCode, Comparator.nullsLast(Comparator.naturalOrder())));
        return regions;
    }

    private void validate(SamplingRequest request) {
        if (request == null) {
            throw new BusinessException("Sampling request cannot be null");
        }
        if (request.getState() == null || request.getState().isBlank()) {
            throw new BusinessException("State cannot be empty");
        }
        if (request.getSelectionType() == null) {
            throw new BusinessException("Selection type cannot be null");
        }
        Integer samples = request.getSamplesPerRegion();
        if (samples == null || samples < minSamples || samples > maxSamples) {
            throw new BusinessException(String.format(
                    "Samples per region must be between %d and %d", minSamples, maxSamples));
        }
    }
}
