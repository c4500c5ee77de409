package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Everything one batch produced. Owned by the caller, the engine keeps no reference to it.
 */
@Value
@Builder
@AllArgsConstructor
public class SamplingRun {
    String runId;
    LocalDateTime startedAt;
    String state;
    SelectionType selectionType;
    int samplesPerRegion;
    int clustersPerRegion;
    List<RegionOutcome> outcomes;

    public long getCompletedCount() {
        return outcomes.stream().filter(o -> o.getResult().isComplete()).count();
    }

    public long getTotalBooths() {
        return outcomes.stream().mapToLong(o -> o.getResult().getTotalBooths()).sum();
    }

    public long getTotalSelected() {
        return outcomes.stream().mapToLong(o -> o.getResult().getSelectedCount()).sum();
    }

    public Optional<RegionOutcome> findRegion(String code) {
        return outcomes.stream()
                .filter(o -> o.getRegion().getCode().equals(code))
                .findFirst();
    }
}
