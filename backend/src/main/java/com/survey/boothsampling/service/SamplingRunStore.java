package com.survey.boothsampling.service;

import com.survey.boothsampling.exception.ResourceNotFoundException;
import com.survey.boothsampling.model.SamplingRun;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the most recent run for the result endpoints. Memory only, lost on restart.
 */
@Component
public class SamplingRunStore {

    private final AtomicReference<SamplingRun> latest = new AtomicReference<>();

    public void save(SamplingRun run) {
        latest.set(run);
    }

    public Optional<SamplingRun> findLatest() {
        return Optional.ofNullable(latest.get());
    }

    public SamplingRun getLatest() {
        return findLatest().orElseThrow(() -> new ResourceNotFoundException("No results available"));
    }
}
