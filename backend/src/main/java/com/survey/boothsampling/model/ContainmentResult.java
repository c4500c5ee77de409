package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Booths that passed containment validation against one region boundary
 */
@Value
@Builder
@AllArgsConstructor
public class ContainmentResult {
    List<Booth> validBooths;
    boolean regionFound;
    ReferenceCheck referenceCheck;

    public static ContainmentResult regionMissing(ReferenceCheck referenceCheck) {
        return new ContainmentResult(Collections.emptyList(), false, referenceCheck);
    }

    public boolean isEmpty() {
        return validBooths.isEmpty();
    }
}
