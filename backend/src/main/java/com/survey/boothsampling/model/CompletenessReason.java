package com.survey.boothsampling.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of verdict reasons shown to users. The text is part of the public output.
 */
public enum CompletenessReason {
    COMPLETE(""),
    NO_BOOTHS_IN_BOUNDARY("no booths found within boundary"),
    INSUFFICIENT_BOOTHS("insufficient valid booths in region"),
    CLUSTER_COUNT_REDUCED("insufficient valid booths: cluster count reduced"),
    REGION_FAILED("region could not be processed");

    private final String text;

    CompletenessReason(String text) {
        this.text = text;
    }

    @JsonValue
    public String getText() {
        return text;
    }
}
