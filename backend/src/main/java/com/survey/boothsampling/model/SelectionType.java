package com.survey.boothsampling.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Which kind of constituency a run samples within
 */
public enum SelectionType {
    ASSEMBLY("assembly", "AC", List.of("ac_no", "ac", "AC_NO", "AC")),
    PARLIAMENTARY("parliamentary", "PC", List.of("pc_no", "pc", "PC_NO", "PC"));

    private final String layerKind;
    private final String label;
    private final List<String> codeAliases;

    SelectionType(String layerKind, String label, List<String> codeAliases) {
        this.layerKind = layerKind;
        this.label = label;
        this.codeAliases = codeAliases;
    }

    public String getLayerKind() {
        return layerKind;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Region code columns tried, most preferred first, when matching booths to a region
     */
    public List<String> getCodeAliases() {
        return codeAliases;
    }

    /**
     * Accepts "AC", "PC", "assembly", "parliamentary", "AC wise", "PC wise" in any case.
     */
    @JsonCreator
    public static SelectionType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Selection type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(" wise", "").replace("_wise", "");
        for (SelectionType type : values()) {
            if (type.layerKind.equals(normalized)
                    || type.label.equalsIgnoreCase(normalized)
                    || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown selection type: " + value);
    }
}
