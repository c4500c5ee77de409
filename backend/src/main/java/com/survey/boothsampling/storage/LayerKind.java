package com.survey.boothsampling.storage;

import com.survey.boothsampling.model.SelectionType;

/**
 * The three layers kept for every state
 */
public enum LayerKind {
    ASSEMBLY("assembly"),
    PARLIAMENTARY("parliamentary"),
    BOOTH("booth");

    private final String fileToken;

    LayerKind(String fileToken) {
        this.fileToken = fileToken;
    }

    /**
     * Token that appears in the layer's file name, e.g. {@code Goa.assembly.geojson}
     */
    public String getFileToken() {
        return fileToken;
    }

    public static LayerKind boundariesFor(SelectionType selectionType) {
        return selectionType == SelectionType.ASSEMBLY ? ASSEMBLY : PARLIAMENTARY;
    }
}
