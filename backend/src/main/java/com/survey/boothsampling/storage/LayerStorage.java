package com.survey.boothsampling.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Where state layers live. Implementations only locate bytes, parsing happens elsewhere.
 */
public interface LayerStorage {

    /**
     * @return state names with at least a folder in the store, sorted
     * @throws com.survey.boothsampling.exception.LayerStorageException if the store cannot be listed
     */
    List<String> listStates();

    /**
     * Opens the GeoJSON document of one layer. The caller closes the stream.
     *
     * @throws com.survey.boothsampling.exception.LayerNotFoundException if the layer does not exist
     * @throws IOException if the layer exists but cannot be read
     */
    InputStream openLayer(String state, LayerKind kind) throws IOException;

    /**
     * Human readable location used in log messages
     */
    String describe();
}
