package com.survey.boothsampling.exception;

/**
 * Exception thrown when the layer store itself cannot be reached or listed
 */
public class LayerStorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayerStorageException(String message) {
        super(message);
    }

    public LayerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
