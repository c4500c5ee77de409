package com.survey.boothsampling.exception;

/**
 * Exception thrown when a state's boundary or booth layer cannot be found
 */
public class LayerNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayerNotFoundException(String message) {
        super(message);
    }

    public LayerNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
