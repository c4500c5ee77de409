package com.survey.boothsampling.exception;

/**
 * Exception thrown when a layer file cannot be parsed into features
 */
public class LayerFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayerFormatException(String message) {
        super(message);
    }

    public LayerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
