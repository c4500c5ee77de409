package com.survey.boothsampling.exception;

/**
 * Exception thrown when a coordinate reference system is missing or unknown to the transform library
 */
public class CoordinateReferenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CoordinateReferenceException(String message) {
        super(message);
    }

    public CoordinateReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
