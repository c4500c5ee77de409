package com.survey.boothsampling.exception;

/**
 * Exception thrown when a whole sampling run cannot proceed, e.g. no region can be matched
 */
public class BatchProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BatchProcessingException(String message) {
        super(message);
    }

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
