package com.survey.boothsampling.exception;

/**
 * Exception thrown for invalid business input that is not a bean validation failure
 */
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
