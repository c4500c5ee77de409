package com.survey.boothsampling.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ResourceNotFoundException.class, LayerNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, WebRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    /**
     * Batch-level failures: the run cannot start or cannot match any region
     */
    @ExceptionHandler(BatchProcessingException.class)
    public ResponseEntity<ErrorResponse> handleBatchFailure(BatchProcessingException ex, WebRequest request) {
        log.error("Sampling run failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Sampling Run Failed", ex.getMessage(), request);
    }

    /**
     * Layer files that exist but cannot be read as features, or name an unusable reference system
     */
    @ExceptionHandler({LayerFormatException.class, CoordinateReferenceException.class})
    public ResponseEntity<ErrorResponse> handleBadLayer(RuntimeException ex, WebRequest request) {
        log.error("Unusable layer data: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Layer Data", ex.getMessage(), request);
    }

    @ExceptionHandler(LayerStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageFailure(LayerStorageException ex, WebRequest request) {
        log.error("Layer store unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Layer Store Unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler({BusinessException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException ex, WebRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        log.debug("Unreadable request body", ex);
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Request body is malformed or contains an unknown selection type", request);
    }

    /**
     * Handle validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex, WebRequest request) {

        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        ValidationErrorResponse errorDetails = new ValidationErrorResponse(
                LocalDateTime.now(),
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                "Please correct the invalid input fields",
                request.getDescription(false),
                errors);

        return new ResponseEntity<>(errorDetails, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
        log.error("Unhandled exception occurred: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "System Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String title, String message, WebRequest request) {
        ErrorResponse errorDetails = new ErrorResponse(
                LocalDateTime.now(),
                status.value(),
                title,
                message,
                request.getDescription(false));
        return new ResponseEntity<>(errorDetails, status);
    }
}
