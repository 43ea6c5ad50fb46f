package com.motionindex.config;

import com.motionindex.processing.batch.BatchTooLargeException;
import com.motionindex.processing.queue.QueueFullException;
import com.motionindex.shared.exception.BatchValidationException;
import com.motionindex.shared.exception.CapacityExceededException;
import com.motionindex.shared.exception.JobNotFoundException;
import com.motionindex.shared.exception.JobNotReadyException;
import com.motionindex.util.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotFound(JobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "JobNotFound", ex.getMessage());
    }

    @ExceptionHandler(JobNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleJobNotReady(JobNotReadyException ex) {
        Map<String, Object> response = body("JobNotReady", ex.getMessage());
        response.put("status", ex.getStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(BatchTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleBatchTooLarge(BatchTooLargeException ex) {
        Map<String, Object> response = body("BatchTooLarge", ex.getMessage());
        response.put("limit", ex.getLimit());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(response);
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<Map<String, Object>> handleQueueFull(QueueFullException ex) {
        Map<String, Object> response = body("QueueFull", ex.getMessage());
        response.put("queue", ex.getQueueName());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(response);
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<Map<String, Object>> handleCapacityExceeded(CapacityExceededException ex) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, "CapacityExceeded", ex.getMessage());
    }

    @ExceptionHandler(BatchValidationException.class)
    public ResponseEntity<Map<String, Object>> handleBatchValidation(BatchValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "ValidationError", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body("ValidationError", "Validation failed");
        response.put("errors", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSizeException(MaxUploadSizeExceededException ex) {
        return respond(HttpStatus.BAD_REQUEST, "FileSizeExceeded", "File size exceeds the maximum allowed upload size");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "IllegalArgument", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(body(error, message));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        response.put("traceId", MDC.get(CorrelationIdFilter.REQUEST_ID_MDC_KEY));
        return response;
    }
}
