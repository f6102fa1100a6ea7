package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.exception.NodeDefinitionNotFoundException;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.exception.RunInProgressException;
import com.novoflow.novoflow_backend.exception.SavedPipelineNotFoundException;
import com.novoflow.novoflow_backend.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Error bodies are {"error": CODE, "message": text}, plus "details" for validation failures.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.debug("Validation failed: {}", ex.getErrors());
        return ResponseEntity.badRequest().body(Map.of(
                "error", "VALIDATION_ERROR",
                "message", ex.getMessage(),
                "details", ex.getErrors()
        ));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
        return error(HttpStatus.BAD_REQUEST, "CONFIGURATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler({NodeDefinitionNotFoundException.class, NodeNotFoundException.class,
            SavedPipelineNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(PipelineException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(RunInProgressException ex) {
        return error(HttpStatus.CONFLICT, "RUN_IN_PROGRESS", ex.getMessage());
    }

    // "No pipeline loaded" and other engine refusals
    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipeline(PipelineException ex) {
        return error(HttpStatus.CONFLICT, "PIPELINE_ERROR", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", code,
                "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
