package com.novoflow.novoflow_backend.exception;

import java.util.List;

/** Missing required input handle, missing required config field, or a malformed graph. */
public class ValidationException extends PipelineException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
