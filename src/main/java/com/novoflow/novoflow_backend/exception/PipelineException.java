package com.novoflow.novoflow_backend.exception;

/** Base for every node-scoped or pipeline-scoped failure raised by the engine. */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
