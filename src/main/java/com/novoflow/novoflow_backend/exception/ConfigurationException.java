package com.novoflow.novoflow_backend.exception;

/** A node type or node config that cannot be executed as written (unknown strategy, missing endpoint, ...). */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
