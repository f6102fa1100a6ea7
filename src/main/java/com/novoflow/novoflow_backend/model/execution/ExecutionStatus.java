package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromWireName(String value) {
        return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
