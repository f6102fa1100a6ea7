package com.novoflow.novoflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PipelineStatus {
    DRAFT,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PipelineStatus fromWireName(String value) {
        if (value == null || value.isBlank()) return DRAFT;
        return PipelineStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
