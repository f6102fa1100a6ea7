package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    IDLE,
    PENDING,
    RUNNING,
    COMPLETED,
    SUCCESS,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeStatus fromWireName(String value) {
        if (value == null || value.isBlank()) return IDLE;
        return NodeStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** completed and success both mean the node produced its result. */
    public boolean isDone() {
        return this == COMPLETED || this == SUCCESS;
    }

    public boolean isWaiting() {
        return this == IDLE || this == PENDING;
    }

    /**
     * Forward-only lifecycle within a run: idle/pending -> running -> completed|success|error.
     * Re-asserting the current status is always allowed.
     */
    public boolean canTransitionTo(NodeStatus next) {
        if (next == null) return false;
        if (next == this) return true;
        return switch (this) {
            case IDLE, PENDING -> next == RUNNING || next.isWaiting();
            case RUNNING       -> next == COMPLETED || next == SUCCESS || next == ERROR;
            default            -> false;
        };
    }
}
