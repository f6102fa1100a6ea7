package com.novoflow.novoflow_backend.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;

import java.util.List;

/** Whole-store state: the graph, the current (or last) execution and the run history, newest first. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreSnapshot(Pipeline pipeline, ExecutionSession currentExecution, List<ExecutionSession> history) {

    public StoreSnapshot {
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static StoreSnapshot empty() {
        return new StoreSnapshot(null, null, List.of());
    }
}
