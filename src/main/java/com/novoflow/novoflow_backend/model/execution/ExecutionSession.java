package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One pipeline run. Stays readable as the current execution after it finishes
 * and is copied into the history list.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionSession {
    private String id;
    private String pipelineId;
    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.QUEUED;

    @Builder.Default
    private List<ExecutionLogEntry> logs = new ArrayList<>();

    public Optional<ExecutionLogEntry> findLog(String nodeId) {
        if (logs == null || nodeId == null) return Optional.empty();
        return logs.stream().filter(l -> nodeId.equals(l.getNodeId())).findFirst();
    }
}
