package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionLogEntry {
    private String nodeId;
    private String nodeLabel;
    private String nodeType;
    private NodeStatus status;
    private Instant startedAt;
    private Instant completedAt;

    // milliseconds
    private Long duration;

    private Map<String, Object> input;
    private Object output;
    private RequestEnvelope request;
    private ResponseEnvelope response;
    private String error;
}
