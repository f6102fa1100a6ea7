package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Outcome of one strategy invocation: the produced data plus what was sent and received. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeExecutionResult(Object data, RequestEnvelope request, ResponseEnvelope response) {

    public static NodeExecutionResult of(Object data) {
        return new NodeExecutionResult(data, null, null);
    }
}
