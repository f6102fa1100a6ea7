package com.novoflow.novoflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineEdge {

    private String id;

    private String source;

    private String target;

    private String sourceHandle;

    // Null on graphs saved before handles existed: the edge then feeds every input of the target
    private String targetHandle;

    public boolean feeds(String nodeId, String handleId) {
        if (target == null || !target.equals(nodeId)) return false;
        return targetHandle == null || targetHandle.isBlank() || targetHandle.equals(handleId);
    }
}
