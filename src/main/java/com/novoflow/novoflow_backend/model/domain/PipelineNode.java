package com.novoflow.novoflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineNode {

    private String id;

    // Node type key, e.g. "input_node"; selects the node definition document
    private String type;

    private String label;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    private NodeStatus status = NodeStatus.IDLE;

    // Normalised output of the last successful execution; read by downstream nodes
    @JsonProperty("result_metadata")
    private Map<String, Object> resultMetadata;

    private String error;

    // Canvas position, carried through untouched
    private Map<String, Object> position;

    @JsonIgnore
    public boolean hasResult() {
        return resultMetadata != null && !resultMetadata.isEmpty();
    }

    @JsonIgnore
    public Object configValue(String key) {
        return config != null ? config.get(key) : null;
    }
}
