package com.novoflow.novoflow_backend.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.novoflow.novoflow_backend.model.definition.spec.ExecutionSpec;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Declarative description of a node type, loaded from nodes/&lt;type&gt;/node.json.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeDefinition {

    private NodeMetadata metadata;

    private Map<String, FieldSchema> schema;

    private NodeHandles handles;

    private ExecutionSpec execution;

    private Map<String, Object> defaultConfig;
}
