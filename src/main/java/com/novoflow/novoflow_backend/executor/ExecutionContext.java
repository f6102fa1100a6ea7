package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;

import java.util.Map;

/** Everything a strategy may read while executing one node. */
public record ExecutionContext(
        PipelineNode node,
        NodeDefinition definition,
        Map<String, Object> inputData,
        Pipeline pipeline) {

    public TemplateContext templateContext() {
        return TemplateContext.of(node, inputData);
    }

    public Map<String, Object> config() {
        return node.getConfig() != null ? node.getConfig() : Map.of();
    }

    public Map<String, Object> defaultConfig() {
        return definition.getDefaultConfig() != null ? definition.getDefaultConfig() : Map.of();
    }

    public String nodeName() {
        return DataFlowResolver.displayName(node);
    }
}
