package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.model.domain.PipelineNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The three roots a {{path}} placeholder can start from.
 *
 * <pre>
 *   input.&lt;handleId&gt;...   resolved upstream data, keyed by input handle
 *   config.&lt;field&gt;...     the node's own config
 *   node.id|type|label|status
 * </pre>
 */
public record TemplateContext(Map<String, Object> input, Map<String, Object> config, Map<String, Object> node) {

    public static TemplateContext of(PipelineNode node, Map<String, Object> inputData) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (node != null) {
            meta.put("id", node.getId());
            meta.put("type", node.getType());
            meta.put("label", node.getLabel());
            meta.put("status", node.getStatus() != null ? node.getStatus().wireName() : null);
        }
        return new TemplateContext(
                inputData != null ? inputData : Map.of(),
                node != null && node.getConfig() != null ? node.getConfig() : Map.of(),
                meta);
    }

    Object root(String name) {
        return switch (name) {
            case "input"  -> input;
            case "config" -> config;
            case "node"   -> node;
            default       -> null;
        };
    }
}
