package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.exception.ValidationException;
import com.novoflow.novoflow_backend.model.definition.DataTypes;
import com.novoflow.novoflow_backend.model.definition.HandleDefinition;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.definition.spec.FileCheckSpec;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineEdge;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes upstream results into a node's input handles.
 *
 * For each input handle the producer's result_metadata is searched in this order:
 *   1. a descriptor tagged for the data type (file_info / output_file for *_file types;
 *      a file_check producer that never ran is described from its config)
 *   2. the conventional field for the data type (output_file, sequence, message)
 *   3. the whole result_metadata for "any"
 *   4. output_file, sequence, message, data, then the whole non-empty blob
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataFlowResolver {

    private final NodeDefinitionRegistry registry;
    private final EngineProperties       properties;

    public Object getInputData(String nodeId, String handleId, HandleDefinition handle, Pipeline pipeline) {
        Optional<PipelineEdge> edge = pipeline.getEdges().stream()
                .filter(e -> e.feeds(nodeId, handleId))
                .findFirst();
        if (edge.isEmpty()) return null;

        PipelineNode source = pipeline.findNode(edge.get().getSource()).orElse(null);
        if (source == null) {
            log.warn("Edge {} into {} references missing node {}", edge.get().getId(), nodeId, edge.get().getSource());
            return null;
        }

        NodeDefinition sourceDefinition = registry.loadNodeConfig(source.getType());
        String dataType = handle != null ? handle.getDataType() : null;
        Map<String, Object> result = source.getResultMetadata();

        // 1. tagged descriptor
        if (sourceDefinition.getExecution() instanceof FileCheckSpec fileCheck
                && (DataTypes.isFileType(dataType) || dataType == null || dataType.isBlank())) {
            if (result != null && Values.isPresent(result.get("file_info"))) return result.get("file_info");
            if (result != null && Values.isPresent(result.get("data"))) return result.get("data");
            return FileDescriptors.fromConfig(source.getConfig(), fileCheck.getDescriptorType(), properties.getPublicBaseUrl());
        }

        // 2. conventional field
        if (DataTypes.isFileType(dataType) && result != null) {
            if (Values.isPresent(result.get("file_info"))) return result.get("file_info");
            if (Values.isPresent(result.get("output_file"))) return result.get("output_file");
        }
        if (DataTypes.SEQUENCE.equals(dataType) && result != null && Values.isPresent(result.get("sequence"))) {
            return result.get("sequence");
        }
        if (DataTypes.MESSAGE.equals(dataType)) {
            Object message = Values.firstPresent(
                    result != null ? result.get("message") : null,
                    source.configValue("message"));
            if (message != null) return message;
        }

        // 3. wildcard
        if (DataTypes.ANY.equals(dataType) && source.hasResult()) {
            return result;
        }

        // 4. legacy
        if (result != null) {
            Object legacy = Values.firstPresent(
                    result.get("output_file"), result.get("sequence"), result.get("message"), result.get("data"));
            if (legacy != null) return legacy;
            return result.isEmpty() ? null : result;
        }
        return null;
    }

    /** {handleId: value} over every declared input handle, leaving out handles with nothing upstream. */
    public Map<String, Object> getAllInputData(PipelineNode node, NodeDefinition definition, Pipeline pipeline) {
        Map<String, Object> inputData = new LinkedHashMap<>();
        for (HandleDefinition handle : inputHandles(definition)) {
            Object value = getInputData(node.getId(), handle.getId(), handle, pipeline);
            if (value != null) {
                inputData.put(handle.getId(), value);
            }
        }
        return inputData;
    }

    public void validateInputs(PipelineNode node, NodeDefinition definition, Map<String, Object> inputData) {
        if (definition.getExecution() != null && definition.getExecution().resolveInputsOptional()) return;

        for (HandleDefinition handle : inputHandles(definition)) {
            if (handle.hasConcreteType() && Values.isEmpty(inputData.get(handle.getId()))) {
                throw new ValidationException("Required input '" + handle.getId() + "' (" + handle.getDataType()
                        + ") not found for node " + displayName(node));
            }
        }
    }

    private List<HandleDefinition> inputHandles(NodeDefinition definition) {
        if (definition.getHandles() == null || definition.getHandles().getInputs() == null) return List.of();
        return definition.getHandles().getInputs();
    }

    static String displayName(PipelineNode node) {
        return node.getLabel() != null && !node.getLabel().isBlank() ? node.getLabel() : node.getId();
    }
}
