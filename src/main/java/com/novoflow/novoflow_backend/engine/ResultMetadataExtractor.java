package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.executor.FileDescriptors;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.HandleDefinition;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.definition.spec.FileCheckSpec;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw strategy result into the result_metadata stored on the node.
 *
 * Downstream nodes read result_metadata by convention (output_file, sequence, message, data),
 * so this is where service-shaped responses are lifted into those names.
 */
@Component
@RequiredArgsConstructor
public class ResultMetadataExtractor {

    private final EngineProperties properties;

    public Map<String, Object> extract(PipelineNode node, NodeDefinition definition, NodeExecutionResult raw) {
        Object result = raw != null ? raw.data() : null;
        if (result == null) return new LinkedHashMap<>();

        Map<String, Object> resultMap = Values.asMap(result);
        if (resultMap == null) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("value", Values.deepCopy(result));
            return wrapped;
        }

        if (definition != null && definition.getExecution() instanceof FileCheckSpec) {
            return fileCheckMetadata(resultMap);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        Object outputFile = Values.firstPresent(resultMap.get("output_file"), resultMap.get("file"));
        if (outputFile != null) metadata.put("output_file", Values.deepCopy(outputFile));
        if (Values.isPresent(resultMap.get("sequence"))) metadata.put("sequence", Values.deepCopy(resultMap.get("sequence")));
        if (Values.isPresent(resultMap.get("message")))  metadata.put("message", Values.deepCopy(resultMap.get("message")));
        if (Values.isPresent(resultMap.get("data")))     metadata.put("data", Values.deepCopy(resultMap.get("data")));

        fileOutputHandle(definition).ifPresent(handle -> {
            Map<String, Object> descriptor = synthesiseFileDescriptor(handle, resultMap);
            if (descriptor != null) metadata.put("output_file", descriptor);
        });

        return metadata.isEmpty() ? Values.deepCopy(resultMap) : metadata;
    }

    private Map<String, Object> fileCheckMetadata(Map<String, Object> descriptor) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_info", Values.deepCopy(descriptor));
        for (String key : new String[]{"type", "filename", "file_id", "file_url"}) {
            if (descriptor.get(key) != null) metadata.put(key, descriptor.get(key));
        }
        metadata.put("data", Values.deepCopy(descriptor));
        return metadata;
    }

    private Optional<HandleDefinition> fileOutputHandle(NodeDefinition definition) {
        if (definition == null || definition.getHandles() == null) return Optional.empty();
        return definition.getHandles().firstFileOutput();
    }

    // {filepath: "/jobs/42/design_0.pdb"} becomes a descriptor another node can take as a file input
    private Map<String, Object> synthesiseFileDescriptor(HandleDefinition handle, Map<String, Object> result) {
        Object filepath = result.get("filepath");
        if (Values.isEmpty(filepath)) {
            Map<String, Object> nested = Values.asMap(result.get("data"));
            filepath = nested != null ? nested.get("filepath") : null;
        }
        if (Values.isEmpty(filepath)) return null;

        String path = String.valueOf(filepath);
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("type", handle.getDataType());
        descriptor.put("filename", fileName(path));
        descriptor.put("filepath", path);
        descriptor.put("file_url", FileDescriptors.sanitizeFileUrl(path, null, properties.getPublicBaseUrl()));
        return descriptor;
    }

    private String fileName(String path) {
        try {
            return Paths.get(path).getFileName().toString();
        } catch (RuntimeException e) {
            int slash = path.lastIndexOf('/');
            return slash >= 0 ? path.substring(slash + 1) : path;
        }
    }
}
