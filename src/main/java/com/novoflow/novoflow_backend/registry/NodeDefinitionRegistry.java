package com.novoflow.novoflow_backend.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.exception.NodeDefinitionNotFoundException;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.definition.NodeMetadata;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads node definitions from {@code <novoflow.nodes.location>/<type>/node.json} and caches them per type.
 */
@Slf4j
@Component
public class NodeDefinitionRegistry {

    public static final List<String> BUILTIN_TYPES = List.of(
            "input_node",
            "message_input_node",
            "http_request_node",
            "code_execution_node",
            "rfdiffusion_node",
            "proteinmpnn_node",
            "alphafold_node"
    );

    // Type keys double as directory names, so nothing that could walk out of the nodes directory
    private static final Pattern TYPE_KEY = Pattern.compile("[a-z0-9_]+");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper   objectMapper;
    private final String         location;

    private final Map<String, NodeDefinition> cache = new ConcurrentHashMap<>();

    public NodeDefinitionRegistry(ResourceLoader resourceLoader, ObjectMapper objectMapper, EngineProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        String configured = properties.getNodes().getLocation();
        this.location = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
    }

    public NodeDefinition loadNodeConfig(String nodeType) {
        if (nodeType == null || !TYPE_KEY.matcher(nodeType).matches()) {
            throw new NodeDefinitionNotFoundException(nodeType);
        }
        NodeDefinition cached = cache.get(nodeType);
        if (cached != null) return cached;

        NodeDefinition loaded = read(nodeType);
        validate(loaded, nodeType);
        NodeDefinition raced = cache.putIfAbsent(nodeType, loaded);
        return raced != null ? raced : loaded;
    }

    /** A private copy of the type's defaultConfig; callers may mutate it freely. */
    public Map<String, Object> getDefaultNodeConfig(String nodeType) {
        Map<String, Object> defaults = loadNodeConfig(nodeType).getDefaultConfig();
        return defaults != null ? Values.deepCopy(defaults) : new LinkedHashMap<>();
    }

    public NodeMetadata getNodeMetadata(String nodeType) {
        return loadNodeConfig(nodeType).getMetadata();
    }

    public Map<String, NodeDefinition> loadAllNodeConfigs() {
        Map<String, NodeDefinition> all = new LinkedHashMap<>();
        BUILTIN_TYPES.forEach(type -> all.put(type, loadNodeConfig(type)));
        return all;
    }

    /** New idle node whose config is seeded from the type's defaults. */
    public PipelineNode createNode(String nodeType, String label) {
        NodeDefinition definition = loadNodeConfig(nodeType);
        String resolvedLabel = label != null && !label.isBlank() ? label : definition.getMetadata().getLabel();
        return PipelineNode.builder()
                .id(nodeType + "_" + UUID.randomUUID().toString().substring(0, 8))
                .type(nodeType)
                .label(resolvedLabel)
                .config(getDefaultNodeConfig(nodeType))
                .status(NodeStatus.IDLE)
                .build();
    }

    private NodeDefinition read(String nodeType) {
        Resource resource = resourceLoader.getResource(location + "/" + nodeType + "/node.json");
        if (!resource.exists()) {
            throw new NodeDefinitionNotFoundException(nodeType);
        }
        try (InputStream in = resource.getInputStream()) {
            NodeDefinition definition = objectMapper.readValue(in, NodeDefinition.class);
            log.debug("Loaded node definition {} from {}", nodeType, resource.getDescription());
            return definition;
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to load node config for " + nodeType + ": " + ex.getMessage(), ex);
        }
    }

    private void validate(NodeDefinition definition, String expectedType) {
        if (definition.getMetadata() == null) {
            throw new ConfigurationException("Node config for " + expectedType + " is missing metadata");
        }
        if (!expectedType.equals(definition.getMetadata().getType())) {
            throw new ConfigurationException("Node config type mismatch: expected " + expectedType
                    + ", got " + definition.getMetadata().getType());
        }
        if (definition.getSchema() == null) {
            throw new ConfigurationException("Node config for " + expectedType + " is missing schema");
        }
        if (definition.getHandles() == null) {
            throw new ConfigurationException("Node config for " + expectedType + " is missing handles");
        }
        if (definition.getExecution() == null) {
            throw new ConfigurationException("Node config for " + expectedType + " is missing execution config");
        }
        if (definition.getDefaultConfig() == null) {
            throw new ConfigurationException("Node config for " + expectedType + " is missing defaultConfig");
        }
    }
}
