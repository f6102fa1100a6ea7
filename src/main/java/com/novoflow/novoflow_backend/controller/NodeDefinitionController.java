package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/nodes")
@RequiredArgsConstructor
public class NodeDefinitionController {

    private final NodeDefinitionRegistry registry;

    /** Palette for the canvas: every built-in type keyed by its type name. */
    @GetMapping
    public Map<String, NodeDefinition> listDefinitions() {
        return registry.loadAllNodeConfigs();
    }

    @GetMapping("/{type}")
    public NodeDefinition getDefinition(@PathVariable String type) {
        return registry.loadNodeConfig(type);
    }

    @GetMapping("/{type}/default-config")
    public Map<String, Object> getDefaultConfig(@PathVariable String type) {
        return registry.getDefaultNodeConfig(type);
    }
}
