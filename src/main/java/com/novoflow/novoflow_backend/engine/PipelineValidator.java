package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.exception.NodeDefinitionNotFoundException;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.exception.ValidationException;
import com.novoflow.novoflow_backend.executor.ExecutionStrategyRegistry;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.FieldSchema;
import com.novoflow.novoflow_backend.model.definition.HandleDefinition;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.definition.spec.FileCheckSpec;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineEdge;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-run checks that need no execution: graph shape, node types, required config fields and
 * connected inputs. Upstream data cannot be known before a run, so inputs are only checked for
 * an incoming edge.
 */
@Component
@RequiredArgsConstructor
public class PipelineValidator {

    private final NodeDefinitionRegistry    registry;
    private final ExecutionStrategyRegistry strategies;
    private final TopologicalSorter         sorter;

    public ValidationResult validate(Pipeline pipeline) {
        List<String> errors = new ArrayList<>();

        Set<String> ids = new HashSet<>();
        for (PipelineNode node : pipeline.getNodes()) {
            if (node.getId() == null || node.getId().isBlank()) {
                errors.add("A node has no id");
            } else if (!ids.add(node.getId())) {
                errors.add("Duplicate node id: " + node.getId());
            }
        }

        for (PipelineEdge edge : pipeline.getEdges()) {
            if (!ids.contains(edge.getSource())) {
                errors.add("Edge " + edge.getId() + " starts at missing node " + edge.getSource());
            }
            if (!ids.contains(edge.getTarget())) {
                errors.add("Edge " + edge.getId() + " ends at missing node " + edge.getTarget());
            }
        }

        for (PipelineNode node : pipeline.getNodes()) {
            errors.addAll(validateNode(node, pipeline));
        }

        List<String> cycle = sorter.findCycleMembers(pipeline.getNodes(), pipeline.getEdges());
        if (!cycle.isEmpty()) {
            errors.add("Pipeline contains a cycle through nodes " + cycle);
        }

        return new ValidationResult(errors.isEmpty(), List.copyOf(errors));
    }

    public void validateOrThrow(Pipeline pipeline) {
        ValidationResult result = validate(pipeline);
        if (!result.valid()) {
            throw new ValidationException("Pipeline is not valid: " + String.join("; ", result.errors()), result.errors());
        }
    }

    private List<String> validateNode(PipelineNode node, Pipeline pipeline) {
        List<String> errors = new ArrayList<>();
        String name = node.getLabel() != null && !node.getLabel().isBlank() ? node.getLabel() : node.getId();

        NodeDefinition definition;
        try {
            definition = registry.loadNodeConfig(node.getType());
        } catch (NodeDefinitionNotFoundException ex) {
            errors.add("Node " + name + ": unknown node type " + node.getType());
            return errors;
        } catch (PipelineException ex) {
            errors.add("Node " + name + ": " + ex.getMessage());
            return errors;
        }

        if (!strategies.isSupported(definition.getExecution())) {
            errors.add("Node " + name + ": Unknown execution type: " + definition.getExecution().getType());
        }

        Map<String, FieldSchema> schema = definition.getSchema();
        schema.forEach((field, fieldSchema) -> {
            if (fieldSchema.isRequired() && Values.isEmpty(node.configValue(field))) {
                errors.add("Node " + name + ": required field '" + field + "' is missing");
            }
        });

        if (definition.getExecution() instanceof FileCheckSpec fileCheck) {
            String field = fileCheck.getIdentifierField();
            boolean alreadyReported = schema.containsKey(field) && schema.get(field).isRequired();
            if (!alreadyReported && Values.isEmpty(node.configValue(field))) {
                errors.add("Node " + name + ": required field '" + field + "' is missing");
            }
        }

        if (!definition.getExecution().resolveInputsOptional() && definition.getHandles().getInputs() != null) {
            for (HandleDefinition handle : definition.getHandles().getInputs()) {
                boolean connected = pipeline.getEdges().stream().anyMatch(e -> e.feeds(node.getId(), handle.getId()));
                if (handle.hasConcreteType() && !connected) {
                    errors.add("Node " + name + ": input '" + handle.getId() + "' (" + handle.getDataType() + ") is not connected");
                }
            }
        }
        return errors;
    }

    public record ValidationResult(boolean valid, List<String> errors) {}
}
