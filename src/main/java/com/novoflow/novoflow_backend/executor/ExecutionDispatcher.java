package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.definition.spec.ExecutionSpec;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs a single node: definition lookup, input gathering and validation, then exactly one strategy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionDispatcher {

    private final NodeDefinitionRegistry    registry;
    private final DataFlowResolver          dataFlowResolver;
    private final ExecutionStrategyRegistry strategies;

    public NodeExecutionResult executeNode(PipelineNode node, Pipeline pipeline) {
        NodeDefinition definition = registry.loadNodeConfig(node.getType());

        Map<String, Object> inputData = dataFlowResolver.getAllInputData(node, definition, pipeline);
        dataFlowResolver.validateInputs(node, definition, inputData);

        ExecutionSpec spec = definition.getExecution();
        if (spec == null || spec.getType() == null) {
            throw new ConfigurationException("Node " + DataFlowResolver.displayName(node) + " has invalid execution configuration");
        }

        log.debug("Dispatching node {} ({}) to {} with inputs {}", node.getId(), node.getType(), spec.getType(), inputData.keySet());
        return dispatch(spec, new ExecutionContext(node, definition, inputData, pipeline));
    }

    private <S extends ExecutionSpec> NodeExecutionResult dispatch(S spec, ExecutionContext context) {
        return strategies.get(spec).execute(spec, context);
    }
}
