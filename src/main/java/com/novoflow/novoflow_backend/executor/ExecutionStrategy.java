package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.model.definition.spec.ExecutionSpec;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;

public interface ExecutionStrategy<S extends ExecutionSpec> {

    Class<S> supportedType();

    // Runs one node; failures surface as PipelineException subclasses
    NodeExecutionResult execute(S spec, ExecutionContext context);
}
