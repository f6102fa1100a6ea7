package com.novoflow.novoflow_backend.exception;

public class NodeDefinitionNotFoundException extends PipelineException {

    public NodeDefinitionNotFoundException(String nodeType) {
        super("No node definition found for type: " + nodeType);
    }
}
