package com.novoflow.novoflow_backend.exception;

public class NodeNotFoundException extends PipelineException {

    public NodeNotFoundException(String nodeId) {
        super("Node not found in pipeline: " + nodeId);
    }
}
