package com.novoflow.novoflow_backend.exception;

import java.util.List;

public class CyclicPipelineException extends ValidationException {

    private final List<String> cycleNodeIds;

    public CyclicPipelineException(List<String> cycleNodeIds) {
        super("Pipeline contains a cycle through nodes " + cycleNodeIds
                + ". Remove one of the connections between them to run the pipeline.");
        this.cycleNodeIds = List.copyOf(cycleNodeIds);
    }

    public List<String> getCycleNodeIds() {
        return cycleNodeIds;
    }
}
