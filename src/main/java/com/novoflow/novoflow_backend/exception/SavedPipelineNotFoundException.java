package com.novoflow.novoflow_backend.exception;

import java.util.UUID;

public class SavedPipelineNotFoundException extends PipelineException {

    public SavedPipelineNotFoundException(UUID id) {
        super("Saved pipeline not found: " + id);
    }
}
