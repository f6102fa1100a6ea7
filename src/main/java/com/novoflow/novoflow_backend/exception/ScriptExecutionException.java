package com.novoflow.novoflow_backend.exception;

/** Anything thrown inside a code_execution node's script, re-raised with the script's own message. */
public class ScriptExecutionException extends PipelineException {

    public ScriptExecutionException(String scriptMessage) {
        super("Code execution failed: " + (scriptMessage == null || scriptMessage.isBlank() ? "Unknown error" : scriptMessage));
    }
}
