package com.novoflow.novoflow_backend.exception;

/** A run was requested, or the graph replaced, while another run still owns the store. */
public class RunInProgressException extends IllegalStateException {

    public RunInProgressException() {
        super("A pipeline run is already in progress. Stop it or wait for it to finish.");
    }
}
