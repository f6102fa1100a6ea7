package com.novoflow.novoflow_backend.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation for one run; checked between nodes, never inside one. */
public class RunHandle {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
