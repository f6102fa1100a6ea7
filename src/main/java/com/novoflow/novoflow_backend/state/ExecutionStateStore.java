package com.novoflow.novoflow_backend.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.domain.PipelineStatus;
import com.novoflow.novoflow_backend.model.execution.ExecutionLogEntry;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Single source of truth for the loaded pipeline, its node states, the current execution and
 * the run history.
 *
 * State is published as an immutable {@link StoreSnapshot} through an AtomicReference. Writers
 * are serialised and work on a private deep copy which replaces the published state in one step,
 * so readers never see a half-applied update. Everything handed out is a copy.
 */
@Slf4j
@Component
public class ExecutionStateStore {

    private final ObjectMapper objectMapper;
    private final int          historyMaxSize;

    private final AtomicReference<StoreSnapshot> state = new AtomicReference<>(StoreSnapshot.empty());

    public ExecutionStateStore(ObjectMapper objectMapper, EngineProperties properties) {
        this.objectMapper = objectMapper;
        this.historyMaxSize = Math.max(1, properties.getHistory().getMaxSize());
    }

    // ── Whole-state access ────────────────────────────────────────────────────

    public StoreSnapshot snapshot() {
        return copy(state.get(), StoreSnapshot.class);
    }

    public synchronized void restore(StoreSnapshot snapshot) {
        state.set(copy(snapshot != null ? snapshot : StoreSnapshot.empty(), StoreSnapshot.class));
    }

    // ── Pipeline and nodes ────────────────────────────────────────────────────

    public synchronized void setPipeline(Pipeline pipeline) {
        StoreSnapshot current = state.get();
        state.set(new StoreSnapshot(copy(pipeline, Pipeline.class), current.currentExecution(), current.history()));
    }

    public Optional<Pipeline> getPipeline() {
        Pipeline pipeline = state.get().pipeline();
        return pipeline == null ? Optional.empty() : Optional.of(copy(pipeline, Pipeline.class));
    }

    public Pipeline requirePipeline() {
        return getPipeline().orElseThrow(() -> new PipelineException("No pipeline loaded"));
    }

    public Optional<PipelineNode> getNode(String nodeId) {
        Pipeline pipeline = state.get().pipeline();
        if (pipeline == null) return Optional.empty();
        return pipeline.findNode(nodeId).map(node -> copy(node, PipelineNode.class));
    }

    /** Applies a patch to one node. A patch that changes the status must respect the node lifecycle. */
    public void updateNode(String nodeId, Consumer<PipelineNode> patch) {
        mutatePipeline(pipeline -> {
            PipelineNode node = pipeline.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
            NodeStatus before = node.getStatus();
            patch.accept(node);
            checkTransition(nodeId, before, node.getStatus());
        });
    }

    public void updateNodeStatus(String nodeId, NodeStatus status) {
        updateNodeStatus(nodeId, status, null);
    }

    public void updateNodeStatus(String nodeId, NodeStatus status, String error) {
        mutatePipeline(pipeline -> {
            PipelineNode node = pipeline.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
            checkTransition(nodeId, node.getStatus(), status);
            node.setStatus(status);
            node.setError(status == NodeStatus.ERROR ? error : null);
        });
    }

    public void setPipelineStatus(PipelineStatus status) {
        mutatePipeline(pipeline -> {
            pipeline.setStatus(status);
            pipeline.setUpdatedAt(Instant.now());
        });
    }

    /** Start of a run: every node that has not produced its result waits again, errors cleared. */
    public void resetForRun() {
        mutatePipeline(pipeline -> pipeline.getNodes().forEach(node -> {
            if (!node.getStatus().isDone()) {
                node.setStatus(NodeStatus.PENDING);
                node.setError(null);
            }
        }));
    }

    /** Explicit re-run of one node: back to pending whatever it was, errors cleared, result kept. */
    public void resetNode(String nodeId) {
        mutatePipeline(pipeline -> {
            PipelineNode node = pipeline.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
            node.setStatus(NodeStatus.PENDING);
            node.setError(null);
        });
    }

    /**
     * End of a run: a waiting node that carries a result is completed, an errored node stays
     * errored, a node still marked running is completed if it has a result and errored otherwise.
     */
    public void reconcileNodeStatuses() {
        mutatePipeline(pipeline -> pipeline.getNodes().forEach(node -> {
            NodeStatus status = node.getStatus();
            if (status.isWaiting() && node.hasResult()) {
                node.setStatus(NodeStatus.COMPLETED);
            } else if (status == NodeStatus.RUNNING) {
                if (node.hasResult()) {
                    node.setStatus(NodeStatus.COMPLETED);
                } else {
                    node.setStatus(NodeStatus.ERROR);
                    if (node.getError() == null) node.setError("Node did not finish");
                }
            }
        }));
    }

    // ── Executions ────────────────────────────────────────────────────────────

    /** Replaces the current execution with a fresh running one. */
    public synchronized ExecutionSession startExecution(String pipelineId) {
        ExecutionSession execution = ExecutionSession.builder()
                .id(UUID.randomUUID().toString())
                .pipelineId(pipelineId)
                .startedAt(Instant.now())
                .status(ExecutionStatus.RUNNING)
                .logs(new ArrayList<>())
                .build();
        StoreSnapshot current = state.get();
        state.set(new StoreSnapshot(current.pipeline(), execution, current.history()));
        return copy(execution, ExecutionSession.class);
    }

    public void addExecutionLog(ExecutionLogEntry entry) {
        mutateExecution(execution -> execution.getLogs().add(copy(entry, ExecutionLogEntry.class)));
    }

    /** Patches the log entry of the given node, or does nothing when the node has none. */
    public void updateExecutionLog(String nodeId, Consumer<ExecutionLogEntry> patch) {
        mutateExecution(execution -> execution.findLog(nodeId).ifPresentOrElse(patch,
                () -> log.debug("No log entry for node {} in execution {}", nodeId, execution.getId())));
    }

    /**
     * Marks the current execution finished and prepends a copy to the history.
     * The execution stays readable as the current one.
     */
    public synchronized ExecutionSession finishExecution(ExecutionStatus status) {
        StoreSnapshot current = state.get();
        if (current.currentExecution() == null) {
            throw new PipelineException("No execution in progress");
        }
        ExecutionSession finished = copy(current.currentExecution(), ExecutionSession.class);
        finished.setStatus(status);
        finished.setCompletedAt(Instant.now());

        List<ExecutionSession> history = new ArrayList<>(historyMaxSize);
        history.add(copy(finished, ExecutionSession.class));
        for (ExecutionSession past : current.history()) {
            if (history.size() >= historyMaxSize) break;
            history.add(past);
        }
        state.set(new StoreSnapshot(current.pipeline(), finished, history));
        return copy(finished, ExecutionSession.class);
    }

    public Optional<ExecutionSession> getCurrentExecution() {
        ExecutionSession execution = state.get().currentExecution();
        return execution == null ? Optional.empty() : Optional.of(copy(execution, ExecutionSession.class));
    }

    public List<ExecutionSession> getHistory() {
        return state.get().history().stream()
                .map(execution -> copy(execution, ExecutionSession.class))
                .toList();
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private synchronized void mutatePipeline(Consumer<Pipeline> mutation) {
        StoreSnapshot current = state.get();
        if (current.pipeline() == null) {
            throw new PipelineException("No pipeline loaded");
        }
        Pipeline next = copy(current.pipeline(), Pipeline.class);
        mutation.accept(next);
        state.set(new StoreSnapshot(next, current.currentExecution(), current.history()));
    }

    private synchronized void mutateExecution(Consumer<ExecutionSession> mutation) {
        StoreSnapshot current = state.get();
        if (current.currentExecution() == null) {
            throw new PipelineException("No execution in progress");
        }
        ExecutionSession next = copy(current.currentExecution(), ExecutionSession.class);
        mutation.accept(next);
        state.set(new StoreSnapshot(current.pipeline(), next, current.history()));
    }

    private void checkTransition(String nodeId, NodeStatus from, NodeStatus to) {
        if (from != null && !from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal status transition for node " + nodeId + ": "
                    + from.wireName() + " -> " + (to != null ? to.wireName() : "null"));
        }
    }

    private <T> T copy(T value, Class<T> type) {
        if (value == null) return null;
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(value), type);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Failed to copy store state: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PipelineException("Failed to copy store state: " + e.getMessage(), e);
        }
    }
}
