package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.exception.HttpCallException;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.executor.ExecutionDispatcher;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.NodeDefinition;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.domain.PipelineStatus;
import com.novoflow.novoflow_backend.model.execution.ExecutionLogEntry;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import com.novoflow.novoflow_backend.state.ExecutionStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one pipeline run against the state store.
 *
 * Nodes run one at a time in topological order. Nodes that already hold their result are
 * skipped. A failing node is recorded as error and the run moves on; dependants then fail their
 * own input validation, which keeps the cause visible in the log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionCoordinator {

    private final ExecutionStateStore     store;
    private final ExecutionDispatcher     dispatcher;
    private final TopologicalSorter       sorter;
    private final ResultMetadataExtractor extractor;
    private final NodeDefinitionRegistry  registry;
    private final ExecutionEventPublisher eventPublisher;

    public ExecutionSession run(RunHandle handle) {
        Pipeline pipeline = store.requirePipeline();

        // Cyclic graphs are rejected before any state changes
        List<String> order = sorter.sortOrReject(pipeline.getNodes(), pipeline.getEdges());
        String pipelineId = pipeline.getId();

        ExecutionSession execution = store.startExecution(pipelineId);
        store.resetForRun();
        store.setPipelineStatus(PipelineStatus.RUNNING);
        eventPublisher.runStarted(pipelineId);
        log.info("Run {} started for pipeline {}: {} nodes in order {}", execution.getId(), pipelineId, order.size(), order);

        boolean cancelled = false;
        try {
            for (String nodeId : order) {
                if (handle != null && handle.isCancelled()) {
                    cancelled = true;
                    log.info("Run {} cancelled before node {}", execution.getId(), nodeId);
                    break;
                }
                PipelineNode node = store.getNode(nodeId).orElse(null);
                if (node == null) continue;
                if (node.getStatus().isDone()) {
                    log.debug("Skipping {}: already {}", nodeId, node.getStatus().wireName());
                    continue;
                }
                runNode(pipelineId, nodeId);
            }
        } finally {
            execution = finish(pipelineId, cancelled);
        }
        return execution;
    }

    /** Runs exactly one node, whatever its current status, with the same bookkeeping as a full run. */
    public ExecutionSession executeSingleNode(String nodeId) {
        Pipeline pipeline = store.requirePipeline();
        if (pipeline.findNode(nodeId).isEmpty()) {
            throw new NodeNotFoundException(nodeId);
        }
        String pipelineId = pipeline.getId();

        store.startExecution(pipelineId);
        store.resetNode(nodeId);
        store.setPipelineStatus(PipelineStatus.RUNNING);
        eventPublisher.runStarted(pipelineId);
        log.info("Single-node run of {} in pipeline {}", nodeId, pipelineId);

        try {
            runNode(pipelineId, nodeId);
        } finally {
            finish(pipelineId, false);
        }
        return store.getCurrentExecution().orElseThrow();
    }

    // ── Per node ──────────────────────────────────────────────────────────────

    private void runNode(String pipelineId, String nodeId) {
        PipelineNode node = store.getNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
        Instant startedAt = Instant.now();

        store.updateNodeStatus(nodeId, NodeStatus.RUNNING);
        store.addExecutionLog(ExecutionLogEntry.builder()
                .nodeId(nodeId)
                .nodeLabel(node.getLabel())
                .nodeType(node.getType())
                .status(NodeStatus.RUNNING)
                .startedAt(startedAt)
                .input(logInput(node))
                .build());

        // Fresh view so upstream results written earlier in this run are visible
        Pipeline current = store.requirePipeline();
        PipelineNode running = current.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));

        NodeStatus outcome;
        try {
            NodeExecutionResult result = dispatcher.executeNode(running, current);
            NodeDefinition definition = registry.loadNodeConfig(running.getType());
            Map<String, Object> metadata = extractor.extract(running, definition, result);

            store.updateNode(nodeId, n -> n.setResultMetadata(metadata));
            store.updateNodeStatus(nodeId, NodeStatus.COMPLETED);

            Instant completedAt = Instant.now();
            store.updateExecutionLog(nodeId, entry -> {
                entry.setStatus(NodeStatus.COMPLETED);
                entry.setCompletedAt(completedAt);
                entry.setDuration(Duration.between(startedAt, completedAt).toMillis());
                entry.setOutput(Values.deepCopy(result.data()));
                entry.setRequest(result.request());
                entry.setResponse(result.response());
            });
            outcome = NodeStatus.COMPLETED;
            log.info("Node {} ({}) completed", nodeId, node.getType());

        } catch (RuntimeException ex) {
            String message = errorMessage(ex);
            RequestEnvelope  request  = ex instanceof HttpCallException http ? http.getRequest()  : null;
            ResponseEnvelope response = ex instanceof HttpCallException http ? http.getResponse() : null;

            if (ex instanceof PipelineException) {
                log.warn("Node {} ({}) failed: {}", nodeId, node.getType(), message);
            } else {
                log.error("Node {} ({}) threw: {}", nodeId, node.getType(), message, ex);
            }

            Instant completedAt = Instant.now();
            store.updateExecutionLog(nodeId, entry -> {
                entry.setStatus(NodeStatus.ERROR);
                entry.setCompletedAt(completedAt);
                entry.setDuration(Duration.between(startedAt, completedAt).toMillis());
                entry.setError(message);
                entry.setRequest(request);
                entry.setResponse(response);
            });
            store.updateNodeStatus(nodeId, NodeStatus.ERROR, message);
            outcome = NodeStatus.ERROR;
        }

        eventPublisher.nodeCompleted(pipelineId, nodeId, outcome);
    }

    private ExecutionSession finish(String pipelineId, boolean cancelled) {
        ExecutionSession finished = store.finishExecution(cancelled ? ExecutionStatus.STOPPED : ExecutionStatus.COMPLETED);
        store.reconcileNodeStatuses();
        store.setPipelineStatus(cancelled ? PipelineStatus.DRAFT : PipelineStatus.COMPLETED);

        eventPublisher.runCompleted(pipelineId, finished.getStatus(), store.requirePipeline().getNodes());
        log.info("Run {} {} with {} log entries", finished.getId(), finished.getStatus().wireName(), finished.getLogs().size());
        return finished;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<String, Object> logInput(PipelineNode node) {
        Map<String, Object> input = new LinkedHashMap<>();
        if (node.getConfig() != null) input.put("config", Values.deepCopy(node.getConfig()));
        return input;
    }

    // A server's own explanation beats "HTTP 500: Internal Server Error"
    static String errorMessage(RuntimeException ex) {
        if (ex instanceof HttpCallException http && http.getResponse() != null) {
            Map<String, Object> body = Values.asMap(http.getResponse().getData());
            if (body != null) {
                Map<String, Object> nested = Values.asMap(body.get("data"));
                Object detail = Values.firstPresent(
                        body.get("error"),
                        body.get("detail"),
                        nested != null ? nested.get("detail") : null);
                if (detail != null) {
                    return detail instanceof String s ? s : String.valueOf(detail);
                }
            }
        }
        return ex.getMessage() != null ? ex.getMessage() : "Execution failed";
    }
}
