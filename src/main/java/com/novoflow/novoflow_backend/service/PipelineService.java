package com.novoflow.novoflow_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.engine.ExecutionCoordinator;
import com.novoflow.novoflow_backend.engine.PipelineValidator;
import com.novoflow.novoflow_backend.engine.RunHandle;
import com.novoflow.novoflow_backend.engine.TopologicalSorter;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.RunInProgressException;
import com.novoflow.novoflow_backend.exception.SavedPipelineNotFoundException;
import com.novoflow.novoflow_backend.exception.ValidationException;
import com.novoflow.novoflow_backend.model.domain.ExecutionRecord;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.domain.PipelineRecord;
import com.novoflow.novoflow_backend.model.domain.PipelineStatus;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import com.novoflow.novoflow_backend.repository.ExecutionRecordRepository;
import com.novoflow.novoflow_backend.repository.PipelineRecordRepository;
import com.novoflow.novoflow_backend.state.ExecutionStateStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Boundary between the REST surface and the engine: loads graphs into the store, starts and
 * stops runs, and saves graphs and finished executions to the database.
 *
 * Runs execute on a single background thread ("novoflow-run") and return immediately, so the
 * canvas can subscribe to /topic/pipeline/{id} before events arrive. Only one run at a time.
 */
@Slf4j
@Service
public class PipelineService {

    private final ExecutionCoordinator      coordinator;
    private final ExecutionStateStore       store;
    private final PipelineValidator         validator;
    private final TopologicalSorter         sorter;
    private final NodeDefinitionRegistry    registry;
    private final PipelineRecordRepository  pipelineRepository;
    private final ExecutionRecordRepository executionRepository;
    private final ObjectMapper              objectMapper;

    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "novoflow-run");
        thread.setDaemon(true);
        return thread;
    });

    private final AtomicReference<RunHandle> activeRun = new AtomicReference<>();

    public PipelineService(ExecutionCoordinator coordinator,
                           ExecutionStateStore store,
                           PipelineValidator validator,
                           TopologicalSorter sorter,
                           NodeDefinitionRegistry registry,
                           PipelineRecordRepository pipelineRepository,
                           ExecutionRecordRepository executionRepository,
                           ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.store = store;
        this.validator = validator;
        this.sorter = sorter;
        this.registry = registry;
        this.pipelineRepository = pipelineRepository;
        this.executionRepository = executionRepository;
        this.objectMapper = objectMapper;
    }

    // ── Graph ─────────────────────────────────────────────────────────────────

    /** Replaces the graph in the store. Missing ids, statuses and configs are filled in. */
    public Pipeline loadPipeline(Pipeline pipeline) {
        if (isRunning()) throw new RunInProgressException();

        Pipeline normalised = pipeline.toBuilder()
                .id(pipeline.getId() != null && !pipeline.getId().isBlank() ? pipeline.getId() : UUID.randomUUID().toString())
                .name(pipeline.getName() != null ? pipeline.getName() : "Untitled pipeline")
                .nodes(pipeline.getNodes() != null ? pipeline.getNodes() : new ArrayList<>())
                .edges(pipeline.getEdges() != null ? pipeline.getEdges() : new ArrayList<>())
                .status(pipeline.getStatus() != null ? pipeline.getStatus() : PipelineStatus.DRAFT)
                .createdAt(pipeline.getCreatedAt() != null ? pipeline.getCreatedAt() : Instant.now())
                .updatedAt(Instant.now())
                .build();

        for (PipelineNode node : normalised.getNodes()) {
            if (node.getStatus() == null) node.setStatus(NodeStatus.IDLE);
            if (node.getConfig() == null) node.setConfig(registry.getDefaultNodeConfig(node.getType()));
        }

        store.setPipeline(normalised);
        log.info("Loaded pipeline {} ({} nodes, {} edges)", normalised.getId(), normalised.getNodes().size(), normalised.getEdges().size());
        return store.requirePipeline();
    }

    public Pipeline currentPipeline() {
        return store.requirePipeline();
    }

    public PipelineValidator.ValidationResult validate() {
        return validator.validate(store.requirePipeline());
    }

    // ── Runs ──────────────────────────────────────────────────────────────────

    public CompletableFuture<ExecutionSession> startRun() {
        Pipeline pipeline = store.requirePipeline();
        // Rejected here as well so the caller gets the error instead of a failed future
        sorter.sortOrReject(pipeline.getNodes(), pipeline.getEdges());

        RunHandle handle = new RunHandle();
        return submit(handle, () -> coordinator.run(handle));
    }

    public CompletableFuture<ExecutionSession> startSingleNode(String nodeId) {
        if (store.getNode(nodeId).isEmpty()) {
            throw new NodeNotFoundException(nodeId);
        }
        return submit(new RunHandle(), () -> coordinator.executeSingleNode(nodeId));
    }

    /** Asks the active run to stop before its next node. False when nothing is running. */
    public boolean stop() {
        RunHandle handle = activeRun.get();
        if (handle == null) return false;
        handle.cancel();
        log.info("Stop requested for the active run");
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private CompletableFuture<ExecutionSession> submit(RunHandle handle, Supplier<ExecutionSession> run) {
        if (!activeRun.compareAndSet(null, handle)) {
            throw new RunInProgressException();
        }
        try {
            return CompletableFuture.supplyAsync(run, runExecutor)
                    .whenComplete((execution, ex) -> {
                        activeRun.compareAndSet(handle, null);
                        if (ex != null) {
                            log.error("Pipeline run failed: {}", ex.getMessage(), ex);
                        } else {
                            persistExecution(execution);
                        }
                    });
        } catch (RuntimeException ex) {
            activeRun.compareAndSet(handle, null);
            throw ex;
        }
    }

    private void persistExecution(ExecutionSession execution) {
        try {
            ExecutionRecord record = new ExecutionRecord();
            record.setExecutionId(execution.getId());
            record.setPipelineId(execution.getPipelineId());
            record.setStatus(execution.getStatus());
            record.setStartedAt(execution.getStartedAt());
            record.setCompletedAt(execution.getCompletedAt());
            record.setSnapshot(objectMapper.convertValue(execution, new TypeReference<Map<String, Object>>() {}));
            executionRepository.save(record);
        } catch (RuntimeException ex) {
            // The in-memory history still has it
            log.error("Could not persist execution {}: {}", execution.getId(), ex.getMessage(), ex);
        }
    }

    public List<ExecutionRecord> persistedExecutions() {
        return executionRepository.findAllByOrderByStartedAtDesc();
    }

    // ── Saved pipelines ───────────────────────────────────────────────────────

    public PipelineRecord savePipeline(String name) {
        Pipeline pipeline = store.requirePipeline();
        String resolvedName = name != null && !name.isBlank() ? name : pipeline.getName();
        if (resolvedName == null || resolvedName.isBlank()) {
            throw new ValidationException("A saved pipeline needs a name");
        }

        PipelineRecord record = pipelineRepository.findByPipelineId(pipeline.getId()).orElseGet(PipelineRecord::new);
        record.setPipelineId(pipeline.getId());
        record.setName(resolvedName);
        record.setGraph(objectMapper.convertValue(pipeline, new TypeReference<LinkedHashMap<String, Object>>() {}));
        PipelineRecord saved = pipelineRepository.save(record);
        log.info("Saved pipeline {} as {} ({})", pipeline.getId(), saved.getId(), resolvedName);
        return saved;
    }

    public List<PipelineRecord> savedPipelines() {
        return pipelineRepository.findAllByOrderByUpdatedAtDesc();
    }

    public Pipeline loadSavedPipeline(UUID id) {
        PipelineRecord record = pipelineRepository.findById(id)
                .orElseThrow(() -> new SavedPipelineNotFoundException(id));
        Pipeline pipeline = objectMapper.convertValue(record.getGraph(), Pipeline.class);
        pipeline.setId(record.getPipelineId());
        pipeline.setName(record.getName());
        return loadPipeline(pipeline);
    }

    public void deleteSavedPipeline(UUID id) {
        if (!pipelineRepository.existsById(id)) {
            throw new SavedPipelineNotFoundException(id);
        }
        pipelineRepository.deleteById(id);
    }

    @PreDestroy
    public void shutdown() {
        runExecutor.shutdownNow();
    }
}
