package com.novoflow.novoflow_backend.service;

import com.novoflow.novoflow_backend.PipelineFixtures;
import com.novoflow.novoflow_backend.engine.ExecutionCoordinator;
import com.novoflow.novoflow_backend.engine.PipelineValidator;
import com.novoflow.novoflow_backend.engine.TopologicalSorter;
import com.novoflow.novoflow_backend.exception.CyclicPipelineException;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.RunInProgressException;
import com.novoflow.novoflow_backend.exception.SavedPipelineNotFoundException;
import com.novoflow.novoflow_backend.model.domain.ExecutionRecord;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.domain.PipelineRecord;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import com.novoflow.novoflow_backend.repository.ExecutionRecordRepository;
import com.novoflow.novoflow_backend.repository.PipelineRecordRepository;
import com.novoflow.novoflow_backend.state.ExecutionStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.novoflow.novoflow_backend.PipelineFixtures.edge;
import static com.novoflow.novoflow_backend.PipelineFixtures.node;
import static com.novoflow.novoflow_backend.PipelineFixtures.pipeline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineServiceTest {

    private ExecutionCoordinator coordinator;
    private ExecutionStateStore store;
    private PipelineRecordRepository pipelineRepository;
    private ExecutionRecordRepository executionRepository;
    private PipelineService service;

    @BeforeEach
    void setUp() {
        coordinator = mock(ExecutionCoordinator.class);
        store = new ExecutionStateStore(PipelineFixtures.objectMapper(), PipelineFixtures.properties());
        pipelineRepository = mock(PipelineRecordRepository.class);
        executionRepository = mock(ExecutionRecordRepository.class);
        service = new PipelineService(coordinator, store, mock(PipelineValidator.class), new TopologicalSorter(),
                PipelineFixtures.registry(), pipelineRepository, executionRepository, PipelineFixtures.objectMapper());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static ExecutionSession finished() {
        return ExecutionSession.builder()
                .id("run-1")
                .pipelineId("p-1")
                .status(ExecutionStatus.COMPLETED)
                .startedAt(Instant.now())
                .completedAt(Instant.now())
                .build();
    }

    @Test
    void load_fillsInIdsStatusesAndDefaultConfig() {
        PipelineNode bare = PipelineNode.builder().id("msg").type("message_input_node").config(null).status(null).build();

        Pipeline loaded = service.loadPipeline(Pipeline.builder().nodes(List.of(bare)).edges(null).build());

        assertThat(loaded.getId()).isNotBlank();
        assertThat(loaded.getName()).isEqualTo("Untitled pipeline");
        assertThat(loaded.getEdges()).isEmpty();
        assertThat(loaded.getNodes().get(0).getStatus()).isEqualTo(NodeStatus.IDLE);
        assertThat(loaded.getNodes().get(0).getConfig()).containsEntry("message", "");
        assertThat(store.requirePipeline().getId()).isEqualTo(loaded.getId());
    }

    @Test
    void run_isSingleFlightAndPersistedWhenDone() throws Exception {
        store.setPipeline(pipeline(List.of(node("msg", "message_input_node", null)), List.of()));
        CountDownLatch release = new CountDownLatch(1);
        when(coordinator.run(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return finished();
        });

        CompletableFuture<ExecutionSession> run = service.startRun();

        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(service::startRun).isInstanceOf(RunInProgressException.class);
        assertThatThrownBy(() -> service.loadPipeline(Pipeline.builder().build())).isInstanceOf(RunInProgressException.class);

        release.countDown();
        assertThat(run.get(5, TimeUnit.SECONDS).getId()).isEqualTo("run-1");

        ArgumentCaptor<ExecutionRecord> saved = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(executionRepository, timeout(2_000)).save(saved.capture());
        assertThat(saved.getValue().getExecutionId()).isEqualTo("run-1");
        assertThat(saved.getValue().getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(saved.getValue().getSnapshot()).containsEntry("status", "completed");
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void cyclicGraph_isRejectedBeforeSubmitting() {
        store.setPipeline(pipeline(List.of(
                node("a", "message_input_node", null),
                node("b", "message_input_node", null)),
                List.of(edge("a", "b", null), edge("b", "a", null))));

        assertThatThrownBy(service::startRun).isInstanceOf(CyclicPipelineException.class);
        assertThat(service.isRunning()).isFalse();
        verifyNoInteractions(coordinator);
    }

    @Test
    void singleNode_unknownId_isRejected() {
        store.setPipeline(pipeline(List.of(node("msg", "message_input_node", null)), List.of()));

        assertThatThrownBy(() -> service.startSingleNode("ghost")).isInstanceOf(NodeNotFoundException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void stop_withoutActiveRun_reportsFalse() {
        assertThat(service.stop()).isFalse();
    }

    @Test
    void save_updatesTheExistingRecordForThePipeline() {
        store.setPipeline(pipeline(List.of(node("msg", "message_input_node", null)), List.of()));
        PipelineRecord existing = new PipelineRecord();
        existing.setId(UUID.randomUUID());
        existing.setPipelineId("pipeline-1");
        when(pipelineRepository.findByPipelineId("pipeline-1")).thenReturn(Optional.of(existing));
        when(pipelineRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        PipelineRecord saved = service.savePipeline("  ");

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getName()).isEqualTo("Test pipeline");
        assertThat(saved.getGraph()).containsKeys("id", "nodes", "edges");
    }

    @Test
    void loadSaved_restoresTheGraphIntoTheStore() {
        PipelineRecord record = new PipelineRecord();
        record.setId(UUID.randomUUID());
        record.setPipelineId("p-saved");
        record.setName("Saved");
        record.setGraph(PipelineFixtures.objectMapper().convertValue(
                pipeline(List.of(node("msg", "message_input_node", null)), List.of()), java.util.Map.class));
        when(pipelineRepository.findById(record.getId())).thenReturn(Optional.of(record));

        Pipeline loaded = service.loadSavedPipeline(record.getId());

        assertThat(loaded.getId()).isEqualTo("p-saved");
        assertThat(store.getNode("msg")).isPresent();
    }

    @Test
    void deleteMissing_isNotFound() {
        UUID id = UUID.randomUUID();
        when(pipelineRepository.existsById(id)).thenReturn(false);

        assertThatThrownBy(() -> service.deleteSavedPipeline(id)).isInstanceOf(SavedPipelineNotFoundException.class);
    }
}
