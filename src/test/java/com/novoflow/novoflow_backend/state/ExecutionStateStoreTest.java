package com.novoflow.novoflow_backend.state;

import com.novoflow.novoflow_backend.PipelineFixtures;
import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.ExecutionLogEntry;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.novoflow.novoflow_backend.PipelineFixtures.node;
import static com.novoflow.novoflow_backend.PipelineFixtures.pipeline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionStateStoreTest {

    private ExecutionStateStore store;

    @BeforeEach
    void setUp() {
        EngineProperties properties = PipelineFixtures.properties();
        properties.getHistory().setMaxSize(2);
        store = new ExecutionStateStore(PipelineFixtures.objectMapper(), properties);
        store.setPipeline(pipeline(List.of(
                node("a", "message_input_node", Map.of("message", "hi")),
                node("b", "message_input_node", Map.of())), List.of()));
    }

    @Test
    void readersGetCopies() {
        Pipeline copy = store.requirePipeline();
        copy.getNodes().get(0).setLabel("changed");
        copy.getNodes().clear();

        assertThat(store.requirePipeline().getNodes()).hasSize(2);
        assertThat(store.getNode("a")).get().extracting(PipelineNode::getLabel).isEqualTo("a");
    }

    @Test
    void noPipeline_isReported() {
        ExecutionStateStore empty = new ExecutionStateStore(PipelineFixtures.objectMapper(), PipelineFixtures.properties());

        assertThat(empty.getPipeline()).isEmpty();
        assertThatThrownBy(empty::requirePipeline).isInstanceOf(PipelineException.class).hasMessage("No pipeline loaded");
    }

    @Test
    void statusMovesForwardOnly() {
        assertThatThrownBy(() -> store.updateNodeStatus("a", NodeStatus.COMPLETED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Illegal status transition for node a: idle -> completed");

        store.updateNodeStatus("a", NodeStatus.RUNNING);
        store.updateNodeStatus("a", NodeStatus.ERROR, "boom");

        assertThat(store.getNode("a")).get().satisfies(node -> {
            assertThat(node.getStatus()).isEqualTo(NodeStatus.ERROR);
            assertThat(node.getError()).isEqualTo("boom");
        });
        assertThatThrownBy(() -> store.updateNodeStatus("a", NodeStatus.RUNNING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void patchThatSkipsTheLifecycle_isRejectedAndNotApplied() {
        assertThatThrownBy(() -> store.updateNode("a", node -> {
            node.setStatus(NodeStatus.SUCCESS);
            node.setResultMetadata(Map.of("message", "x"));
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.getNode("a")).get().satisfies(node -> {
            assertThat(node.getStatus()).isEqualTo(NodeStatus.IDLE);
            assertThat(node.getResultMetadata()).isNull();
        });
    }

    @Test
    void resetForRun_keepsFinishedNodesAndClearsErrors() {
        store.updateNodeStatus("a", NodeStatus.RUNNING);
        store.updateNode("a", node -> node.setResultMetadata(Map.of("message", "hi")));
        store.updateNodeStatus("a", NodeStatus.COMPLETED);
        store.updateNodeStatus("b", NodeStatus.RUNNING);
        store.updateNodeStatus("b", NodeStatus.ERROR, "boom");

        store.resetForRun();

        assertThat(store.getNode("a")).get().extracting(PipelineNode::getStatus).isEqualTo(NodeStatus.COMPLETED);
        assertThat(store.getNode("b")).get().satisfies(node -> {
            assertThat(node.getStatus()).isEqualTo(NodeStatus.PENDING);
            assertThat(node.getError()).isNull();
        });
    }

    @Test
    void reconcile_settlesNodesLeftWaitingOrRunning() {
        store.updateNode("a", node -> node.setResultMetadata(Map.of("message", "hi")));
        store.updateNodeStatus("b", NodeStatus.RUNNING);

        store.reconcileNodeStatuses();

        assertThat(store.getNode("a")).get().extracting(PipelineNode::getStatus).isEqualTo(NodeStatus.COMPLETED);
        assertThat(store.getNode("b")).get().satisfies(node -> {
            assertThat(node.getStatus()).isEqualTo(NodeStatus.ERROR);
            assertThat(node.getError()).isEqualTo("Node did not finish");
        });
    }

    @Test
    void executionLog_isPatchedByNodeId() {
        store.startExecution("pipeline-1");
        store.addExecutionLog(ExecutionLogEntry.builder().nodeId("a").status(NodeStatus.RUNNING).build());

        store.updateExecutionLog("a", entry -> entry.setStatus(NodeStatus.COMPLETED));
        store.updateExecutionLog("missing", entry -> entry.setStatus(NodeStatus.ERROR));

        ExecutionSession current = store.getCurrentExecution().orElseThrow();
        assertThat(current.getLogs()).singleElement()
                .extracting(ExecutionLogEntry::getStatus).isEqualTo(NodeStatus.COMPLETED);
    }

    @Test
    void history_isNewestFirstAndCapped() {
        String first  = store.startExecution("pipeline-1").getId();
        store.finishExecution(ExecutionStatus.COMPLETED);
        String second = store.startExecution("pipeline-1").getId();
        store.finishExecution(ExecutionStatus.STOPPED);
        String third  = store.startExecution("pipeline-1").getId();
        ExecutionSession finished = store.finishExecution(ExecutionStatus.COMPLETED);

        assertThat(store.getHistory()).extracting(ExecutionSession::getId).containsExactly(third, second);
        assertThat(store.getHistory()).extracting(ExecutionSession::getId).doesNotContain(first);
        assertThat(finished.getCompletedAt()).isNotNull();
        assertThat(store.getCurrentExecution()).get().extracting(ExecutionSession::getId).isEqualTo(third);
    }

    @Test
    void snapshotAndRestore_roundTripTheWholeStore() {
        store.startExecution("pipeline-1");
        StoreSnapshot snapshot = store.snapshot();

        store.updateNodeStatus("a", NodeStatus.RUNNING);
        store.restore(snapshot);

        assertThat(store.getNode("a")).get().extracting(PipelineNode::getStatus).isEqualTo(NodeStatus.IDLE);
        assertThat(store.getCurrentExecution()).isPresent();
    }
}
