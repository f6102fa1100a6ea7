package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.exception.CyclicPipelineException;
import com.novoflow.novoflow_backend.model.domain.PipelineEdge;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.novoflow.novoflow_backend.PipelineFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologicalSorterTest {

    private final TopologicalSorter sorter = new TopologicalSorter();

    private static PipelineNode node(String id) {
        return PipelineNode.builder().id(id).type("message_input_node").build();
    }

    @Test
    void linearChain_isSortedInChainOrder() {
        List<PipelineNode> nodes = List.of(node("c"), node("b"), node("a"));
        List<PipelineEdge> edges = List.of(edge("a", "b", null), edge("b", "c", null));

        assertThat(sorter.sort(nodes, edges)).containsExactly("a", "b", "c");
    }

    @Test
    void everyEdgeSourceComesBeforeItsTarget() {
        List<PipelineNode> nodes = List.of(node("e"), node("d"), node("c"), node("b"), node("a"));
        List<PipelineEdge> edges = List.of(
                edge("a", "c", null), edge("b", "c", null), edge("c", "d", null), edge("a", "e", null), edge("d", "e", null));

        List<String> order = sorter.sort(nodes, edges);

        assertThat(order).hasSize(5);
        for (PipelineEdge e : edges) {
            assertThat(order.indexOf(e.getSource())).isLessThan(order.indexOf(e.getTarget()));
        }
    }

    @Test
    void edgesToUnknownNodes_areIgnored() {
        List<PipelineNode> nodes = List.of(node("a"), node("b"));
        List<PipelineEdge> edges = List.of(edge("ghost", "a", null), edge("a", "b", null));

        assertThat(sorter.sort(nodes, edges)).containsExactly("a", "b");
    }

    @Test
    void cycle_leavesMembersUnsortedAndIsRejected() {
        List<PipelineNode> nodes = List.of(node("a"), node("b"), node("c"));
        List<PipelineEdge> edges = List.of(edge("a", "b", null), edge("b", "c", null), edge("c", "b", null));

        assertThat(sorter.sort(nodes, edges)).containsExactly("a");
        assertThat(sorter.findCycleMembers(nodes, edges)).containsExactly("b", "c");
        assertThatThrownBy(() -> sorter.sortOrReject(nodes, edges))
                .isInstanceOf(CyclicPipelineException.class)
                .hasMessageContaining("b");
    }
}
