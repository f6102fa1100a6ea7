package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.exception.CyclicPipelineException;
import com.novoflow.novoflow_backend.model.domain.PipelineEdge;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Kahn's algorithm. Edges touching an id outside the node set are ignored; ties are broken by
 * position in the node list, so the same graph always sorts the same way.
 */
@Component
public class TopologicalSorter {

    public List<String> sort(List<PipelineNode> nodes, List<PipelineEdge> edges) {
        Map<String, Integer>      inDegree  = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (PipelineNode node : nodes) {
            inDegree.put(node.getId(), 0);
            adjacency.put(node.getId(), new ArrayList<>());
        }

        for (PipelineEdge edge : edges) {
            if (!inDegree.containsKey(edge.getSource()) || !inDegree.containsKey(edge.getTarget())) continue;
            adjacency.get(edge.getSource()).add(edge.getTarget());
            inDegree.merge(edge.getTarget(), 1, Integer::sum);
        }

        Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        List<String> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            for (String next : adjacency.get(id)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) queue.add(next);
            }
        }
        return order;
    }

    /** Ids the sort never reached: members of a cycle or downstream of one. Empty for a DAG. */
    public List<String> findCycleMembers(List<PipelineNode> nodes, List<PipelineEdge> edges) {
        Set<String> reached = new HashSet<>(sort(nodes, edges));
        List<String> unreached = new ArrayList<>();
        for (PipelineNode node : nodes) {
            if (!reached.contains(node.getId())) unreached.add(node.getId());
        }
        return unreached;
    }

    public List<String> sortOrReject(List<PipelineNode> nodes, List<PipelineEdge> edges) {
        List<String> order = sort(nodes, edges);
        if (order.size() < nodes.size()) {
            Set<String> reached = new HashSet<>(order);
            List<String> unreached = nodes.stream()
                    .map(PipelineNode::getId)
                    .filter(id -> !reached.contains(id))
                    .toList();
            throw new CyclicPipelineException(unreached);
        }
        return order;
    }
}
