package com.novoflow.novoflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Pipeline {

    private String id;

    private String name;

    @Builder.Default
    private List<PipelineNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<PipelineEdge> edges = new ArrayList<>();

    @Builder.Default
    private PipelineStatus status = PipelineStatus.DRAFT;

    private Instant createdAt;

    private Instant updatedAt;

    public Optional<PipelineNode> findNode(String nodeId) {
        if (nodeId == null || nodes == null) return Optional.empty();
        return nodes.stream().filter(n -> nodeId.equals(n.getId())).findFirst();
    }
}
