package com.novoflow.novoflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A saved pipeline graph. The whole graph (nodes, edges, results) lives in one JSON column. */
@Entity
@Table(name = "pipelines")
@Data
public class PipelineRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Id of the pipeline inside the graph; saving the same pipeline again updates this row
    @Column(name = "pipeline_id", nullable = false, unique = true)
    private String pipelineId;

    @Column(nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "graph")
    private Map<String, Object> graph;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
