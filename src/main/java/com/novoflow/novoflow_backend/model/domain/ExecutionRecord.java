package com.novoflow.novoflow_backend.model.domain;

import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import jakarta.persistence.*;
import lombok.Data;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "pipeline_executions")
@Data
public class ExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private String executionId;

    @Column(name = "pipeline_id")
    private String pipelineId;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status;

    // Finished execution with all its log entries, saved for audit/debug
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshot")
    private Map<String, Object> snapshot;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
