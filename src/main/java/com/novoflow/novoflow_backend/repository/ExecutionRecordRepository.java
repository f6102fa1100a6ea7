package com.novoflow.novoflow_backend.repository;

import com.novoflow.novoflow_backend.model.domain.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID> {

    List<ExecutionRecord> findAllByOrderByStartedAtDesc();

    List<ExecutionRecord> findByPipelineIdOrderByStartedAtDesc(String pipelineId);
}
