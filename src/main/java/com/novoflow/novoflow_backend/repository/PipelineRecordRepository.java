package com.novoflow.novoflow_backend.repository;

import com.novoflow.novoflow_backend.model.domain.PipelineRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PipelineRecordRepository extends JpaRepository<PipelineRecord, UUID> {

    Optional<PipelineRecord> findByPipelineId(String pipelineId);

    // Most recently saved first
    List<PipelineRecord> findAllByOrderByUpdatedAtDesc();
}
