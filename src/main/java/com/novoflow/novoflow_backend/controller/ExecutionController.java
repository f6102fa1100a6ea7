package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.model.domain.ExecutionRecord;
import com.novoflow.novoflow_backend.model.execution.ExecutionSession;
import com.novoflow.novoflow_backend.service.PipelineService;
import com.novoflow.novoflow_backend.state.ExecutionStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionStateStore store;
    private final PipelineService pipelineService;

    // 204 until the first run starts
    @GetMapping("/current")
    public ResponseEntity<ExecutionSession> current() {
        return store.getCurrentExecution()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    /** Finished runs of this process, newest first. */
    @GetMapping("/history")
    public List<ExecutionSession> history() {
        return store.getHistory();
    }

    /** Finished runs that made it to the database, newest first. */
    @GetMapping("/persisted")
    public List<ExecutionRecord> persisted() {
        return pipelineService.persistedExecutions();
    }
}
