package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.engine.PipelineValidator;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.service.PipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * The working graph. Runs are started in the background and return 202 straight away;
 * progress arrives over /topic/pipeline/{pipelineId} and GET /api/executions/current.
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService pipelineService;

    @PutMapping
    public Pipeline loadPipeline(@RequestBody Pipeline pipeline) {
        return pipelineService.loadPipeline(pipeline);
    }

    @GetMapping
    public Pipeline getPipeline() {
        return pipelineService.currentPipeline();
    }

    @PostMapping("/validate")
    public PipelineValidator.ValidationResult validate() {
        return pipelineService.validate();
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run() {
        pipelineService.startRun();
        return accepted();
    }

    @PostMapping("/nodes/{nodeId}/run")
    public ResponseEntity<Map<String, Object>> runNode(@PathVariable String nodeId) {
        pipelineService.startSingleNode(nodeId);
        return accepted();
    }

    @PostMapping("/stop")
    public Map<String, Object> stop() {
        boolean stopping = pipelineService.stop();
        return Map.of("stopping", stopping);
    }

    private ResponseEntity<Map<String, Object>> accepted() {
        String pipelineId = pipelineService.currentPipeline().getId();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("pipelineId", pipelineId, "status", "running"));
    }
}
