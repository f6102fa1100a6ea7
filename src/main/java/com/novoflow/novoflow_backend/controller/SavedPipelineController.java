package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.model.domain.PipelineRecord;
import com.novoflow.novoflow_backend.service.PipelineService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/pipelines")
@RequiredArgsConstructor
public class SavedPipelineController {

    private final PipelineService pipelineService;

    /** Saves the graph currently in the store. Body is optional: {"name": "..."} */
    @PostMapping
    public PipelineRecord save(@RequestBody(required = false) Map<String, String> body) {
        String name = body != null ? body.get("name") : null;
        return pipelineService.savePipeline(name);
    }

    @GetMapping
    public List<PipelineRecord> list() {
        return pipelineService.savedPipelines();
    }

    @PostMapping("/{id}/load")
    public Pipeline load(@PathVariable UUID id) {
        return pipelineService.loadSavedPipeline(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        pipelineService.deleteSavedPipeline(id);
        return ResponseEntity.noContent().build();
    }
}
