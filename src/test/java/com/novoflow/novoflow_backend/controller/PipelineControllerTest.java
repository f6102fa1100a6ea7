package com.novoflow.novoflow_backend.controller;

import com.novoflow.novoflow_backend.engine.PipelineValidator.ValidationResult;
import com.novoflow.novoflow_backend.exception.CyclicPipelineException;
import com.novoflow.novoflow_backend.exception.NodeNotFoundException;
import com.novoflow.novoflow_backend.exception.PipelineException;
import com.novoflow.novoflow_backend.exception.RunInProgressException;
import com.novoflow.novoflow_backend.model.domain.Pipeline;
import com.novoflow.novoflow_backend.service.PipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PipelineController.class)
class PipelineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PipelineService pipelineService;

    private static Pipeline loaded() {
        return Pipeline.builder().id("p-1").name("Binder design").build();
    }

    @Test
    void put_loadsTheGraph() throws Exception {
        when(pipelineService.loadPipeline(any())).thenReturn(loaded());

        mockMvc.perform(put("/api/pipeline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Binder design\", \"nodes\": [], \"edges\": []}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("p-1"))
                .andExpect(jsonPath("$.status").value("draft"));
    }

    @Test
    void get_withoutGraph_isAConflict() throws Exception {
        when(pipelineService.currentPipeline()).thenThrow(new PipelineException("No pipeline loaded"));

        mockMvc.perform(get("/api/pipeline"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("No pipeline loaded"));
    }

    @Test
    void validate_returnsEveryError() throws Exception {
        when(pipelineService.validate()).thenReturn(new ValidationResult(false, List.of("Node af: input 'sequence' (sequence) is not connected")));

        mockMvc.perform(post("/api/pipeline/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Node af: input 'sequence' (sequence) is not connected"));
    }

    @Test
    void run_isAcceptedAndReturnsThePipelineId() throws Exception {
        when(pipelineService.currentPipeline()).thenReturn(loaded());

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.pipelineId").value("p-1"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void run_whileAnotherRunIsActive_isAConflict() throws Exception {
        when(pipelineService.startRun()).thenThrow(new RunInProgressException());

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RUN_IN_PROGRESS"));
    }

    @Test
    void run_withCycle_isABadRequest() throws Exception {
        when(pipelineService.startRun()).thenThrow(new CyclicPipelineException(List.of("a", "b")));

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details[0]").exists());
    }

    @Test
    void runNode_unknownNode_isNotFound() throws Exception {
        when(pipelineService.startSingleNode("ghost")).thenThrow(new NodeNotFoundException("ghost"));

        mockMvc.perform(post("/api/pipeline/nodes/ghost/run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Node not found in pipeline: ghost"));
    }

    @Test
    void stop_reportsWhetherARunWasActive() throws Exception {
        when(pipelineService.stop()).thenReturn(true);

        mockMvc.perform(post("/api/pipeline/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopping").value(true));
    }

    @Test
    void malformedBody_isABadRequest() throws Exception {
        mockMvc.perform(put("/api/pipeline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodes\": [ "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
