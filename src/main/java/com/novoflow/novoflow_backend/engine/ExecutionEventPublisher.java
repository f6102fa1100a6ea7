package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.ExecutionStatus;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class ExecutionEventPublisher {

    // The canvas subscribes to /topic/pipeline/{pipelineId} to receive live updates
    private static final String TOPIC = "/topic/pipeline/";

    private final SimpMessagingTemplate messagingTemplate;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void runStarted(String pipelineId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "run-started");
        payload.put("pipelineId", pipelineId);
        publish(pipelineId, payload);
    }

    public void nodeCompleted(String pipelineId, String nodeId, NodeStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "node-completed");
        payload.put("pipelineId", pipelineId);
        payload.put("nodeId", nodeId);
        payload.put("status", status.wireName());
        publish(pipelineId, payload);
    }

    public void runCompleted(String pipelineId, ExecutionStatus status, List<PipelineNode> nodes) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "run-completed");
        payload.put("pipelineId", pipelineId);
        payload.put("status", status.wireName());
        payload.put("nodes", nodes);
        publish(pipelineId, payload);
    }

    // A missing subscriber or broken broker must never fail the run itself
    private void publish(String pipelineId, Map<String, Object> payload) {
        String destination = TOPIC + pipelineId;
        log.debug("Publishing {} to {}", payload.get("event"), destination);
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException ex) {
            log.warn("Could not publish {} to {}: {}", payload.get("event"), destination, ex.getMessage());
        }
    }
}
