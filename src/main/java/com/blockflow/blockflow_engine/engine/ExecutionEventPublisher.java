package com.blockflow.blockflow_engine.engine;

import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class ExecutionEventPublisher {

    public enum BlockStatus { RUNNING, SUCCESS, FAILURE, RETRYING }

    // Clients subscribe to /topic/execution/{executionId} to receive live updates
    private static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void blockStarted(String executionId, String blockId) {
        publish(executionId, blockId, BlockStatus.RUNNING.name(), null);
    }

    public void blockCompleted(String executionId, String blockId) {
        publish(executionId, blockId, BlockStatus.SUCCESS.name(), null);
    }

    public void blockFailed(String executionId, String blockId, String error) {
        publish(executionId, blockId, BlockStatus.FAILURE.name(), error);
    }

    public void blockRetrying(String executionId, String blockId) {
        publish(executionId, blockId, BlockStatus.RETRYING.name(), null);
    }

    /** Final event of a run; blockId is null. */
    public void runFinished(String executionId, ExecutionStatus status, String error) {
        publish(executionId, null, status.name(), error);
    }

    private void publish(String executionId, String blockId, String status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("blockId", blockId);
        payload.put("status", status);
        payload.put("error", error != null ? error : "");
        String destination = TOPIC + executionId;
        log.debug("Publishing to {}: block={}, status={}", destination, blockId, status);
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            // events are fire-and-forget
            log.warn("Could not publish event for execution {}: {}", executionId, e.getMessage());
        }
    }
}
