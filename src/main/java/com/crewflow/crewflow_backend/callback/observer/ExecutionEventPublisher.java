package com.crewflow.crewflow_backend.callback.observer;

import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class ExecutionEventPublisher {

    // Clients subscribe to /topic/execution/{jobId} for live updates
    public static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void publish(ExecutionEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", event.jobId());
        payload.put("sequence", event.sequence());
        payload.put("type", event.type().name());
        payload.put("taskKey", event.taskKey() != null ? event.taskKey() : "");
        payload.put("agentName", event.agentName() != null ? event.agentName() : "");
        payload.put("payload", event.payload());
        payload.put("timestamp", event.timestamp().toString());

        String destination = TOPIC + event.jobId();
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("[WS] publish: destination={}, type={}, via={}",
                destination, event.type(), bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.relay(event.jobId(), payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
