package com.crewflow.crewflow_backend.callback.observer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.util.Map;

/**
 * Relays execution events through a Redis channel so that every instance, this one
 * included, pushes them to its own STOMP subscribers. A client connected to instance B
 * still follows an execution running on instance A.
 * Registered by {@code RedisWebSocketConfig} when {@code crewflow.websocket.redis-bridge} is on.
 */
@Slf4j
public class RedisWebSocketBridge implements MessageListener {

    public static final String DEFAULT_CHANNEL = "crewflow:execution-events";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisWebSocketBridge(StringRedisTemplate redisTemplate, SimpMessagingTemplate messagingTemplate,
                                ObjectMapper objectMapper, String channel) {
        this.redisTemplate = redisTemplate;
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }

    public void relay(String jobId, Map<String, Object> body) {
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(new RelayedEvent(jobId, body)));
        } catch (JsonProcessingException e) {
            log.error("[WS] Could not serialise event #{} of {}", body.get("sequence"), jobId, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        RelayedEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), RelayedEvent.class);
        } catch (IOException e) {
            log.warn("[WS] Ignoring unreadable message on {}: {}", channel, e.getMessage());
            return;
        }
        if (event.jobId() == null || event.jobId().isBlank() || event.body() == null) {
            log.warn("[WS] Ignoring message without job id or body on {}", channel);
            return;
        }
        try {
            messagingTemplate.convertAndSend(ExecutionEventPublisher.TOPIC + event.jobId(), event.body());
        } catch (MessagingException e) {
            log.error("[WS] Could not forward event #{} of {} to subscribers", event.body().get("sequence"),
                    event.jobId(), e);
        }
    }

    record RelayedEvent(String jobId, Map<String, Object> body) {}
}
