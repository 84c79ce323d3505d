package com.crewflow.crewflow_backend.config;

import com.crewflow.crewflow_backend.callback.observer.RedisWebSocketBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

// Multi-instance streaming, off unless crewflow.websocket.redis-bridge=true
@Slf4j
@Configuration
@ConditionalOnProperty(name = "crewflow.websocket.redis-bridge", havingValue = "true")
public class RedisWebSocketConfig {

    @Value("${crewflow.websocket.redis-channel:" + RedisWebSocketBridge.DEFAULT_CHANNEL + "}")
    private String channel;

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper) {
        log.info("[WS] Relaying execution events through Redis channel {}", channel);
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper, channel);
    }

    @Bean
    public RedisMessageListenerContainer executionEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                         RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(bridge.channel()));
        container.setErrorHandler(e -> log.error("[WS] Redis listener failed: {}", e.getMessage(), e));
        return container;
    }
}
