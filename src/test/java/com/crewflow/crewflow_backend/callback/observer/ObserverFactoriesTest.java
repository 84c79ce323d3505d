package com.crewflow.crewflow_backend.callback.observer;

import com.crewflow.crewflow_backend.model.domain.ExecutionTrace;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import com.crewflow.crewflow_backend.model.event.ExecutionEventType;
import com.crewflow.crewflow_backend.repository.ExecutionTraceRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ObserverFactoriesTest {

    private final ExecutionEvent event = ExecutionEvent.of("job-1", ExecutionEventType.TASK_COMPLETED,
            "T1", "A", Map.of("output", "done"), Instant.parse("2026-03-01T10:00:00Z")).withSequence(4);

    @Test
    public void shouldPersistEventAsTrace() {
        ExecutionTraceRepository repository = mock(ExecutionTraceRepository.class);

        new TracingObserverFactory(repository).init("job-1", Map.of()).onEvent(event);

        ArgumentCaptor<ExecutionTrace> trace = ArgumentCaptor.forClass(ExecutionTrace.class);
        verify(repository).save(trace.capture());
        Assertions.assertEquals("job-1", trace.getValue().getJobId());
        Assertions.assertEquals("T1", trace.getValue().getTaskKey());
        Assertions.assertEquals("TASK_COMPLETED", trace.getValue().getEventType());
        Assertions.assertEquals(4L, trace.getValue().getOutput().get("sequence"));
        Assertions.assertEquals("done", trace.getValue().getOutput().get("output"));
        Assertions.assertEquals(Instant.parse("2026-03-01T10:00:00Z"), trace.getValue().getCreatedAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldStreamEventToJobTopic() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        ObjectProvider<RedisWebSocketBridge> noBridge = mock(ObjectProvider.class);
        ExecutionEventPublisher publisher = new ExecutionEventPublisher(template, noBridge);

        new StreamingObserverFactory(publisher).init("job-1", Map.of()).onEvent(event);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(template).convertAndSend(eq("/topic/execution/job-1"), payload.capture());
        Map<String, Object> body = (Map<String, Object>) payload.getValue();
        Assertions.assertEquals("TASK_COMPLETED", body.get("type"));
        Assertions.assertEquals(4L, body.get("sequence"));
        Assertions.assertEquals("A", body.get("agentName"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldRouteThroughRedisWhenBridgeIsEnabled() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(redis, template, new ObjectMapper(),
                RedisWebSocketBridge.DEFAULT_CHANNEL);
        ObjectProvider<RedisWebSocketBridge> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(bridge);

        new ExecutionEventPublisher(template, provider).publish(event);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redis).convertAndSend(eq(RedisWebSocketBridge.DEFAULT_CHANNEL), json.capture());
        Assertions.assertTrue(json.getValue().contains("\"jobId\":\"job-1\""));
        verify(template, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    public void shouldForwardRelayedEventToLocalSubscribers() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(mock(StringRedisTemplate.class), template,
                new ObjectMapper(), RedisWebSocketBridge.DEFAULT_CHANNEL);
        Message message = mock(Message.class);
        when(message.getBody()).thenReturn(
                "{\"jobId\":\"job-9\",\"body\":{\"type\":\"TASK_STARTED\",\"sequence\":2}}"
                        .getBytes(StandardCharsets.UTF_8));

        bridge.onMessage(message, null);

        verify(template).convertAndSend("/topic/execution/job-9", (Object) Map.of("type", "TASK_STARTED", "sequence", 2));
    }

    @Test
    public void shouldDropUnreadableRelayedMessage() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(mock(StringRedisTemplate.class), template,
                new ObjectMapper(), RedisWebSocketBridge.DEFAULT_CHANNEL);
        Message message = mock(Message.class);
        when(message.getBody()).thenReturn("not json".getBytes(StandardCharsets.UTF_8));

        bridge.onMessage(message, null);

        verifyNoInteractions(template);
    }
}
