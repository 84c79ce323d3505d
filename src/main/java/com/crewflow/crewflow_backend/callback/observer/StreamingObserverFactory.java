package com.crewflow.crewflow_backend.callback.observer;

import com.crewflow.crewflow_backend.callback.ExecutionObserver;
import com.crewflow.crewflow_backend.callback.ExecutionObserverFactory;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Streams every event to STOMP subscribers of {@code /topic/execution/{jobId}}.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class StreamingObserverFactory implements ExecutionObserverFactory {

    private final ExecutionEventPublisher publisher;

    @Override
    public String name() {
        return "streaming";
    }

    @Override
    public ExecutionObserver init(String jobId, Map<String, Object> config) {
        return new ExecutionObserver() {
            @Override
            public String name() {
                return "streaming";
            }

            @Override
            public void onEvent(ExecutionEvent event) {
                publisher.publish(event);
            }
        };
    }
}
