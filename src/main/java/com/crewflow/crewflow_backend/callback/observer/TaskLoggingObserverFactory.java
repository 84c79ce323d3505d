package com.crewflow.crewflow_backend.callback.observer;

import com.crewflow.crewflow_backend.callback.ExecutionObserver;
import com.crewflow.crewflow_backend.callback.ExecutionObserverFactory;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

// Writes a one-line summary of every event to the application log
@Slf4j
@Component
@Order(3)
public class TaskLoggingObserverFactory implements ExecutionObserverFactory {

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public ExecutionObserver init(String jobId, Map<String, Object> config) {
        return new ExecutionObserver() {
            @Override
            public String name() {
                return "logging";
            }

            @Override
            public void onEvent(ExecutionEvent event) {
                if (event.taskKey() != null) {
                    log.info("[EXECUTION {}] #{} {} task={} agent={}", event.jobId(), event.sequence(),
                            event.type(), event.taskKey(), event.agentName());
                } else {
                    log.info("[EXECUTION {}] #{} {}", event.jobId(), event.sequence(), event.type());
                }
            }
        };
    }
}
