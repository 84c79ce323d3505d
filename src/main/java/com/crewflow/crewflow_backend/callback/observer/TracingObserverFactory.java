package com.crewflow.crewflow_backend.callback.observer;

import com.crewflow.crewflow_backend.callback.ExecutionObserver;
import com.crewflow.crewflow_backend.callback.ExecutionObserverFactory;
import com.crewflow.crewflow_backend.model.domain.ExecutionTrace;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import com.crewflow.crewflow_backend.repository.ExecutionTraceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists each event as an {@link ExecutionTrace} row.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class TracingObserverFactory implements ExecutionObserverFactory {

    private final ExecutionTraceRepository traceRepository;

    @Override
    public String name() {
        return "tracing";
    }

    @Override
    public ExecutionObserver init(String jobId, Map<String, Object> config) {
        return new TracingObserver();
    }

    private class TracingObserver implements ExecutionObserver {

        @Override
        public String name() {
            return "tracing";
        }

        @Override
        public void onEvent(ExecutionEvent event) {
            Map<String, Object> output = new LinkedHashMap<>(event.payload());
            output.put("sequence", event.sequence());

            ExecutionTrace trace = new ExecutionTrace();
            trace.setJobId(event.jobId());
            trace.setTaskKey(event.taskKey());
            trace.setAgentName(event.agentName());
            trace.setEventType(event.type().name());
            trace.setOutput(output);
            trace.setCreatedAt(event.timestamp());
            traceRepository.save(trace);
        }
    }
}
