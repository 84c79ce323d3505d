package com.crewflow.crewflow_backend.model.event;

import java.time.Instant;
import java.util.Map;

/**
 * One lifecycle event of an execution, as delivered to every observer.
 * {@code sequence} is assigned by the broadcaster and grows by one per event of the same execution.
 */
public record ExecutionEvent(String jobId,
                             long sequence,
                             ExecutionEventType type,
                             String taskKey,
                             String agentName,
                             Map<String, Object> payload,
                             Instant timestamp) {

    public static ExecutionEvent of(String jobId, ExecutionEventType type, String taskKey,
                                    String agentName, Map<String, Object> payload, Instant timestamp) {
        return new ExecutionEvent(jobId, 0L, type, taskKey, agentName,
                payload != null ? payload : Map.of(), timestamp);
    }

    public static ExecutionEvent of(String jobId, ExecutionEventType type, Map<String, Object> payload,
                                    Instant timestamp) {
        return of(jobId, type, null, null, payload, timestamp);
    }

    public ExecutionEvent withSequence(long seq) {
        return new ExecutionEvent(jobId, seq, type, taskKey, agentName, payload, timestamp);
    }
}
