package com.crewflow.crewflow_backend.engine;

import java.util.Map;

public record TaskLifecycleEvent(String taskKey, String agentName, TaskEventType type, Map<String, Object> payload) {

    public static TaskLifecycleEvent of(String taskKey, String agentName, TaskEventType type) {
        return new TaskLifecycleEvent(taskKey, agentName, type, Map.of());
    }

    public static TaskLifecycleEvent failed(String taskKey, String agentName, String error) {
        return new TaskLifecycleEvent(taskKey, agentName, TaskEventType.FAILED,
                Map.of("error", error != null ? error : "unknown error"));
    }
}
