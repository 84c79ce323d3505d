package com.crewflow.crewflow_backend.model.flow;

import java.util.Map;

/**
 * Validated flow, ready to seed task tracking and to hand to the engine.
 */
public record PreparedFlow(Map<String, AgentSpec> agents,
                           Map<String, TaskSpec> tasks,
                           OrderingPlan orderingPlan) {

    /** Largest retry budget a task or agent may ask for. */
    public static final int MAX_RETRY_LIMIT = 100;

    public AgentSpec agentFor(String taskKey) {
        TaskSpec task = tasks.get(taskKey);
        return task != null ? agents.get(task.getAgent()) : null;
    }

    /**
     * Guardrail retry budget of a task: the task's {@code max_retries}, else its agent's
     * {@code max_retry_limit}, else {@code fallback}; clamped to {@code [0, MAX_RETRY_LIMIT]}.
     */
    public int maxRetries(String taskKey, int fallback) {
        TaskSpec task = tasks.get(taskKey);
        if (task != null && task.getMaxRetries() != null) return clamp(task.getMaxRetries());
        AgentSpec agent = agentFor(taskKey);
        if (agent != null && agent.getMaxRetryLimit() != null) return clamp(agent.getMaxRetryLimit());
        return clamp(fallback);
    }

    private static int clamp(int retries) {
        return Math.min(MAX_RETRY_LIMIT, Math.max(0, retries));
    }

    public String agentNameFor(String taskKey) {
        TaskSpec task = tasks.get(taskKey);
        return task != null ? task.getAgent() : null;
    }
}
