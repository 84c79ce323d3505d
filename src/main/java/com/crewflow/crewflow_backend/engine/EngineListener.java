package com.crewflow.crewflow_backend.engine;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;

/**
 * Callback surface the orchestration core hands to an {@link AgentEngine}.
 * May be called from several engine threads at once.
 */
public interface EngineListener {

    void onTaskEvent(TaskLifecycleEvent event);

    /**
     * Reports one attempt's output. A rejection carries feedback the engine should feed
     * into the next attempt while the task stays RUNNING.
     */
    GuardrailResult onTaskOutput(String taskKey, TaskOutput output, int attempt);

    /** True once the execution was cancelled; engines should stop starting new work. */
    boolean isCancelled();
}
