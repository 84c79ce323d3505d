package com.crewflow.crewflow_backend.engine;

import com.crewflow.crewflow_backend.model.flow.PreparedFlow;

/**
 * External agent-execution engine. Runs the tasks of a prepared flow, reports progress through
 * the listener and returns when no more task events will follow.
 */
public interface AgentEngine {

    /** Value of {@code crewflow.engine.type} that selects this engine. */
    String type();

    EngineResult run(String jobId, PreparedFlow flow, EngineListener listener);
}
