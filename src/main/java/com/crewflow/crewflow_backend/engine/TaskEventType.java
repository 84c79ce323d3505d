package com.crewflow.crewflow_backend.engine;

public enum TaskEventType {
    STARTED,
    AGENT_STEP,
    TOOL_USAGE,
    LLM_CALL,
    COMPLETED,
    FAILED
}
