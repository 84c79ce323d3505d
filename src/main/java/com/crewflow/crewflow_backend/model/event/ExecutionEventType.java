package com.crewflow.crewflow_backend.model.event;

public enum ExecutionEventType {
    EXECUTION_STARTED,
    TASK_STARTED,
    AGENT_STEP,
    TOOL_USAGE,
    LLM_CALL,
    TASK_OUTPUT,
    GUARDRAIL_PASSED,
    GUARDRAIL_REJECTED,
    TASK_COMPLETED,
    TASK_FAILED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_CANCELLED
}
