package com.crewflow.crewflow_backend.model.domain;

/**
 * Lifecycle of a single task inside an execution.
 * A task row is created when the task is dispatched, so there is no PENDING state.
 */
public enum TaskState {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
