package com.crewflow.crewflow_backend.exception;

/**
 * The agent engine could not run or finish an execution.
 */
public class EngineException extends CrewFlowException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
