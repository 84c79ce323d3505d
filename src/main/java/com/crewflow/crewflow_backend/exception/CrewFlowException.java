package com.crewflow.crewflow_backend.exception;

/**
 * Root of every error raised by the orchestration core.
 */
public class CrewFlowException extends RuntimeException {

    public CrewFlowException(String message) {
        super(message);
    }

    public CrewFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
