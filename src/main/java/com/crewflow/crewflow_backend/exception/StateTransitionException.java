package com.crewflow.crewflow_backend.exception;

public class StateTransitionException extends CrewFlowException {

    public StateTransitionException(String message) {
        super(message);
    }

    public StateTransitionException(String subject, Enum<?> from, Enum<?> to) {
        super("Illegal transition for " + subject + ": " + from + " -> " + to);
    }
}
