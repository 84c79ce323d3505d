package com.crewflow.crewflow_backend.exception;

/**
 * Invalid flow, job or schedule configuration. Never retried.
 */
public class ConfigException extends CrewFlowException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
