package com.crewflow.crewflow_backend.exception;

public class ResourceNotFoundException extends CrewFlowException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException execution(String jobId) {
        return new ResourceNotFoundException("Execution not found: " + jobId);
    }

    public static ResourceNotFoundException task(String jobId, String taskKey) {
        return new ResourceNotFoundException("Task " + taskKey + " not found for execution " + jobId);
    }

    public static ResourceNotFoundException schedule(Long id) {
        return new ResourceNotFoundException("Schedule not found: " + id);
    }
}
