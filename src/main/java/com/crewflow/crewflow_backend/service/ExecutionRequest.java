package com.crewflow.crewflow_backend.service;

import com.crewflow.crewflow_backend.model.flow.FlowDefinition;

import java.util.Map;

/**
 * Body of {@code POST /api/executions}; schedules store the same shape as their job config.
 *
 * @param jobId      optional caller-chosen id; submitting the same id twice returns the first execution
 * @param observers  per-execution observer settings, e.g. {@code {"disabled_observers": ["tracing"]}}
 */
public record ExecutionRequest(String jobId,
                               String runName,
                               FlowDefinition definition,
                               Map<String, Object> inputs,
                               Map<String, Object> observers) {
}
