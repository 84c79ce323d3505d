package com.crewflow.crewflow_backend.callback;

import java.util.Map;

/**
 * Creates a per-execution {@link ExecutionObserver}. Implementations are Spring beans,
 * picked up by the {@link CallbackManager} in {@code @Order} order.
 */
public interface ExecutionObserverFactory {

    String name();

    ExecutionObserver init(String jobId, Map<String, Object> config);
}
