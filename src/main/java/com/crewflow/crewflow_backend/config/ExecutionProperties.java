package com.crewflow.crewflow_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code crewflow.execution.*} settings.
 */
@Data
@ConfigurationProperties(prefix = "crewflow.execution")
public class ExecutionProperties {

    /** When false, one FAILED task fails the whole execution. */
    private boolean allowPartialFailure = false;

    private int workerPoolSize = 4;

    private int queueCapacity = 100;

    /** Guardrail retries per task when neither the task nor its agent set one. */
    private int defaultMaxRetries = 2;

    /** Upper bound for draining observer lanes at the end of an execution. */
    private long callbackDrainTimeoutMs = 10_000;
}
