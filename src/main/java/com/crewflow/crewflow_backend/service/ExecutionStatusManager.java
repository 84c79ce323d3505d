package com.crewflow.crewflow_backend.service;

import com.crewflow.crewflow_backend.config.ExecutionProperties;
import com.crewflow.crewflow_backend.engine.EngineResult;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.exception.StateTransitionException;
import com.crewflow.crewflow_backend.model.domain.ErrorTrace;
import com.crewflow.crewflow_backend.model.domain.Execution;
import com.crewflow.crewflow_backend.model.domain.ExecutionStatus;
import com.crewflow.crewflow_backend.model.domain.ExecutionTrace;
import com.crewflow.crewflow_backend.model.domain.TriggerType;
import com.crewflow.crewflow_backend.repository.ErrorTraceRepository;
import com.crewflow.crewflow_backend.repository.ExecutionRepository;
import com.crewflow.crewflow_backend.repository.ExecutionTraceRepository;
import com.crewflow.crewflow_backend.repository.TaskStatusRepository;
import com.crewflow.crewflow_backend.tracking.TaskStatusTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution state machine: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}.
 * Terminal executions only change by being deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionStatusManager {

    private final ExecutionRepository executionRepository;
    private final TaskStatusRepository taskStatusRepository;
    private final ErrorTraceRepository errorTraceRepository;
    private final ExecutionTraceRepository executionTraceRepository;
    private final TaskStatusTracker taskStatusTracker;
    private final ExecutionProperties properties;
    private final Clock clock;

    public Execution create(String jobId, Map<String, Object> config) {
        return create(jobId, config, null, TriggerType.API, null);
    }

    /**
     * Creates a PENDING execution. Calling it again with the same jobId returns the stored row unchanged.
     */
    public Execution create(String jobId, Map<String, Object> config, String runName,
                            TriggerType triggerType, Long scheduleId) {
        Optional<Execution> existing = executionRepository.findByJobId(jobId);
        if (existing.isPresent()) {
            log.info("[EXECUTION] {} already exists, returning it unchanged", jobId);
            return existing.get();
        }
        Execution execution = new Execution();
        execution.setJobId(jobId);
        execution.setStatus(ExecutionStatus.PENDING);
        execution.setInputs(config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>());
        execution.setRunName(runName);
        execution.setTriggerType(triggerType != null ? triggerType : TriggerType.API);
        execution.setScheduleId(scheduleId);
        execution.setCreatedAt(clock.instant());
        try {
            return executionRepository.save(execution);
        } catch (DataIntegrityViolationException e) {
            // Lost a concurrent create for the same jobId
            return executionRepository.findByJobId(jobId).orElseThrow(() -> e);
        }
    }

    @Transactional
    public Execution updateStatus(String jobId, ExecutionStatus status, String message, Object result) {
        Execution execution = executionRepository.findByJobIdForUpdate(jobId)
                .orElseThrow(() -> ResourceNotFoundException.execution(jobId));
        ExecutionStatus current = execution.getStatus();
        if (current.isTerminal() || status == ExecutionStatus.PENDING
                || (current == ExecutionStatus.RUNNING && status == ExecutionStatus.RUNNING)) {
            throw new StateTransitionException("execution " + jobId, current, status);
        }

        Instant now = clock.instant();
        execution.setStatus(status);
        if (status == ExecutionStatus.RUNNING && execution.getStartedAt() == null) {
            execution.setStartedAt(now);
        }
        if (status.isTerminal()) {
            Instant createdAt = execution.getCreatedAt();
            execution.setCompletedAt(createdAt != null && !now.isAfter(createdAt) ? createdAt.plusMillis(1) : now);
        }
        if (message != null && (status == ExecutionStatus.FAILED || status == ExecutionStatus.CANCELLED)) {
            execution.setError(message.length() > 4000 ? message.substring(0, 4000) : message);
        }
        if (result != null) {
            execution.setResult(normalizeResult(result));
        }
        log.info("[EXECUTION] {}: {} -> {}", jobId, current, status);
        return executionRepository.save(execution);
    }

    public Execution markRunning(String jobId) {
        return updateStatus(jobId, ExecutionStatus.RUNNING, null, null);
    }

    public Execution cancel(String jobId) {
        return updateStatus(jobId, ExecutionStatus.CANCELLED, "Execution cancelled", null);
    }

    /**
     * Settles the terminal status once the engine has returned. Executions that are already
     * terminal (typically CANCELLED) are returned untouched.
     */
    public Execution finish(String jobId, EngineResult engineResult) {
        Execution execution = get(jobId);
        if (execution.getStatus().isTerminal()) {
            log.info("[EXECUTION] {} already {}, keeping it", jobId, execution.getStatus());
            return execution;
        }

        if (!engineResult.success()) {
            taskStatusTracker.failOutstanding(jobId, "execution failed");
            return settle(jobId, ExecutionStatus.FAILED, engineResult.error(), null);
        }

        List<String> stragglers = taskStatusTracker.failOutstanding(jobId, "never reported completion");
        stragglers.forEach(taskKey -> taskStatusTracker.recordErrorTrace(jobId, taskKey, "TASK_INCOMPLETE",
                "Task never reported completion", Map.of()));

        if (taskStatusTracker.anyFailed(jobId) && !properties.isAllowPartialFailure()) {
            return settle(jobId, ExecutionStatus.FAILED, "One or more tasks failed", engineResult.result());
        }
        return settle(jobId, ExecutionStatus.COMPLETED, null, engineResult.result());
    }

    private Execution settle(String jobId, ExecutionStatus status, String message, Object result) {
        try {
            return updateStatus(jobId, status, message, result);
        } catch (StateTransitionException e) {
            // Cancelled while finishing
            log.info("[EXECUTION] {} not moved to {}: {}", jobId, status, e.getMessage());
            return get(jobId);
        }
    }

    @Transactional(readOnly = true)
    public Execution get(String jobId) {
        return executionRepository.findByJobId(jobId)
                .orElseThrow(() -> ResourceNotFoundException.execution(jobId));
    }

    public boolean exists(String jobId) {
        return executionRepository.existsByJobId(jobId);
    }

    @Transactional(readOnly = true)
    public List<ErrorTrace> errorTraces(String jobId) {
        return errorTraceRepository.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    @Transactional(readOnly = true)
    public List<ExecutionTrace> traces(String jobId) {
        return executionTraceRepository.findByJobIdOrderByIdAsc(jobId);
    }

    /** Deletes the execution with its task statuses, error traces and execution traces. */
    @Transactional
    public void deleteCascade(String jobId) {
        Execution execution = executionRepository.findByJobIdForUpdate(jobId)
                .orElseThrow(() -> ResourceNotFoundException.execution(jobId));
        int traces = executionTraceRepository.deleteByJobId(jobId);
        int errors = errorTraceRepository.deleteByJobId(jobId);
        int tasks = taskStatusRepository.deleteByJobId(jobId);
        executionRepository.delete(execution);
        log.info("[EXECUTION] Deleted {} with {} task(s), {} error trace(s), {} trace(s)",
                jobId, tasks, errors, traces);
    }

    /**
     * Wraps any engine result into a JSON object: maps are kept, strings and numbers go under
     * {@code value}, lists under {@code items}, booleans under {@code success}.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeResult(Object result) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (result instanceof Map<?, ?> map) {
            normalized.putAll((Map<String, Object>) map);
        } else if (result instanceof String || result instanceof Number) {
            normalized.put("value", result);
        } else if (result instanceof Collection<?> items) {
            normalized.put("items", new ArrayList<>(items));
        } else if (result instanceof Object[] array) {
            normalized.put("items", Arrays.asList(array));
        } else if (result instanceof Boolean flag) {
            normalized.put("success", flag);
        } else {
            normalized.put("value", String.valueOf(result));
        }
        return normalized;
    }
}
