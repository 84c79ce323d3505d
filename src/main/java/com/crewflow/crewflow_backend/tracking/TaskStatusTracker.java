package com.crewflow.crewflow_backend.tracking;

import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.exception.StateTransitionException;
import com.crewflow.crewflow_backend.model.domain.ErrorTrace;
import com.crewflow.crewflow_backend.model.domain.TaskState;
import com.crewflow.crewflow_backend.model.domain.TaskStatus;
import com.crewflow.crewflow_backend.repository.ErrorTraceRepository;
import com.crewflow.crewflow_backend.repository.TaskStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-task state machine: {@code RUNNING -> COMPLETED | FAILED}, terminal states are final.
 * Each transition runs in its own transaction with the task row locked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStatusTracker {

    private final TaskStatusRepository taskStatusRepository;
    private final ErrorTraceRepository errorTraceRepository;
    private final Clock clock;

    /**
     * Seeds one RUNNING row per task key. Refuses to write anything when the
     * execution already has a row for any of the keys.
     *
     * @param taskDefs task key → agent name (agent may be null), iteration order kept
     */
    @Transactional
    public List<TaskStatus> createForJob(String jobId, Map<String, String> taskDefs) {
        if (taskDefs.isEmpty()) return List.of();
        if (taskStatusRepository.existsByJobIdAndTaskKeyIn(jobId, taskDefs.keySet())) {
            throw new StateTransitionException("Task statuses already exist for execution " + jobId);
        }
        Instant now = clock.instant();
        List<TaskStatus> rows = new ArrayList<>();
        taskDefs.forEach((taskKey, agentName) -> {
            TaskStatus row = new TaskStatus();
            row.setJobId(jobId);
            row.setTaskKey(taskKey);
            row.setAgentName(agentName);
            row.setStatus(TaskState.RUNNING);
            row.setStartedAt(now);
            rows.add(row);
        });
        List<TaskStatus> saved = taskStatusRepository.saveAll(rows);
        log.info("[TRACKER] Created {} task status row(s) for {}", saved.size(), jobId);
        return saved;
    }

    @Transactional
    public TaskStatus transition(String jobId, String taskKey, TaskState newStatus) {
        TaskStatus row = taskStatusRepository.findForUpdate(jobId, taskKey)
                .orElseThrow(() -> ResourceNotFoundException.task(jobId, taskKey));
        TaskState current = row.getStatus();
        if (current.isTerminal() || newStatus == TaskState.RUNNING) {
            throw new StateTransitionException("task " + taskKey + " of " + jobId, current, newStatus);
        }
        row.setStatus(newStatus);
        row.setCompletedAt(clock.instant());
        log.info("[TRACKER] {} / {}: {} -> {}", jobId, taskKey, current, newStatus);
        return taskStatusRepository.save(row);
    }

    /**
     * Engine-facing variant of {@link #transition}: an illegal transition or an unknown task
     * is logged and ignored. The result is present only when the row actually changed.
     */
    @Transactional
    public Optional<TaskStatus> transitionQuietly(String jobId, String taskKey, TaskState newStatus) {
        try {
            return Optional.of(transition(jobId, taskKey, newStatus));
        } catch (StateTransitionException | ResourceNotFoundException e) {
            log.warn("[TRACKER] Ignoring {}: {}", newStatus, e.getMessage());
        }
        return Optional.empty();
    }

    @Transactional(readOnly = true)
    public boolean allTerminal(String jobId) {
        List<TaskStatus> rows = taskStatusRepository.findByJobIdOrderByIdAsc(jobId);
        return !rows.isEmpty() && rows.stream().allMatch(t -> t.getStatus().isTerminal());
    }

    @Transactional(readOnly = true)
    public List<TaskStatus> tasksFor(String jobId) {
        return taskStatusRepository.findByJobIdOrderByIdAsc(jobId);
    }

    @Transactional(readOnly = true)
    public boolean anyFailed(String jobId) {
        return taskStatusRepository.countByJobIdAndStatus(jobId, TaskState.FAILED) > 0;
    }

    /** Fails every task of the execution that is still RUNNING; returns the keys that were failed. */
    @Transactional
    public List<String> failOutstanding(String jobId, String reason) {
        List<String> failed = new ArrayList<>();
        Instant now = clock.instant();
        for (TaskStatus row : taskStatusRepository.findByJobIdAndStatus(jobId, TaskState.RUNNING)) {
            row.setStatus(TaskState.FAILED);
            row.setCompletedAt(now);
            taskStatusRepository.save(row);
            failed.add(row.getTaskKey());
        }
        if (!failed.isEmpty()) {
            log.warn("[TRACKER] Failed outstanding task(s) {} of {}: {}", failed, jobId, reason);
        }
        return failed;
    }

    /**
     * Appends an error trace. Runs in its own transaction and never throws, so a
     * failing trace write cannot undo the transition that caused it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordErrorTrace(String jobId, String taskKey, String errorType,
                                 String message, Map<String, Object> metadata) {
        try {
            ErrorTrace trace = new ErrorTrace();
            trace.setJobId(jobId);
            trace.setTaskKey(taskKey);
            trace.setErrorType(errorType);
            trace.setErrorMessage(truncate(message, 4000));
            trace.setMetadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of());
            trace.setCreatedAt(clock.instant());
            errorTraceRepository.save(trace);
        } catch (Exception e) {
            log.error("[TRACKER] Could not record error trace for {} / {}: {}", jobId, taskKey, e.getMessage());
        }
    }

    private static String truncate(String text, int max) {
        if (text == null || text.length() <= max) return text;
        return text.substring(0, max);
    }
}
