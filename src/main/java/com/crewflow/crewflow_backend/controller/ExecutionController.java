package com.crewflow.crewflow_backend.controller;

import com.crewflow.crewflow_backend.model.domain.Execution;
import com.crewflow.crewflow_backend.model.domain.TaskStatus;
import com.crewflow.crewflow_backend.service.ExecutionRequest;
import com.crewflow.crewflow_backend.service.ExecutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionService executionService;

    // POST /api/executions: validates and queues a flow run, returns the PENDING execution
    @PostMapping
    public ResponseEntity<ExecutionDetail> submit(@RequestBody ExecutionRequest request) {
        Execution execution = executionService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(execution));
    }

    @GetMapping("/{jobId}")
    public ExecutionDetail get(@PathVariable String jobId) {
        return toDetail(executionService.get(jobId));
    }

    // GET /api/executions/{jobId}/tasks: per-task status in dispatch order
    @GetMapping("/{jobId}/tasks")
    public List<TaskDetail> tasks(@PathVariable String jobId) {
        return executionService.tasks(jobId).stream().map(this::toTask).toList();
    }

    // GET /api/executions/{jobId}/errors: guardrail rejections and task failures, oldest first
    @GetMapping("/{jobId}/errors")
    public List<ErrorDetail> errors(@PathVariable String jobId) {
        return executionService.errors(jobId).stream()
                .map(e -> new ErrorDetail(e.getTaskKey(), e.getErrorType(), e.getErrorMessage(),
                        e.getMetadata(), e.getCreatedAt()))
                .toList();
    }

    @GetMapping("/{jobId}/traces")
    public List<TraceDetail> traces(@PathVariable String jobId) {
        return executionService.traces(jobId).stream()
                .map(t -> new TraceDetail(t.getEventType(), t.getTaskKey(), t.getAgentName(),
                        t.getOutput(), t.getCreatedAt()))
                .toList();
    }

    @PostMapping("/{jobId}/cancel")
    public ExecutionDetail cancel(@PathVariable String jobId) {
        return toDetail(executionService.cancel(jobId));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> delete(@PathVariable String jobId) {
        executionService.delete(jobId);
        return ResponseEntity.noContent().build();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private ExecutionDetail toDetail(Execution e) {
        return new ExecutionDetail(
                e.getJobId(),
                e.getRunName(),
                e.getStatus().name(),
                e.getTriggerType() != null ? e.getTriggerType().name() : null,
                e.getScheduleId(),
                e.getInputs(),
                e.getResult(),
                e.getError(),
                e.getCreatedAt(),
                e.getStartedAt(),
                e.getCompletedAt(),
                durationMs(e.getStartedAt(), e.getCompletedAt()));
    }

    private TaskDetail toTask(TaskStatus t) {
        return new TaskDetail(t.getTaskKey(), t.getAgentName(), t.getStatus().name(),
                t.getStartedAt(), t.getCompletedAt());
    }

    private static Long durationMs(Instant start, Instant end) {
        return start != null && end != null ? Duration.between(start, end).toMillis() : null;
    }

    public record ExecutionDetail(
            String jobId,
            String runName,
            String status,
            String triggerType,
            Long scheduleId,
            Map<String, Object> inputs,
            Map<String, Object> result,
            String error,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt,
            Long durationMs
    ) {}

    public record TaskDetail(
            String taskKey,
            String agentName,
            String status,
            Instant startedAt,
            Instant completedAt
    ) {}

    public record ErrorDetail(
            String taskKey,
            String errorType,
            String errorMessage,
            Map<String, Object> metadata,
            Instant createdAt
    ) {}

    public record TraceDetail(
            String eventType,
            String taskKey,
            String agentName,
            Map<String, Object> output,
            Instant createdAt
    ) {}
}
