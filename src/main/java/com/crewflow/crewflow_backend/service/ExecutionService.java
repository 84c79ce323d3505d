package com.crewflow.crewflow_backend.service;

import com.crewflow.crewflow_backend.callback.CallbackManager;
import com.crewflow.crewflow_backend.callback.ObserverHandles;
import com.crewflow.crewflow_backend.engine.AgentEngineRegistry;
import com.crewflow.crewflow_backend.engine.EngineListener;
import com.crewflow.crewflow_backend.engine.EngineResult;
import com.crewflow.crewflow_backend.engine.TaskLifecycleEvent;
import com.crewflow.crewflow_backend.exception.EngineException;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.exception.StateTransitionException;
import com.crewflow.crewflow_backend.flow.FlowValidator;
import com.crewflow.crewflow_backend.guardrail.GuardrailEngine;
import com.crewflow.crewflow_backend.model.domain.ErrorTrace;
import com.crewflow.crewflow_backend.model.domain.Execution;
import com.crewflow.crewflow_backend.model.domain.ExecutionStatus;
import com.crewflow.crewflow_backend.model.domain.ExecutionTrace;
import com.crewflow.crewflow_backend.model.domain.TaskState;
import com.crewflow.crewflow_backend.model.domain.TaskStatus;
import com.crewflow.crewflow_backend.model.domain.TriggerType;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import com.crewflow.crewflow_backend.model.event.ExecutionEventType;
import com.crewflow.crewflow_backend.model.flow.PreparedFlow;
import com.crewflow.crewflow_backend.model.flow.TaskSpec;
import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import com.crewflow.crewflow_backend.tracking.TaskStatusTracker;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for running flows: validates, persists the execution, and drives the engine on
 * the worker pool while task transitions and guardrail verdicts are broadcast to observers.
 */
@Slf4j
@Service
public class ExecutionService {

    private static final int OUTPUT_PREVIEW = 500;

    private final FlowValidator flowValidator;
    private final ExecutionStatusManager statusManager;
    private final TaskStatusTracker taskStatusTracker;
    private final GuardrailEngine guardrailEngine;
    private final CallbackManager callbackManager;
    private final AgentEngineRegistry engineRegistry;
    private final ObjectMapper objectMapper;
    private final TaskExecutor workerPool;
    private final Clock clock;

    private final Map<String, ObserverHandles> activeHandles = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public ExecutionService(FlowValidator flowValidator,
                            ExecutionStatusManager statusManager,
                            TaskStatusTracker taskStatusTracker,
                            GuardrailEngine guardrailEngine,
                            CallbackManager callbackManager,
                            AgentEngineRegistry engineRegistry,
                            ObjectMapper objectMapper,
                            @Qualifier("executionWorkerPool") TaskExecutor workerPool,
                            Clock clock) {
        this.flowValidator = flowValidator;
        this.statusManager = statusManager;
        this.taskStatusTracker = taskStatusTracker;
        this.guardrailEngine = guardrailEngine;
        this.callbackManager = callbackManager;
        this.engineRegistry = engineRegistry;
        this.objectMapper = objectMapper;
        this.workerPool = workerPool;
        this.clock = clock;
    }

    public Execution submit(ExecutionRequest request) {
        return submit(request, TriggerType.API, null);
    }

    /**
     * Validates the flow, stores a PENDING execution and returns it right away; the engine
     * runs on the worker pool. A jobId that already exists returns the stored execution
     * without dispatching it again.
     */
    public Execution submit(ExecutionRequest request, TriggerType triggerType, Long scheduleId) {
        PreparedFlow prepared = flowValidator.prepare(request.definition());

        String jobId = request.jobId() != null && !request.jobId().isBlank()
                ? request.jobId() : UUID.randomUUID().toString();
        if (statusManager.exists(jobId)) {
            return statusManager.get(jobId);
        }

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("definition", objectMapper.convertValue(request.definition(),
                new TypeReference<Map<String, Object>>() {}));
        config.put("inputs", request.inputs() != null ? request.inputs() : Map.of());
        Execution execution = statusManager.create(jobId, config, request.runName(), triggerType, scheduleId);

        Map<String, Object> observerConfig = request.observers() != null ? request.observers() : Map.of();
        try {
            workerPool.execute(() -> runInBackground(jobId, prepared, observerConfig));
        } catch (TaskRejectedException e) {
            log.error("[EXECUTION] Worker pool rejected {}: {}", jobId, e.getMessage());
            statusManager.updateStatus(jobId, ExecutionStatus.FAILED, "Worker pool is full", null);
            throw new EngineException("Execution " + jobId + " could not be scheduled: worker pool is full", e);
        }
        log.info("[EXECUTION] Submitted {} ({} task(s), trigger={})",
                jobId, prepared.orderingPlan().taskKeys().size(), execution.getTriggerType());
        return execution;
    }

    void runInBackground(String jobId, PreparedFlow prepared, Map<String, Object> observerConfig) {
        ObserverHandles handles = callbackManager.init(jobId, observerConfig);
        activeHandles.put(jobId, handles);
        try {
            Map<String, String> taskDefs = new LinkedHashMap<>();
            prepared.orderingPlan().taskKeys().forEach(k -> taskDefs.put(k, prepared.agentNameFor(k)));
            // Cancelled or deleted while still queued: no task rows are seeded
            try {
                statusManager.markRunning(jobId);
            } catch (StateTransitionException | ResourceNotFoundException e) {
                log.warn("[EXECUTION] {} not started: {}", jobId, e.getMessage());
                return;
            }
            try {
                taskStatusTracker.createForJob(jobId, taskDefs);
            } catch (StateTransitionException e) {
                log.warn("[EXECUTION] {} could not seed tasks: {}", jobId, e.getMessage());
                failQuietly(jobId, e.getMessage());
                return;
            }
            callbackManager.dispatch(handles, event(jobId, ExecutionEventType.EXECUTION_STARTED,
                    Map.of("tasks", List.copyOf(taskDefs.keySet()))));

            EngineResult result;
            try {
                result = engineRegistry.active().run(jobId, prepared, new Listener(jobId, prepared, handles));
            } catch (Exception e) {
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("[EXECUTION] Engine failed for {}: {}", jobId, msg, e);
                taskStatusTracker.recordErrorTrace(jobId, null, "ENGINE_ERROR", msg,
                        Map.of("exception", e.getClass().getName()));
                result = EngineResult.failure(msg);
            }

            Execution done = statusManager.finish(jobId, result);
            if (done.getStatus() == ExecutionStatus.COMPLETED) {
                callbackManager.dispatch(handles, event(jobId, ExecutionEventType.EXECUTION_COMPLETED,
                        done.getResult() != null ? done.getResult() : Map.of()));
            } else if (done.getStatus() == ExecutionStatus.FAILED) {
                callbackManager.dispatch(handles, event(jobId, ExecutionEventType.EXECUTION_FAILED,
                        Map.of("error", done.getError() != null ? done.getError() : "")));
            }
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[EXECUTION] {} aborted: {}", jobId, msg, e);
            failQuietly(jobId, msg);
        } finally {
            activeHandles.remove(jobId);
            cancelRequested.remove(jobId);
            callbackManager.cleanup(handles);
        }
    }

    private void failQuietly(String jobId, String message) {
        try {
            taskStatusTracker.failOutstanding(jobId, message);
            statusManager.updateStatus(jobId, ExecutionStatus.FAILED, message, null);
        } catch (Exception inner) {
            log.error("[EXECUTION] Could not mark {} as FAILED: {}", jobId, inner.getMessage());
        }
    }

    public Execution cancel(String jobId) {
        Execution cancelled = statusManager.cancel(jobId);
        ObserverHandles handles = requestStop(jobId);
        if (handles != null) {
            callbackManager.dispatch(handles, event(jobId, ExecutionEventType.EXECUTION_CANCELLED,
                    Map.of("error", cancelled.getError() != null ? cancelled.getError() : "")));
        }
        return cancelled;
    }

    /**
     * Flags a running execution so the engine stops at its next check. The flag is only set while
     * the run is registered; its {@code finally} clears both entries, so nothing outlives the run.
     */
    private ObserverHandles requestStop(String jobId) {
        return activeHandles.computeIfPresent(jobId, (key, handles) -> {
            cancelRequested.add(key);
            return handles;
        });
    }

    private ExecutionEvent event(String jobId, ExecutionEventType type, Map<String, Object> payload) {
        return ExecutionEvent.of(jobId, type, payload, clock.instant());
    }

    public Execution get(String jobId) {
        return statusManager.get(jobId);
    }

    public List<TaskStatus> tasks(String jobId) {
        statusManager.get(jobId);
        return taskStatusTracker.tasksFor(jobId);
    }

    public void delete(String jobId) {
        requestStop(jobId);
        statusManager.deleteCascade(jobId);
    }

    public List<ErrorTrace> errors(String jobId) {
        statusManager.get(jobId);
        return statusManager.errorTraces(jobId);
    }

    public List<ExecutionTrace> traces(String jobId) {
        statusManager.get(jobId);
        return statusManager.traces(jobId);
    }

    // ── Engine callbacks ─────────────────────────────────────────────────────

    private class Listener implements EngineListener {

        private final String jobId;
        private final PreparedFlow prepared;
        private final ObserverHandles handles;

        Listener(String jobId, PreparedFlow prepared, ObserverHandles handles) {
            this.jobId = jobId;
            this.prepared = prepared;
            this.handles = handles;
        }

        @Override
        public void onTaskEvent(TaskLifecycleEvent event) {
            String agent = event.agentName() != null ? event.agentName() : prepared.agentNameFor(event.taskKey());
            Map<String, Object> payload = event.payload() != null ? event.payload() : Map.of();
            switch (event.type()) {
                case STARTED -> broadcast(ExecutionEventType.TASK_STARTED, event.taskKey(), agent, payload);
                case AGENT_STEP -> broadcast(ExecutionEventType.AGENT_STEP, event.taskKey(), agent, payload);
                case TOOL_USAGE -> broadcast(ExecutionEventType.TOOL_USAGE, event.taskKey(), agent, payload);
                case LLM_CALL -> broadcast(ExecutionEventType.LLM_CALL, event.taskKey(), agent, payload);
                case COMPLETED -> taskStatusTracker.transitionQuietly(jobId, event.taskKey(), TaskState.COMPLETED)
                        .ifPresent(row -> broadcast(ExecutionEventType.TASK_COMPLETED, event.taskKey(), agent, payload));
                case FAILED -> {
                    String error = String.valueOf(payload.getOrDefault("error", "Task failed"));
                    taskStatusTracker.transitionQuietly(jobId, event.taskKey(), TaskState.FAILED)
                            .ifPresent(row -> {
                                taskStatusTracker.recordErrorTrace(jobId, event.taskKey(), "TASK_FAILED", error, payload);
                                broadcast(ExecutionEventType.TASK_FAILED, event.taskKey(), agent, payload);
                            });
                }
            }
        }

        @Override
        public GuardrailResult onTaskOutput(String taskKey, TaskOutput output, int attempt) {
            String agent = prepared.agentNameFor(taskKey);
            String text = output.asText(objectMapper);
            broadcast(ExecutionEventType.TASK_OUTPUT, taskKey, agent, Map.of(
                    "attempt", attempt,
                    "output", text.length() > OUTPUT_PREVIEW ? text.substring(0, OUTPUT_PREVIEW) : text));

            TaskSpec task = prepared.tasks().get(taskKey);
            Object rule = task != null ? task.getGuardrail() : null;
            if (rule == null) {
                return GuardrailResult.accept();
            }
            GuardrailResult verdict = guardrailEngine.validate(output, rule);
            if (verdict.valid()) {
                broadcast(ExecutionEventType.GUARDRAIL_PASSED, taskKey, agent,
                        Map.of("attempt", attempt, "feedback", verdict.feedback()));
            } else {
                taskStatusTracker.recordErrorTrace(jobId, taskKey, "GUARDRAIL_REJECTED", verdict.feedback(),
                        Map.of("attempt", attempt));
                broadcast(ExecutionEventType.GUARDRAIL_REJECTED, taskKey, agent,
                        Map.of("attempt", attempt, "feedback", verdict.feedback()));
            }
            return verdict;
        }

        @Override
        public boolean isCancelled() {
            return cancelRequested.contains(jobId);
        }

        private void broadcast(ExecutionEventType type, String taskKey, String agent, Map<String, Object> payload) {
            callbackManager.dispatch(handles, ExecutionEvent.of(jobId, type, taskKey, agent, payload, clock.instant()));
        }
    }
}
