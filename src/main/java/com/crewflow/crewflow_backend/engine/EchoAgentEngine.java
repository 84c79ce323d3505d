package com.crewflow.crewflow_backend.engine;

import com.crewflow.crewflow_backend.config.ExecutionProperties;
import com.crewflow.crewflow_backend.model.flow.OrderingPlan;
import com.crewflow.crewflow_backend.model.flow.PreparedFlow;
import com.crewflow.crewflow_backend.model.flow.TaskSpec;
import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local engine that needs no LLM: every attempt of a task "answers" with the task's
 * {@code echo_output} setting, or with its description, plus the guardrail feedback of
 * the previous attempt. Stages run in plan order; tasks of a concurrent stage run together.
 *
 * <pre>
 * "tasks": { "research": { "agent": "analyst", "description": "...", "echo_output": "1. Acme AG\n2. ..." } }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EchoAgentEngine implements AgentEngine {

    private final ExecutionProperties properties;

    @Override
    public String type() {
        return "echo";
    }

    @Override
    public EngineResult run(String jobId, PreparedFlow flow, EngineListener listener) {
        Map<String, Object> outputs = new ConcurrentHashMap<>();
        for (OrderingPlan.Stage stage : flow.orderingPlan().stages()) {
            if (listener.isCancelled()) {
                log.info("[ENGINE] {} cancelled, skipping stage {}", jobId, stage.label());
                break;
            }
            if (stage.concurrent() && stage.taskKeys().size() > 1) {
                List<CompletableFuture<Void>> running = new ArrayList<>();
                for (String taskKey : stage.taskKeys()) {
                    running.add(CompletableFuture.runAsync(() -> runTask(flow, taskKey, listener, outputs)));
                }
                CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
            } else {
                for (String taskKey : stage.taskKeys()) {
                    if (listener.isCancelled()) break;
                    runTask(flow, taskKey, listener, outputs);
                }
            }
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        flow.orderingPlan().taskKeys().forEach(k -> {
            if (outputs.containsKey(k)) ordered.put(k, outputs.get(k));
        });
        return EngineResult.success(ordered);
    }

    private void runTask(PreparedFlow flow, String taskKey, EngineListener listener, Map<String, Object> outputs) {
        TaskSpec task = flow.tasks().get(taskKey);
        String agent = flow.agentNameFor(taskKey);
        int maxRetries = flow.maxRetries(taskKey, properties.getDefaultMaxRetries());

        listener.onTaskEvent(TaskLifecycleEvent.of(taskKey, agent, TaskEventType.STARTED));

        String feedback = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            String content = answer(task, feedback);
            listener.onTaskEvent(new TaskLifecycleEvent(taskKey, agent, TaskEventType.AGENT_STEP,
                    Map.of("attempt", attempt, "thought", "Echoing task " + taskKey)));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("content", content);
            body.put("task", taskKey);
            body.put("agent", agent);
            body.put("attempt", attempt);

            GuardrailResult verdict = listener.onTaskOutput(taskKey, TaskOutput.structured(body), attempt);
            if (verdict.valid()) {
                outputs.put(taskKey, content);
                listener.onTaskEvent(new TaskLifecycleEvent(taskKey, agent, TaskEventType.COMPLETED,
                        Map.of("output", content, "attempts", attempt)));
                return;
            }
            feedback = verdict.feedback();
        }
        listener.onTaskEvent(TaskLifecycleEvent.failed(taskKey, agent,
                "Guardrail validation failed after " + (maxRetries + 1) + " attempt(s): " + feedback));
    }

    private static String answer(TaskSpec task, String feedback) {
        Object configured = task.getExtra().get("echo_output");
        String base = configured != null ? String.valueOf(configured)
                : task.getDescription() != null ? task.getDescription() : "";
        return feedback == null ? base : base + "\n\nPrevious feedback: " + feedback;
    }
}
