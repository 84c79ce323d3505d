package com.crewflow.crewflow_backend.flow;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.guardrail.GuardrailConfig;
import com.crewflow.crewflow_backend.guardrail.GuardrailFactory;
import com.crewflow.crewflow_backend.model.flow.AgentSpec;
import com.crewflow.crewflow_backend.model.flow.FlowDefinition;
import com.crewflow.crewflow_backend.model.flow.FlowSpec;
import com.crewflow.crewflow_backend.model.flow.FlowType;
import com.crewflow.crewflow_backend.model.flow.OrderingPlan;
import com.crewflow.crewflow_backend.model.flow.PreparedFlow;
import com.crewflow.crewflow_backend.model.flow.TaskSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a {@link FlowDefinition} before anything is persisted and turns it into a {@link PreparedFlow}.
 * No I/O; the first problem found is raised as a {@link ConfigException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowValidator {

    private final GuardrailFactory guardrailFactory;
    private final ObjectMapper objectMapper;

    public PreparedFlow prepare(FlowDefinition definition) {
        if (definition == null) {
            throw new ConfigException("Missing or empty required section: agents");
        }
        Map<String, AgentSpec> agents = definition.getAgents();
        Map<String, TaskSpec> tasks = definition.getTasks();
        FlowSpec flow = definition.getFlow();

        if (agents == null || agents.isEmpty()) throw missing("agents");
        if (tasks == null || tasks.isEmpty()) throw missing("tasks");
        if (flow == null || isEmpty(flow)) throw missing("flow");

        agents.forEach((name, agent) -> {
            if (agent != null) checkRetryLimit("Agent " + name + " max_retry_limit", agent.getMaxRetryLimit());
        });
        tasks.forEach((taskKey, task) -> {
            checkAgent(taskKey, task, agents);
            checkRetryLimit("Task " + taskKey + " max_retries", task.getMaxRetries());
            checkGuardrail(taskKey, task);
        });

        FlowType type = FlowType.fromValue(flow.getType())
                .orElseThrow(() -> new ConfigException("Invalid flow type: " + flow.getType()));

        OrderingPlan plan = switch (type) {
            case SEQUENTIAL -> sequential(flow, tasks);
            case PARALLEL -> parallel(flow, tasks);
            case CONDITIONAL -> conditional(flow, tasks);
        };

        log.debug("[FLOW] Prepared {} flow with {} stage(s), tasks={}", type, plan.stages().size(), plan.taskKeys());
        return new PreparedFlow(
                Collections.unmodifiableMap(new LinkedHashMap<>(agents)),
                Collections.unmodifiableMap(new LinkedHashMap<>(tasks)),
                plan);
    }

    // ── Section checks ────────────────────────────────────────────────────────

    private void checkAgent(String taskKey, TaskSpec task, Map<String, AgentSpec> agents) {
        if (task == null || task.getAgent() == null || task.getAgent().isBlank()) {
            throw new ConfigException("Task " + taskKey + " must be assigned to an agent");
        }
        if (!agents.containsKey(task.getAgent())) {
            throw new ConfigException("Task " + taskKey + " assigned to undefined agent: " + task.getAgent());
        }
    }

    private static void checkRetryLimit(String field, Integer value) {
        if (value != null && (value < 0 || value > PreparedFlow.MAX_RETRY_LIMIT)) {
            throw new ConfigException(field + " must be between 0 and " + PreparedFlow.MAX_RETRY_LIMIT + ", got " + value);
        }
    }

    private void checkGuardrail(String taskKey, TaskSpec task) {
        Object rule = task.getGuardrail();
        if (rule == null || (rule instanceof String s && s.isBlank())) return;
        GuardrailConfig config;
        try {
            config = GuardrailConfig.parse(rule, objectMapper);
        } catch (ConfigException e) {
            throw new ConfigException("Task " + taskKey + " has an invalid guardrail: " + e.getMessage());
        }
        if (!guardrailFactory.isSupported(config.type())) {
            throw new ConfigException("Task " + taskKey + " uses unknown guardrail type: " + config.type());
        }
    }

    // ── Ordering plans ───────────────────────────────────────────────────────

    private OrderingPlan sequential(FlowSpec flow, Map<String, TaskSpec> tasks) {
        List<String> sequence = flow.getTasks();
        if (sequence == null || sequence.isEmpty()) {
            throw new ConfigException("Sequential flow must define tasks sequence");
        }
        List<OrderingPlan.Stage> stages = new ArrayList<>();
        for (String taskKey : sequence) {
            if (!tasks.containsKey(taskKey)) {
                throw new ConfigException("Undefined task in flow sequence: " + taskKey);
            }
            stages.add(new OrderingPlan.Stage(taskKey, List.of(taskKey), false));
        }
        return new OrderingPlan(FlowType.SEQUENTIAL, stages);
    }

    private OrderingPlan parallel(FlowSpec flow, Map<String, TaskSpec> tasks) {
        List<List<String>> groups = flow.getParallelTasks();
        if (groups == null || groups.isEmpty()) {
            throw new ConfigException("Parallel flow must define parallel task groups");
        }
        List<OrderingPlan.Stage> stages = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            List<String> group = groups.get(i);
            if (group == null || group.isEmpty()) {
                throw new ConfigException("Parallel task group " + i + " must not be empty");
            }
            for (String taskKey : group) {
                if (!tasks.containsKey(taskKey)) {
                    throw new ConfigException("Undefined task in parallel group: " + taskKey);
                }
            }
            stages.add(new OrderingPlan.Stage("group-" + i, List.copyOf(group), true));
        }
        return new OrderingPlan(FlowType.PARALLEL, stages);
    }

    private OrderingPlan conditional(FlowSpec flow, Map<String, TaskSpec> tasks) {
        Map<String, List<String>> branches = flow.getConditionalTasks();
        if (branches == null || branches.isEmpty()) {
            throw new ConfigException("Conditional flow must define conditional tasks");
        }
        List<OrderingPlan.Stage> stages = new ArrayList<>();
        branches.forEach((condition, branch) -> {
            if (branch == null || branch.isEmpty()) {
                throw new ConfigException("Tasks for condition " + condition + " must not be empty");
            }
            for (String taskKey : branch) {
                if (!tasks.containsKey(taskKey)) {
                    throw new ConfigException("Undefined task in conditional flow: " + taskKey);
                }
            }
            stages.add(new OrderingPlan.Stage(condition, List.copyOf(branch), false));
        });
        return new OrderingPlan(FlowType.CONDITIONAL, stages);
    }

    private static boolean isEmpty(FlowSpec flow) {
        return (flow.getType() == null || flow.getType().isBlank())
                && flow.getTasks() == null
                && flow.getParallelTasks() == null
                && flow.getConditionalTasks() == null;
    }

    private static ConfigException missing(String section) {
        return new ConfigException("Missing or empty required section: " + section);
    }
}
