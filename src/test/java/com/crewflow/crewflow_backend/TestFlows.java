package com.crewflow.crewflow_backend;

import com.crewflow.crewflow_backend.guardrail.CompanyCountGuardrail;
import com.crewflow.crewflow_backend.guardrail.CompanyNameNotNullGuardrail;
import com.crewflow.crewflow_backend.guardrail.CountProbe;
import com.crewflow.crewflow_backend.guardrail.DataProcessingCountGuardrail;
import com.crewflow.crewflow_backend.guardrail.DataProcessingGuardrail;
import com.crewflow.crewflow_backend.guardrail.EmptyDataProcessingGuardrail;
import com.crewflow.crewflow_backend.guardrail.GuardrailFactory;
import com.crewflow.crewflow_backend.guardrail.MinimumNumberGuardrail;
import com.crewflow.crewflow_backend.guardrail.RecordCountSource;
import com.crewflow.crewflow_backend.model.flow.AgentSpec;
import com.crewflow.crewflow_backend.model.flow.FlowDefinition;
import com.crewflow.crewflow_backend.model.flow.FlowSpec;
import com.crewflow.crewflow_backend.model.flow.TaskSpec;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for flow definitions and a fully wired guardrail factory.
 */
public final class TestFlows {

    private TestFlows() {
    }

    public static AgentSpec agent(String role) {
        AgentSpec agent = new AgentSpec();
        agent.setRole(role);
        agent.setGoal("Help with " + role);
        return agent;
    }

    public static TaskSpec task(String agent, String description) {
        TaskSpec task = new TaskSpec();
        task.setAgent(agent);
        task.setDescription(description);
        task.setExpectedOutput("A short answer");
        return task;
    }

    /** Agent A with tasks T1, T2 run sequentially as {@code sequence}. */
    public static FlowDefinition sequential(String... sequence) {
        Map<String, AgentSpec> agents = new LinkedHashMap<>();
        agents.put("A", agent("researcher"));
        Map<String, TaskSpec> tasks = new LinkedHashMap<>();
        tasks.put("T1", task("A", "First task"));
        tasks.put("T2", task("A", "Second task"));

        FlowSpec flow = new FlowSpec();
        flow.setType("sequential");
        flow.setTasks(List.of(sequence));
        return FlowDefinition.builder().agents(agents).tasks(tasks).flow(flow).build();
    }

    public static GuardrailFactory guardrailFactory(ObjectMapper mapper, RecordCountSource source) {
        CountProbe probe = new CountProbe(source);
        GuardrailFactory factory = new GuardrailFactory(List.of(
                new CompanyCountGuardrail(mapper),
                new MinimumNumberGuardrail(mapper),
                new EmptyDataProcessingGuardrail(probe),
                new DataProcessingCountGuardrail(probe),
                new CompanyNameNotNullGuardrail(probe),
                new DataProcessingGuardrail(probe)));
        factory.init();
        return factory;
    }

    public static String companyList(int count) {
        StringBuilder sb = new StringBuilder("Swiss companies:\n");
        for (int i = 1; i <= count; i++) {
            sb.append(i).append(". Company").append(String.format("%02d", i)).append(" AG - Basel\n");
        }
        return sb.toString();
    }
}
