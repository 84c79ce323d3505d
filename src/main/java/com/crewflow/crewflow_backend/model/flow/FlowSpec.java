package com.crewflow.crewflow_backend.model.flow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Topology section of a flow definition. Which ordering field is read depends on {@code type}:
 * <ul>
 *   <li>sequential  → {@code tasks}: ordered task names</li>
 *   <li>parallel    → {@code parallel_tasks}: groups of task names, each group runs concurrently</li>
 *   <li>conditional → {@code conditional_tasks}: condition label → task names</li>
 * </ul>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowSpec {

    private String type;

    private List<String> tasks;

    @JsonProperty("parallel_tasks")
    private List<List<String>> parallelTasks;

    @JsonProperty("conditional_tasks")
    private Map<String, List<String>> conditionalTasks;
}
