package com.crewflow.crewflow_backend.model.flow;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowDefinition {

    @Builder.Default
    private Map<String, AgentSpec> agents = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, TaskSpec> tasks = new LinkedHashMap<>();

    private FlowSpec flow;
}
