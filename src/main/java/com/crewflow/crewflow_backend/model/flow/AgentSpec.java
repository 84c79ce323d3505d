package com.crewflow.crewflow_backend.model.flow;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentSpec {

    private String role;
    private String goal;
    private String backstory;
    private String llm;

    /** Guardrail retry budget for every task this agent runs, unless the task overrides it. */
    @JsonProperty("max_retry_limit")
    private Integer maxRetryLimit;

    // Engine-specific settings (tools, memory, verbose...) pass through untouched
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
