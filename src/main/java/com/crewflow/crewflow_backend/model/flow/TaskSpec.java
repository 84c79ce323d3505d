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
public class TaskSpec {

    private String description;

    @JsonProperty("expected_output")
    private String expectedOutput;

    /** Key into {@link FlowDefinition#getAgents()}. */
    private String agent;

    /**
     * Guardrail rule, either a map or a JSON string, e.g.
     * <pre>{ "type": "company_count", "min_companies": 50 }</pre>
     */
    private Object guardrail;

    @JsonProperty("max_retries")
    private Integer maxRetries;

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
