package com.crewflow.crewflow_backend.model.flow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dispatch order derived from the flow section: stages run one after another,
 * tasks inside a concurrent stage may run at the same time.
 */
public record OrderingPlan(FlowType type, List<Stage> stages) {

    public record Stage(String label, List<String> taskKeys, boolean concurrent) {
    }

    /** Every task key the plan dispatches, first occurrence order. */
    public List<String> taskKeys() {
        Set<String> keys = new LinkedHashSet<>();
        stages.forEach(stage -> keys.addAll(stage.taskKeys()));
        return new ArrayList<>(keys);
    }
}
