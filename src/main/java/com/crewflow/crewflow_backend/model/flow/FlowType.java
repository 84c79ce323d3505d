package com.crewflow.crewflow_backend.model.flow;

import java.util.Arrays;
import java.util.Optional;

public enum FlowType {
    SEQUENTIAL,
    PARALLEL,
    CONDITIONAL;

    public static Optional<FlowType> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
