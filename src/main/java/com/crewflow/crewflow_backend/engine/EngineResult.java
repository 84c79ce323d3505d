package com.crewflow.crewflow_backend.engine;

/**
 * What the engine returns once it stops driving an execution.
 * {@code result} is raw and gets normalised before it is stored.
 */
public record EngineResult(boolean success, Object result, String error) {

    public static EngineResult success(Object result) {
        return new EngineResult(true, result, null);
    }

    public static EngineResult failure(String error) {
        return new EngineResult(false, null, error);
    }
}
