package com.crewflow.crewflow_backend.guardrail;

/**
 * Either a row count or the reason it could not be obtained.
 */
public record CountResult(long value, String error) {

    public static CountResult of(long value) {
        return new CountResult(value, null);
    }

    public static CountResult failed(String error) {
        return new CountResult(-1L, error != null ? error : "unknown error");
    }

    public boolean ok() {
        return error == null;
    }
}
