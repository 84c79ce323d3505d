package com.crewflow.crewflow_backend.model.guardrail;

/**
 * Outcome of one guardrail validation attempt. On rejection {@code feedback}
 * is handed back to the engine as corrective input for the next attempt.
 */
public record GuardrailResult(boolean valid, String feedback) {

    public static GuardrailResult accept() {
        return new GuardrailResult(true, "");
    }

    public static GuardrailResult accept(String note) {
        return new GuardrailResult(true, note != null ? note : "");
    }

    public static GuardrailResult reject(String feedback) {
        return new GuardrailResult(false, feedback != null ? feedback : "");
    }
}
