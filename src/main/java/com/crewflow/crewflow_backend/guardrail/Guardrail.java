package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;

public interface Guardrail {

    /** Value of the rule's {@code type} key this guardrail answers to. */
    String supportedType();

    // Returns a rejection with feedback instead of throwing; the engine wraps anything that escapes
    GuardrailResult validate(TaskOutput output, GuardrailConfig config);
}
