package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// Passes only while the data_processing table has no rows
@Component
@RequiredArgsConstructor
public class EmptyDataProcessingGuardrail implements Guardrail {

    private final CountProbe probe;

    @Override
    public String supportedType() {
        return "empty_data_processing";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        CountResult total = probe.count("data_processing total", RecordCountSource::countTotal);
        if (!total.ok()) {
            return GuardrailResult.reject("Error checking data_processing table: " + total.error());
        }
        if (total.value() > 0) {
            return GuardrailResult.reject("The data_processing table contains " + total.value()
                    + " records. The table must be empty to proceed.");
        }
        return GuardrailResult.accept("The data_processing table is empty as required.");
    }
}
