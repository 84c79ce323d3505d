package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Passes when the data_processing table holds at least {@code minimum_count} rows (default 0).
 */
@Component
@RequiredArgsConstructor
public class DataProcessingCountGuardrail implements Guardrail {

    private final CountProbe probe;

    @Override
    public String supportedType() {
        return "data_processing_count";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        long minimum = config.integer("minimum_count", 0);
        CountResult total = probe.count("data_processing total", RecordCountSource::countTotal);
        if (!total.ok()) {
            return GuardrailResult.reject("Error checking data processing count: " + total.error());
        }
        if (total.value() >= minimum) {
            return GuardrailResult.accept("Success: The number of records in the data_processing table ("
                    + total.value() + ") meets or exceeds the minimum count (" + minimum + ").");
        }
        return GuardrailResult.reject("Insufficient records: The number of records in the data_processing table ("
                + total.value() + ") is below the minimum count required (" + minimum + ").");
    }
}
