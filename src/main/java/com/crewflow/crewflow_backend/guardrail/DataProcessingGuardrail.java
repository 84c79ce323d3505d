package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Passes once every row of the data_processing table has been processed.
 */
@Component
@RequiredArgsConstructor
public class DataProcessingGuardrail implements Guardrail {

    private final CountProbe probe;

    @Override
    public String supportedType() {
        return "data_processing";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        CountResult total = probe.count("data_processing total", RecordCountSource::countTotal);
        if (!total.ok()) {
            return GuardrailResult.reject("Error checking data processing status: " + total.error());
        }
        if (total.value() == 0) {
            return GuardrailResult.reject("No records found in the database. Please ensure data is loaded.");
        }
        CountResult unprocessed = probe.count("unprocessed", RecordCountSource::countUnprocessed);
        if (!unprocessed.ok()) {
            return GuardrailResult.reject("Error checking data processing status: " + unprocessed.error());
        }
        if (unprocessed.value() > 0) {
            return GuardrailResult.reject("There are still " + unprocessed.value()
                    + " unprocessed records in the database. Please try again later.");
        }
        return GuardrailResult.accept("All data records have been processed successfully.");
    }
}
