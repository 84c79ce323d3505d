package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CompanyNameNotNullGuardrail implements Guardrail {

    private final CountProbe probe;

    @Override
    public String supportedType() {
        return "company_name_not_null";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        CountResult total = probe.count("data_processing total", RecordCountSource::countTotal);
        if (!total.ok()) {
            return GuardrailResult.reject("Error checking company names: " + total.error());
        }
        if (total.value() == 0) {
            return GuardrailResult.reject("No records found in the database. Please ensure data is loaded.");
        }
        CountResult missing = probe.count("missing company_name", RecordCountSource::countMissingCompanyName);
        if (!missing.ok()) {
            return GuardrailResult.reject("Error checking company names: " + missing.error());
        }
        if (missing.value() > 0) {
            return GuardrailResult.reject("There are " + missing.value()
                    + " records with null company_name in the database. Please fix these records.");
        }
        return GuardrailResult.accept("All records have non-null company_name values.");
    }
}
