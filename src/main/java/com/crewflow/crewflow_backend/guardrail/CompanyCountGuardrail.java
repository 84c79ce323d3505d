package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks that the output names at least {@code min_companies} distinct companies.
 * <pre>{ "type": "company_count", "min_companies": 50 }</pre>
 * {@code minimum_count} is accepted as an alias.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompanyCountGuardrail implements Guardrail {

    static final long DEFAULT_MINIMUM = 50;

    private final ObjectMapper objectMapper;

    @Override
    public String supportedType() {
        return "company_count";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        long minimum = config.has("min_companies")
                ? config.integer("min_companies", DEFAULT_MINIMUM)
                : config.integer("minimum_count", DEFAULT_MINIMUM);

        String text = output != null ? output.asText(objectMapper) : "";
        if (text.isBlank()) {
            return GuardrailResult.reject("No content found in the output. Please provide a list of at least "
                    + minimum + " company names.");
        }

        List<String> companies = CompanyNameExtractor.extract(text);
        log.debug("[GUARDRAIL] company_count found {} companies (minimum {})", companies.size(), minimum);
        if (companies.size() >= minimum) {
            return GuardrailResult.accept();
        }
        return GuardrailResult.reject("Your response only includes " + companies.size()
                + " companies, but at least " + minimum
                + " are required. Please try again and provide more company names.");
    }
}
