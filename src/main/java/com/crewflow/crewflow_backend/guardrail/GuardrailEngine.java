package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a task output through the guardrail named by its rule config.
 * Always answers with a {@link GuardrailResult}; configuration problems and
 * unexpected failures come back as rejections carrying a diagnostic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuardrailEngine {

    private final GuardrailFactory factory;
    private final ObjectMapper objectMapper;

    public GuardrailResult validate(TaskOutput output, Object ruleConfig) {
        GuardrailConfig config;
        try {
            config = GuardrailConfig.parse(ruleConfig, objectMapper);
        } catch (ConfigException e) {
            log.warn("[GUARDRAIL] Invalid guardrail config {}: {}", ruleConfig, e.getMessage());
            return GuardrailResult.reject("Invalid guardrail configuration: " + e.getMessage());
        }
        if (!factory.isSupported(config.type())) {
            log.warn("[GUARDRAIL] Unknown guardrail type: {}", config.type());
            return GuardrailResult.reject("Unknown guardrail type: " + config.type());
        }
        try {
            GuardrailResult result = factory.get(config.type()).validate(output, config);
            log.info("[GUARDRAIL] {} -> valid={}", config.type(), result.valid());
            return result;
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[GUARDRAIL] {} failed: {}", config.type(), msg, e);
            return GuardrailResult.reject("Error during " + config.type() + " validation: " + msg);
        }
    }
}
