package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.exception.ConfigException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class GuardrailFactory {

    private final List<Guardrail> guardrails;
    private final Map<String, Guardrail> registry = new TreeMap<>();

    @PostConstruct
    public void init() {
        guardrails.forEach(g -> registry.put(g.supportedType(), g));
        log.info("[GUARDRAIL] Registered guardrail types: {}", registry.keySet());
    }

    public Guardrail get(String type) {
        Guardrail guardrail = registry.get(type);
        if (guardrail == null) {
            throw new ConfigException("Unknown guardrail type: " + type);
        }
        return guardrail;
    }

    public boolean isSupported(String type) {
        return type != null && registry.containsKey(type);
    }
}
