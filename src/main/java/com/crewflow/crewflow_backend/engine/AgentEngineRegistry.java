package com.crewflow.crewflow_backend.engine;

import com.crewflow.crewflow_backend.exception.ConfigException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AgentEngineRegistry {

    private final List<AgentEngine> engines;
    private final Map<String, AgentEngine> registry = new HashMap<>();

    @Value("${crewflow.engine.type:echo}")
    private String engineType;

    @PostConstruct
    public void init() {
        engines.forEach(engine -> registry.put(engine.type(), engine));
        if (!registry.containsKey(engineType)) {
            throw new ConfigException("No agent engine registered for type: " + engineType
                    + " (available: " + registry.keySet() + ")");
        }
        log.info("[ENGINE] Using agent engine '{}'", engineType);
    }

    public AgentEngine active() {
        return registry.get(engineType);
    }
}
