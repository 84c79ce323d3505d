package com.crewflow.crewflow_backend.guardrail;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.ToLongFunction;

/**
 * Runs a count query against the {@link RecordCountSource}. The first failure triggers
 * {@link RecordCountSource#createIfMissing()} and one retry; a second failure is returned as an error result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CountProbe {

    private final RecordCountSource source;

    public CountResult count(String label, ToLongFunction<RecordCountSource> query) {
        try {
            return CountResult.of(query.applyAsLong(source));
        } catch (Exception first) {
            log.warn("[GUARDRAIL] {} count failed ({}), creating table and retrying once", label, first.getMessage());
        }
        try {
            source.createIfMissing();
            return CountResult.of(query.applyAsLong(source));
        } catch (Exception second) {
            String msg = second.getMessage() != null ? second.getMessage() : second.getClass().getSimpleName();
            log.error("[GUARDRAIL] {} count failed after retry: {}", label, msg);
            return CountResult.failed(msg);
        }
    }
}
