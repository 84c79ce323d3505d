package com.crewflow.crewflow_backend.scheduler;

import com.crewflow.crewflow_backend.exception.ConfigException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class CronEvaluatorTest {

    private final CronEvaluator evaluator = new CronEvaluator(ZoneOffset.UTC);

    @Test
    public void shouldEvaluateFiveFieldExpression() {
        Instant next = evaluator.next("0 9 * * *", Instant.parse("2026-03-01T08:30:00Z"));

        Assertions.assertEquals(Instant.parse("2026-03-01T09:00:00Z"), next);
    }

    @Test
    public void shouldReturnTimeStrictlyAfterFrom() {
        Instant next = evaluator.next("0 9 * * *", Instant.parse("2026-03-01T09:00:00Z"));

        Assertions.assertEquals(Instant.parse("2026-03-02T09:00:00Z"), next);
    }

    @Test
    public void shouldEvaluateSixFieldExpressionWithSeconds() {
        Instant next = evaluator.next("30 0 * * * *", Instant.parse("2026-03-01T10:00:00Z"));

        Assertions.assertEquals(Instant.parse("2026-03-01T10:00:30Z"), next);
    }

    @Test
    public void shouldEvaluateMacro() {
        Instant next = evaluator.next("@hourly", Instant.parse("2026-03-01T10:15:00Z"));

        Assertions.assertEquals(Instant.parse("2026-03-01T11:00:00Z"), next);
    }

    @Test
    public void shouldEvaluateInConfiguredZone() {
        CronEvaluator zurich = new CronEvaluator(ZoneId.of("Europe/Zurich"));

        Instant next = zurich.next("0 9 * * *", Instant.parse("2026-03-01T07:00:00Z"));

        Assertions.assertEquals(Instant.parse("2026-03-01T08:00:00Z"), next);
    }

    @Test
    public void shouldRejectInvalidExpressions() {
        Assertions.assertThrows(ConfigException.class, () -> evaluator.validate("every morning"));
        Assertions.assertThrows(ConfigException.class, () -> evaluator.validate("61 * * * *"));
        Assertions.assertThrows(ConfigException.class, () -> evaluator.validate(" "));
        Assertions.assertThrows(ConfigException.class, () -> evaluator.validate(null));
    }
}
