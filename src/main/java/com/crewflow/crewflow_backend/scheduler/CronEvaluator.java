package com.crewflow.crewflow_backend.scheduler;

import com.crewflow.crewflow_backend.exception.ConfigException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Next-fire-time computation for schedule cron expressions.
 * Accepts 5-field Unix cron ({@code "0 9 * * MON-FRI"}), 6-field Spring cron with seconds,
 * and macros such as {@code @hourly} or {@code @daily}.
 */
@Component
public class CronEvaluator {

    private final ZoneId zone;

    public CronEvaluator(@Value("${crewflow.scheduler.zone:UTC}") ZoneId zone) {
        this.zone = zone;
    }

    /** First fire time strictly after {@code from}. */
    public Instant next(String expression, Instant from) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(from, zone));
        if (next == null) {
            throw new ConfigException("Cron expression never fires: " + expression);
        }
        return next.toInstant();
    }

    public void validate(String expression) {
        parse(expression);
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigException("Cron expression must not be empty");
        }
        String trimmed = expression.trim();
        String normalized;
        if (trimmed.startsWith("@")) {
            normalized = trimmed;
        } else {
            int fields = trimmed.split("\\s+").length;
            if (fields == 5) {
                normalized = "0 " + trimmed;
            } else if (fields == 6) {
                normalized = trimmed;
            } else {
                throw new ConfigException("Invalid cron expression (expected 5 or 6 fields): " + expression);
            }
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid cron expression: " + expression + " (" + e.getMessage() + ")");
        }
    }
}
