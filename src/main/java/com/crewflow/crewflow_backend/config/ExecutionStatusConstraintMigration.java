package com.crewflow.crewflow_backend.config;

import com.crewflow.crewflow_backend.model.domain.ExecutionStatus;
import com.crewflow.crewflow_backend.model.domain.TaskState;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Keeps the status check constraints of executions and task_statuses in line with
 * {@link ExecutionStatus} and {@link TaskState}. Needed when a status is added after the tables were created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionStatusConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateStatusConstraints() {
        update("executions", "executions_status_check", ExecutionStatus.values());
        update("task_statuses", "task_statuses_status_check", TaskState.values());
    }

    private void update(String table, String constraint, Enum<?>[] values) {
        try {
            String allowed = String.join("', '", Arrays.stream(values).map(Enum::name).toList());
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD CONSTRAINT " + constraint
                    + " CHECK (status IN ('" + allowed + "'))");
            log.debug("Updated {} to allow {}", constraint, allowed);
        } catch (Exception e) {
            log.warn("Could not update {} (constraint may already be correct): {}", constraint, e.getMessage());
        }
    }
}
