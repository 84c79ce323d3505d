package com.crewflow.crewflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "executions")
@Data
public class Execution {

    // Surrogate storage key; callers address executions by jobId
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, unique = true, updatable = false)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    // Submitted flow definition plus run inputs
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> inputs;

    // Populated only once the execution is terminal
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> result;

    @Column(length = 4000)
    private String error;

    @Column(name = "run_name")
    private String runName;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type")
    private TriggerType triggerType = TriggerType.API;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
