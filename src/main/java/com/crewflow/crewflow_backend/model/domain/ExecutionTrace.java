package com.crewflow.crewflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "execution_traces")
@Data
public class ExecutionTrace {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "agent_name")
    private String agentName;

    @Column(name = "task_key")
    private String taskKey;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> output;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
