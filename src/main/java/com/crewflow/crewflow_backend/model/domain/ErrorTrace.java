package com.crewflow.crewflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "error_traces")
@Data
public class ErrorTrace {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private String jobId;

    @Column(name = "task_key", updatable = false)
    private String taskKey;

    @Column(name = "error_type", nullable = false, updatable = false)
    private String errorType;

    @Column(name = "error_message", length = 4000, updatable = false)
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt = Instant.now();
}
