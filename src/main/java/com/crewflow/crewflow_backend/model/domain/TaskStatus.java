package com.crewflow.crewflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "task_statuses",
        uniqueConstraints = @UniqueConstraint(name = "uk_task_status_job_task", columnNames = {"job_id", "task_key"}))
@Data
public class TaskStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "task_key", nullable = false)
    private String taskKey;

    @Column(name = "agent_name")
    private String agentName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState status = TaskState.RUNNING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
