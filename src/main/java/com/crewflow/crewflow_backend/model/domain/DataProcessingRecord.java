package com.crewflow.crewflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Row of the record table that count-based guardrails inspect.
 * Agents register company numbers here and flip {@code processed} once enriched.
 */
@Entity
@Table(name = "data_processing")
@Data
public class DataProcessingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "che_number", nullable = false, unique = true)
    private String cheNumber;

    @Column(nullable = false)
    private boolean processed = false;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
