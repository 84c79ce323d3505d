package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.Execution;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ExecutionRepository extends JpaRepository<Execution, Long> {

    Optional<Execution> findByJobId(String jobId);

    // Row lock for status transitions; only meaningful inside a transaction
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Execution e where e.jobId = :jobId")
    Optional<Execution> findByJobIdForUpdate(@Param("jobId") String jobId);

    boolean existsByJobId(String jobId);
}
