package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.ErrorTrace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ErrorTraceRepository extends JpaRepository<ErrorTrace, Long> {

    List<ErrorTrace> findByJobIdOrderByCreatedAtAsc(String jobId);

    @Modifying
    @Query("delete from ErrorTrace e where e.jobId = :jobId")
    int deleteByJobId(@Param("jobId") String jobId);
}
