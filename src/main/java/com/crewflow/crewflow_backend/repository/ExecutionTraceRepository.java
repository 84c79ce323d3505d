package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.ExecutionTrace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ExecutionTraceRepository extends JpaRepository<ExecutionTrace, Long> {

    List<ExecutionTrace> findByJobIdOrderByIdAsc(String jobId);

    @Modifying
    @Query("delete from ExecutionTrace t where t.jobId = :jobId")
    int deleteByJobId(@Param("jobId") String jobId);
}
