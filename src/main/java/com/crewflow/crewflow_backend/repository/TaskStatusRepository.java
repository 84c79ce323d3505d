package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.TaskState;
import com.crewflow.crewflow_backend.model.domain.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TaskStatusRepository extends JpaRepository<TaskStatus, Long> {

    List<TaskStatus> findByJobIdOrderByIdAsc(String jobId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from TaskStatus t where t.jobId = :jobId and t.taskKey = :taskKey")
    Optional<TaskStatus> findForUpdate(@Param("jobId") String jobId, @Param("taskKey") String taskKey);

    boolean existsByJobIdAndTaskKeyIn(String jobId, Collection<String> taskKeys);

    long countByJobIdAndStatus(String jobId, TaskState status);

    List<TaskStatus> findByJobIdAndStatus(String jobId, TaskState status);

    @Modifying
    @Query("delete from TaskStatus t where t.jobId = :jobId")
    int deleteByJobId(@Param("jobId") String jobId);
}
