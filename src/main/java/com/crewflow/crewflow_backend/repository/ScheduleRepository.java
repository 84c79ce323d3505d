package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    @Query("select s from Schedule s where s.active = true and s.nextRunAt is not null and s.nextRunAt <= :now order by s.nextRunAt asc")
    List<Schedule> findDue(@Param("now") Instant now);

    List<Schedule> findAllByOrderByCreatedAtDesc();

    /**
     * Compare-and-set claim of one due occurrence. Only the caller that still sees
     * {@code expected} as the stored next run gets 1 back; everyone else gets 0.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Schedule s set s.nextRunAt = :next, s.lastRunAt = :now, s.updatedAt = :now "
            + "where s.id = :id and s.active = true and s.nextRunAt = :expected")
    int claim(@Param("id") Long id,
              @Param("expected") Instant expected,
              @Param("next") Instant next,
              @Param("now") Instant now);
}
