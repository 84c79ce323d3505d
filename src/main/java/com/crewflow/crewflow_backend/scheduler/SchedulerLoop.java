package com.crewflow.crewflow_backend.scheduler;

import com.crewflow.crewflow_backend.model.domain.Execution;
import com.crewflow.crewflow_backend.model.domain.Schedule;
import com.crewflow.crewflow_backend.model.domain.TriggerType;
import com.crewflow.crewflow_backend.repository.ScheduleRepository;
import com.crewflow.crewflow_backend.service.ExecutionRequest;
import com.crewflow.crewflow_backend.service.ExecutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Polls for due schedules and turns each due occurrence into exactly one execution.
 * An occurrence is claimed with a compare-and-set on {@code next_run_at}; only the
 * instance whose claim succeeds submits the execution.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crewflow.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerLoop {

    private final ScheduleRepository scheduleRepository;
    private final ScheduleService scheduleService;
    private final ExecutionService executionService;
    private final CronEvaluator cronEvaluator;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${crewflow.scheduler.poll-interval-ms:60000}",
               initialDelayString = "${crewflow.scheduler.initial-delay-ms:10000}")
    public void tick() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<Schedule> due;
        try {
            due = scheduleRepository.findDue(now);
        } catch (Exception e) {
            log.error("[SCHEDULER] Could not load due schedules: {}", e.getMessage(), e);
            return;
        }
        if (!due.isEmpty()) {
            log.debug("[SCHEDULER] {} schedule(s) due at {}", due.size(), now);
        }
        for (Schedule schedule : due) {
            try {
                fire(schedule, now);
            } catch (Exception e) {
                log.error("[SCHEDULER] Schedule {} '{}' failed: {}", schedule.getId(), schedule.getName(), e.getMessage(), e);
            }
        }
    }

    /** Returns true when this call claimed the occurrence and submitted an execution. */
    boolean fire(Schedule schedule, Instant now) {
        // Next occurrence strictly after now: missed occurrences collapse into this one
        Instant next = cronEvaluator.next(schedule.getCronExpression(), now);
        int claimed = scheduleRepository.claim(schedule.getId(), schedule.getNextRunAt(), next, now);
        if (claimed != 1) {
            log.debug("[SCHEDULER] Schedule {} already claimed for {}", schedule.getId(), schedule.getNextRunAt());
            return false;
        }

        // The claim stays even if submission fails, the occurrence is not retried
        ExecutionRequest stored = scheduleService.toRequest(schedule.getJobConfig());
        String runName = stored.runName() != null ? stored.runName() : schedule.getName();
        ExecutionRequest request = new ExecutionRequest(null, runName, stored.definition(),
                stored.inputs(), stored.observers());
        Execution execution = executionService.submit(request, TriggerType.SCHEDULE, schedule.getId());
        log.info("[SCHEDULER] Schedule {} '{}' fired execution {}, next run {}",
                schedule.getId(), schedule.getName(), execution.getJobId(), next);
        return true;
    }
}
