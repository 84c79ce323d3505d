package com.crewflow.crewflow_backend.scheduler;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.flow.FlowValidator;
import com.crewflow.crewflow_backend.model.domain.Schedule;
import com.crewflow.crewflow_backend.repository.ScheduleRepository;
import com.crewflow.crewflow_backend.service.ExecutionRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ScheduleRepository scheduleRepository;
    private final CronEvaluator cronEvaluator;
    private final FlowValidator flowValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores an active schedule. The job config has the shape of an execution request
     * ({@code definition}, {@code inputs}, {@code runName}) and is validated up front.
     */
    @Transactional
    public Schedule create(String name, String cronExpression, Map<String, Object> jobConfig) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Schedule name must not be empty");
        }
        cronEvaluator.validate(cronExpression);
        toRequest(jobConfig);
        Instant now = clock.instant();

        Schedule schedule = new Schedule();
        schedule.setName(name.trim());
        schedule.setCronExpression(cronExpression.trim());
        schedule.setActive(true);
        schedule.setJobConfig(new LinkedHashMap<>(jobConfig));
        schedule.setNextRunAt(cronEvaluator.next(cronExpression, now));
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        Schedule saved = scheduleRepository.save(schedule);
        log.info("[SCHEDULER] Created schedule {} '{}' ({}), next run {}",
                saved.getId(), saved.getName(), saved.getCronExpression(), saved.getNextRunAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Schedule> list() {
        return scheduleRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public Schedule get(Long id) {
        return scheduleRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.schedule(id));
    }

    /**
     * Flips the active flag. Re-activating computes the next run from now, so occurrences
     * missed while inactive are never replayed.
     */
    @Transactional
    public Schedule toggle(Long id) {
        Schedule schedule = get(id);
        Instant now = clock.instant();
        boolean active = !schedule.isActive();
        schedule.setActive(active);
        schedule.setNextRunAt(active ? cronEvaluator.next(schedule.getCronExpression(), now) : null);
        schedule.setUpdatedAt(now);
        log.info("[SCHEDULER] Schedule {} is now {}", id, active ? "active" : "inactive");
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public void delete(Long id) {
        Schedule schedule = get(id);
        scheduleRepository.delete(schedule);
        log.info("[SCHEDULER] Deleted schedule {}", id);
    }

    /** Parses and validates a stored job config into an execution request. */
    public ExecutionRequest toRequest(Map<String, Object> jobConfig) {
        if (jobConfig == null || jobConfig.isEmpty()) {
            throw new ConfigException("Schedule job config must not be empty");
        }
        ExecutionRequest request;
        try {
            request = objectMapper.convertValue(jobConfig, ExecutionRequest.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid schedule job config: " + e.getMessage());
        }
        flowValidator.prepare(request.definition());
        return request;
    }
}
