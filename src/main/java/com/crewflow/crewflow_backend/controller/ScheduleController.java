package com.crewflow.crewflow_backend.controller;

import com.crewflow.crewflow_backend.model.domain.Schedule;
import com.crewflow.crewflow_backend.scheduler.ScheduleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping
    public ResponseEntity<ScheduleDetail> create(@Valid @RequestBody CreateScheduleRequest body) {
        Schedule schedule = scheduleService.create(body.name(), body.cronExpression(), body.jobConfig());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(schedule));
    }

    @GetMapping
    public List<ScheduleDetail> list() {
        return scheduleService.list().stream().map(this::toDetail).toList();
    }

    @GetMapping("/{id}")
    public ScheduleDetail get(@PathVariable Long id) {
        return toDetail(scheduleService.get(id));
    }

    // PATCH /api/schedules/{id}/toggle: activating recomputes next run from now
    @PatchMapping("/{id}/toggle")
    public ScheduleDetail toggle(@PathVariable Long id) {
        return toDetail(scheduleService.toggle(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private ScheduleDetail toDetail(Schedule s) {
        return new ScheduleDetail(s.getId(), s.getName(), s.getCronExpression(), s.isActive(),
                s.getJobConfig(), s.getLastRunAt(), s.getNextRunAt(), s.getCreatedAt(), s.getUpdatedAt());
    }

    public record CreateScheduleRequest(
            @NotBlank String name,
            @NotBlank String cronExpression,
            @NotEmpty Map<String, Object> jobConfig
    ) {}

    public record ScheduleDetail(
            Long id,
            String name,
            String cronExpression,
            boolean active,
            Map<String, Object> jobConfig,
            Instant lastRunAt,
            Instant nextRunAt,
            Instant createdAt,
            Instant updatedAt
    ) {}
}
