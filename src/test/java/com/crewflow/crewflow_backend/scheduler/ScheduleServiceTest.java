package com.crewflow.crewflow_backend.scheduler;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.flow.FlowValidator;
import com.crewflow.crewflow_backend.model.domain.Schedule;
import com.crewflow.crewflow_backend.model.flow.FlowDefinition;
import com.crewflow.crewflow_backend.repository.ScheduleRepository;
import com.crewflow.crewflow_backend.service.ExecutionRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:20:00Z");

    private ScheduleRepository scheduleRepository;
    private FlowValidator flowValidator;
    private ScheduleService service;

    @BeforeEach
    public void setUp() {
        scheduleRepository = mock(ScheduleRepository.class);
        flowValidator = mock(FlowValidator.class);
        when(scheduleRepository.save(any(Schedule.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new ScheduleService(scheduleRepository, new CronEvaluator(ZoneOffset.UTC), flowValidator,
                new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void shouldCreateActiveScheduleWithNextRun() {
        Schedule created = service.create(" Hourly report ", "0 * * * *", jobConfig());

        Assertions.assertEquals("Hourly report", created.getName());
        Assertions.assertTrue(created.isActive());
        Assertions.assertEquals(Instant.parse("2026-03-01T11:00:00Z"), created.getNextRunAt());
        Assertions.assertNull(created.getLastRunAt());
        verify(flowValidator).prepare(any(FlowDefinition.class));
    }

    @Test
    public void shouldRejectInvalidCronWithoutSaving() {
        Assertions.assertThrows(ConfigException.class, () -> service.create("report", "every hour", jobConfig()));
        Assertions.assertThrows(ConfigException.class, () -> service.create("report", null, jobConfig()));
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    public void shouldRejectEmptyJobConfig() {
        Assertions.assertThrows(ConfigException.class, () -> service.create("report", "0 * * * *", Map.of()));
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    public void shouldComputeNextRunFromNowWhenReactivated() {
        Schedule paused = new Schedule();
        paused.setId(3L);
        paused.setCronExpression("0 * * * *");
        paused.setActive(false);
        paused.setLastRunAt(NOW.minus(30, ChronoUnit.DAYS));
        when(scheduleRepository.findById(3L)).thenReturn(Optional.of(paused));

        Schedule toggled = service.toggle(3L);

        Assertions.assertTrue(toggled.isActive());
        Assertions.assertEquals(Instant.parse("2026-03-01T11:00:00Z"), toggled.getNextRunAt());
    }

    @Test
    public void shouldClearNextRunWhenDeactivated() {
        Schedule active = new Schedule();
        active.setId(4L);
        active.setCronExpression("0 * * * *");
        active.setActive(true);
        active.setNextRunAt(Instant.parse("2026-03-01T11:00:00Z"));
        when(scheduleRepository.findById(4L)).thenReturn(Optional.of(active));

        Schedule toggled = service.toggle(4L);

        Assertions.assertFalse(toggled.isActive());
        Assertions.assertNull(toggled.getNextRunAt());
    }

    @Test
    public void shouldReadStoredJobConfigAsRequest() {
        ArgumentCaptor<FlowDefinition> definition = ArgumentCaptor.forClass(FlowDefinition.class);

        ExecutionRequest request = service.toRequest(jobConfig());

        verify(flowValidator).prepare(definition.capture());
        Assertions.assertEquals("nightly", request.runName());
        Assertions.assertEquals(Map.of("region", "CH"), request.inputs());
        Assertions.assertEquals(List.of("T1"), definition.getValue().getFlow().getTasks());
        Assertions.assertEquals("A", definition.getValue().getTasks().get("T1").getAgent());
    }

    @Test
    public void shouldReportMissingSchedule() {
        when(scheduleRepository.findById(99L)).thenReturn(Optional.empty());

        Assertions.assertThrows(ResourceNotFoundException.class, () -> service.delete(99L));
    }

    private static Map<String, Object> jobConfig() {
        return Map.of(
                "runName", "nightly",
                "inputs", Map.of("region", "CH"),
                "definition", Map.of(
                        "agents", Map.of("A", Map.of("role", "researcher", "goal", "find companies")),
                        "tasks", Map.of("T1", Map.of("agent", "A", "description", "List companies")),
                        "flow", Map.of("type", "sequential", "tasks", List.of("T1"))));
    }
}
