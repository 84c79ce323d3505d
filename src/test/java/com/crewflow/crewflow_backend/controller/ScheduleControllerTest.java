package com.crewflow.crewflow_backend.controller;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.crewflow.crewflow_backend.exception.ResourceNotFoundException;
import com.crewflow.crewflow_backend.model.domain.Schedule;
import com.crewflow.crewflow_backend.scheduler.ScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ScheduleControllerTest {

    private static final String BODY = """
            {"name": "nightly", "cronExpression": "0 2 * * *",
             "jobConfig": {"definition": {"flow": {"type": "sequential", "tasks": ["T1"]}}}}
            """;

    private ScheduleService scheduleService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        scheduleService = mock(ScheduleService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new ScheduleController(scheduleService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void shouldCreateSchedule() throws Exception {
        when(scheduleService.create(eq("nightly"), eq("0 2 * * *"), anyMap())).thenReturn(schedule(1L, true));

        mockMvc.perform(post("/api/schedules").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    public void shouldRejectBlankName() throws Exception {
        mockMvc.perform(post("/api/schedules").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \" \", \"cronExpression\": \"0 2 * * *\", \"jobConfig\": {\"a\": 1}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verifyNoInteractions(scheduleService);
    }

    @Test
    public void shouldRejectInvalidCron() throws Exception {
        when(scheduleService.create(anyString(), anyString(), anyMap()))
                .thenThrow(new ConfigException("Invalid cron expression: every night"));

        mockMvc.perform(post("/api/schedules").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CONFIG"));
    }

    @Test
    public void shouldListSchedules() throws Exception {
        when(scheduleService.list()).thenReturn(List.of(schedule(2L, true), schedule(1L, false)));

        mockMvc.perform(get("/api/schedules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(2))
                .andExpect(jsonPath("$[1].active").value(false));
    }

    @Test
    public void shouldToggleSchedule() throws Exception {
        when(scheduleService.toggle(1L)).thenReturn(schedule(1L, false));

        mockMvc.perform(patch("/api/schedules/1/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    public void shouldReturnNotFoundForUnknownSchedule() throws Exception {
        when(scheduleService.get(42L)).thenThrow(ResourceNotFoundException.schedule(42L));

        mockMvc.perform(get("/api/schedules/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    public void shouldRejectNonNumericId() throws Exception {
        mockMvc.perform(get("/api/schedules/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    public void shouldDeleteWithNoContent() throws Exception {
        mockMvc.perform(delete("/api/schedules/3"))
                .andExpect(status().isNoContent());

        verify(scheduleService).delete(3L);
    }

    private static Schedule schedule(Long id, boolean active) {
        Schedule schedule = new Schedule();
        schedule.setId(id);
        schedule.setName("nightly");
        schedule.setCronExpression("0 2 * * *");
        schedule.setActive(active);
        schedule.setJobConfig(Map.of("definition", Map.of()));
        return schedule;
    }
}
