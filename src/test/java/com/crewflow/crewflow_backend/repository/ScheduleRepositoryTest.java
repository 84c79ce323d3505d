package com.crewflow.crewflow_backend.repository;

import com.crewflow.crewflow_backend.model.domain.Schedule;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@DataJpaTest
public class ScheduleRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private ScheduleRepository scheduleRepository;

    @Test
    public void shouldClaimOccurrenceOnlyOnce() {
        Schedule schedule = scheduleRepository.saveAndFlush(schedule("hourly", true, NOW.minusSeconds(60)));
        Instant expected = schedule.getNextRunAt();

        int first = scheduleRepository.claim(schedule.getId(), expected, NOW.plusSeconds(3600), NOW);
        int second = scheduleRepository.claim(schedule.getId(), expected, NOW.plusSeconds(7200), NOW);

        Assertions.assertEquals(1, first);
        Assertions.assertEquals(0, second);
        Schedule stored = scheduleRepository.findById(schedule.getId()).orElseThrow();
        Assertions.assertEquals(NOW.plusSeconds(3600), stored.getNextRunAt());
        Assertions.assertEquals(NOW, stored.getLastRunAt());
    }

    @Test
    public void shouldNotClaimInactiveSchedule() {
        Schedule schedule = scheduleRepository.saveAndFlush(schedule("paused", false, NOW.minusSeconds(60)));

        Assertions.assertEquals(0,
                scheduleRepository.claim(schedule.getId(), schedule.getNextRunAt(), NOW.plusSeconds(3600), NOW));
    }

    @Test
    public void shouldFindOnlyActiveDueSchedules() {
        scheduleRepository.save(schedule("due-later", true, NOW.minusSeconds(10)));
        scheduleRepository.save(schedule("due-first", true, NOW.minusSeconds(600)));
        scheduleRepository.save(schedule("due-now", true, NOW));
        scheduleRepository.save(schedule("paused", false, NOW.minusSeconds(600)));
        scheduleRepository.save(schedule("future", true, NOW.plusSeconds(1)));
        scheduleRepository.save(schedule("unscheduled", true, null));
        scheduleRepository.flush();

        List<Schedule> due = scheduleRepository.findDue(NOW);

        Assertions.assertEquals(List.of("due-first", "due-later", "due-now"),
                due.stream().map(Schedule::getName).toList());
    }

    private static Schedule schedule(String name, boolean active, Instant nextRunAt) {
        Schedule schedule = new Schedule();
        schedule.setName(name);
        schedule.setCronExpression("0 * * * *");
        schedule.setActive(active);
        schedule.setJobConfig(Map.of("runName", name));
        schedule.setNextRunAt(nextRunAt);
        return schedule;
    }
}
