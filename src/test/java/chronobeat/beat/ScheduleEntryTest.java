package chronobeat.beat;

import chronobeat.model.PeriodicTask;
import chronobeat.schedule.CronSchedule;
import chronobeat.schedule.CrontabExpression;
import chronobeat.schedule.DueCheck;
import chronobeat.schedule.EverySchedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleEntryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private static PeriodicTask.Builder task() {
        return PeriodicTask.builder()
                .id(1)
                .name("report")
                .task("reports.build")
                .intervalId(1L)
                .updatedAt(NOW.minusSeconds(3600));
    }

    @Test
    void futureStartTimeIsNeverDue() {
        PeriodicTask t = task().startTime(NOW.plus(Duration.ofHours(2))).build();
        ScheduleEntry entry = ScheduleEntry.of(t, new EverySchedule(Duration.ofMinutes(1)));

        DueCheck check = entry.evaluate(NOW);

        assertFalse(check.due());
        assertEquals(NOW.plus(Duration.ofHours(2)), check.nextDue());
    }

    @Test
    void futureStartTimeWaitsForFirstCronMatchAfterIt() {
        PeriodicTask t = task().startTime(Instant.parse("2024-01-01T12:30:00Z")).build();
        CronSchedule hourly = new CronSchedule(CrontabExpression.parse("0 * * * *"), ZoneOffset.UTC);
        ScheduleEntry entry = ScheduleEntry.of(t, hourly);

        DueCheck check = entry.evaluate(NOW);

        assertFalse(check.due());
        assertEquals(Instant.parse("2024-01-01T13:00:00Z"), check.nextDue());
    }

    @Test
    void pastStartTimeDefersToSchedule() {
        PeriodicTask t = task().startTime(NOW.minusSeconds(1)).build();
        ScheduleEntry entry = ScheduleEntry.of(t, new EverySchedule(Duration.ofMinutes(1)));

        assertTrue(entry.evaluate(NOW).due());
    }

    @Test
    void withRunAdvancesBookkeeping() {
        ScheduleEntry entry = ScheduleEntry.of(task().totalRunCount(4).build(),
                new EverySchedule(Duration.ofMinutes(5)));

        ScheduleEntry ran = entry.withRun(NOW);

        assertEquals(NOW, ran.lastRunAt());
        assertEquals(5, ran.totalRunCount());
        assertFalse(ran.evaluate(NOW.plus(Duration.ofMinutes(4))).due());
        assertTrue(ran.evaluate(NOW.plus(Duration.ofMinutes(5))).due());
        // original untouched
        assertNull(entry.lastRunAt());
        assertEquals(4, entry.totalRunCount());
    }

    @Test
    void expiry() {
        ScheduleEntry entry = ScheduleEntry.of(task().expiresAt(NOW).build(),
                new EverySchedule(Duration.ofMinutes(1)));

        assertFalse(entry.isExpired(NOW.minusSeconds(1)));
        assertTrue(entry.isExpired(NOW));
    }

    @Test
    void definitionKeyFollowsTaskAndScheduleEdits() {
        PeriodicTask t = task().build();
        ScheduleEntry entry = ScheduleEntry.of(t, new EverySchedule(Duration.ofMinutes(1)));

        ScheduleEntry edited = ScheduleEntry.of(t.toBuilder().updatedAt(NOW).build(),
                new EverySchedule(Duration.ofMinutes(1)));
        ScheduleEntry rescheduled = ScheduleEntry.of(t, new EverySchedule(Duration.ofMinutes(2)));

        assertNotEquals(entry.definitionKey(), edited.definitionKey());
        assertNotEquals(entry.definitionKey(), rescheduled.definitionKey());
        assertEquals(entry.definitionKey(), entry.withRun(NOW).definitionKey());
    }
}
