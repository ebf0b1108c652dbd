package chronobeat.store;

import chronobeat.MutableClock;
import chronobeat.TestDatabases;
import chronobeat.exception.ScheduleInUseException;
import chronobeat.exception.ValidationException;
import chronobeat.model.CrontabSchedule;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.model.PeriodicTask;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduleStoreTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcIntervalRepository intervals;
    private static JdbcCrontabRepository crontabs;
    private static JdbcPeriodicTaskRepository tasks;
    private static JdbcChangeMarkerRepository marker;

    @BeforeAll
    static void setup() {
        db = TestDatabases.fresh("test-schedule-store");
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        intervals = new JdbcIntervalRepository(db, clock);
        crontabs = new JdbcCrontabRepository(db, clock);
        tasks = new JdbcPeriodicTaskRepository(db, clock);
        marker = new JdbcChangeMarkerRepository(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM periodic_tasks");
            st.execute("DELETE FROM interval_schedules");
            st.execute("DELETE FROM crontab_schedules");
            conn.commit();
        }
    }

    private PeriodicTask.Builder task(String name, Long intervalId) {
        return PeriodicTask.builder()
                .name(name)
                .task("jobs." + name)
                .intervalId(intervalId);
    }

    @Test
    void markerStartsAtZeroAndBumpIncrements() {
        long before = marker.current().version();

        clock.set(Instant.parse("2024-01-01T10:05:00Z"));
        marker.bump();

        assertEquals(before + 1, marker.current().version());
        assertEquals(Instant.parse("2024-01-01T10:05:00Z"), marker.current().lastUpdate());
    }

    @Test
    @DisplayName("Every schedule mutation bumps the change marker")
    void mutationsBumpMarker() {
        long v0 = marker.current().version();

        IntervalSchedule interval = intervals.create(5, IntervalPeriod.MINUTES);
        assertEquals(v0 + 1, marker.current().version());

        intervals.update(new IntervalSchedule(interval.id(), 10, IntervalPeriod.MINUTES));
        assertEquals(v0 + 2, marker.current().version());

        CrontabSchedule crontab = crontabs.create(new CrontabSchedule(0, "0", "*", null, null, null, null));
        assertEquals(v0 + 3, marker.current().version());

        PeriodicTask created = tasks.create(task("nightly", interval.id()).build());
        assertEquals(v0 + 4, marker.current().version());

        tasks.update(created.toBuilder().intervalId(null).crontabId(crontab.id()).build());
        assertEquals(v0 + 5, marker.current().version());

        tasks.setEnabled(created.id(), false);
        assertEquals(v0 + 6, marker.current().version());

        tasks.delete(created.id());
        assertEquals(v0 + 7, marker.current().version());

        assertTrue(intervals.delete(interval.id()));
        assertTrue(crontabs.delete(crontab.id()));
        assertEquals(v0 + 9, marker.current().version());
    }

    @Test
    void updateOfMissingRowDoesNotBump() {
        long v0 = marker.current().version();

        assertFalse(intervals.update(new IntervalSchedule(9999, 1, IntervalPeriod.HOURS)));
        assertFalse(intervals.delete(9999));

        assertEquals(v0, marker.current().version());
    }

    @Test
    @DisplayName("Deleting a referenced interval is rejected and changes nothing")
    void deleteReferencedIntervalRejected() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.HOURS);
        PeriodicTask t = tasks.create(task("hourly", interval.id()).build());
        long v0 = marker.current().version();

        ScheduleInUseException e = assertThrows(ScheduleInUseException.class, () -> intervals.delete(interval.id()));

        assertEquals(1, e.referencingTasks());
        assertTrue(intervals.findById(interval.id()).isPresent());
        assertEquals(interval.id(), tasks.findById(t.id()).orElseThrow().intervalId());
        assertEquals(v0, marker.current().version());
    }

    @Test
    void deleteReferencedCrontabRejectedEvenForDisabledTask() {
        CrontabSchedule crontab = crontabs.create(new CrontabSchedule(0, "30", "2", "*", "*", "*", "UTC"));
        PeriodicTask t = tasks.create(PeriodicTask.builder()
                .name("cleanup").task("jobs.cleanup").crontabId(crontab.id()).enabled(false).build());

        assertThrows(ScheduleInUseException.class, () -> crontabs.delete(crontab.id()));
        assertTrue(crontabs.findById(crontab.id()).isPresent());

        tasks.delete(t.id());
        assertTrue(crontabs.delete(crontab.id()));
        assertTrue(crontabs.findById(crontab.id()).isEmpty());
    }

    @Test
    @DisplayName("A task bound after the reference count still blocks the delete")
    void deleteRacingNewBindingReportsInUse() {
        IntervalSchedule interval = intervals.create(3, IntervalPeriod.HOURS);
        tasks.create(task("late", interval.id()).build());
        JdbcIntervalRepository countsNothing = new JdbcIntervalRepository(db, clock) {
            @Override
            int countReferencingTasks(Connection conn, long id) {
                return 0;
            }
        };
        long v0 = marker.current().version();

        ScheduleInUseException e = assertThrows(ScheduleInUseException.class,
                () -> countsNothing.delete(interval.id()));

        assertEquals(1, e.referencingTasks());
        assertTrue(intervals.findById(interval.id()).isPresent());
        assertEquals(v0, marker.current().version());
    }

    @Test
    void crontabDeleteRacingNewBindingReportsInUse() {
        CrontabSchedule crontab = crontabs.create(new CrontabSchedule(0, "0", "3", "*", "*", "*", "UTC"));
        tasks.create(PeriodicTask.builder().name("nightly").task("jobs.nightly").crontabId(crontab.id()).build());
        JdbcCrontabRepository countsNothing = new JdbcCrontabRepository(db, clock) {
            @Override
            int countReferencingTasks(Connection conn, long id) {
                return 0;
            }
        };

        assertThrows(ScheduleInUseException.class, () -> countsNothing.delete(crontab.id()));
        assertTrue(crontabs.findById(crontab.id()).isPresent());
    }

    @Test
    void crontabDefaultsAndRoundTrip() {
        CrontabSchedule created = crontabs.create(new CrontabSchedule(0, "*/5", "9-17", "mon-fri", null, null, null));

        CrontabSchedule found = crontabs.findById(created.id()).orElseThrow();
        assertEquals("*/5", found.minute());
        assertEquals("9-17", found.hour());
        assertEquals("mon-fri", found.dayOfWeek());
        assertEquals("*", found.dayOfMonth());
        assertEquals("*", found.monthOfYear());
        assertEquals("UTC", found.timezone());
        assertEquals("*/5 9-17 * * mon-fri (m/h/dM/MY/d) UTC", found.display());
    }

    @Test
    void taskDefinitionRoundTrip() {
        IntervalSchedule interval = intervals.create(30, IntervalPeriod.SECONDS);
        PeriodicTask created = tasks.create(task("sync", interval.id())
                .args(List.of(1, "two"))
                .kwargs(Map.of("dryRun", true))
                .queue("low")
                .priority(7)
                .expireSeconds(120)
                .oneOff(true)
                .startTime(Instant.parse("2024-02-01T00:00:00Z"))
                .description("sync things")
                .build());

        PeriodicTask found = tasks.findById(created.id()).orElseThrow();
        assertEquals("sync", found.name());
        assertEquals("jobs.sync", found.task());
        assertEquals(List.of(1, "two"), found.args());
        assertEquals(Map.of("dryRun", true), found.kwargs());
        assertEquals("low", found.queue());
        assertEquals(7, found.priority());
        assertEquals(120, found.expireSeconds());
        assertTrue(found.oneOff());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), found.startTime());
        assertTrue(found.enabled());
        assertEquals(0, found.totalRunCount());
        assertNull(found.lastRunAt());
        assertEquals(clock.instant(), found.createdAt());
        assertEquals("every 30 seconds", found.interval().display());
    }

    @Test
    void duplicateNameRejected() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        tasks.create(task("dup", interval.id()).build());

        assertThrows(ValidationException.class, () -> tasks.create(task("dup", interval.id()).build()));
    }

    @Test
    void findEnabledWithSchedulesSkipsDisabled() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        CrontabSchedule crontab = crontabs.create(new CrontabSchedule(0, "0", "0", "*", "*", "*", "UTC"));
        tasks.create(task("a-interval", interval.id()).build());
        tasks.create(PeriodicTask.builder().name("b-cron").task("jobs.b").crontabId(crontab.id()).build());
        tasks.create(task("c-off", interval.id()).enabled(false).build());

        List<PeriodicTask> enabled = tasks.findEnabledWithSchedules();

        assertEquals(List.of("a-interval", "b-cron"), enabled.stream().map(PeriodicTask::name).toList());
        assertNotNull(enabled.get(0).interval());
        assertNull(enabled.get(0).crontab());
        assertNotNull(enabled.get(1).crontab());
        assertEquals("0 0 * * *", enabled.get(1).crontab().expression());
    }

    @Test
    void listingAndCounts() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        for (int i = 0; i < 5; i++) {
            tasks.create(task("t" + i, interval.id()).enabled(i % 2 == 0).build());
        }

        assertEquals(5, tasks.count(null));
        assertEquals(3, tasks.count(true));
        assertEquals(2, tasks.count(false));
        assertEquals(List.of("t2", "t3"), tasks.findAll(null, 2, 2).stream().map(PeriodicTask::name).toList());
        assertEquals(5, tasks.countByIntervalId(interval.id()));
        assertEquals(1, intervals.count());
    }

    @Test
    @DisplayName("recordRun writes bookkeeping without bumping the marker or re-enabling")
    void recordRunBookkeeping() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        PeriodicTask t = tasks.create(task("tick", interval.id()).build());
        tasks.setEnabled(t.id(), false);
        long v0 = marker.current().version();
        Instant ranAt = Instant.parse("2024-01-01T10:01:00Z");

        assertTrue(tasks.recordRun("tick", ranAt, 3, true));

        PeriodicTask after = tasks.findById(t.id()).orElseThrow();
        assertEquals(ranAt, after.lastRunAt());
        assertEquals(3, after.totalRunCount());
        assertFalse(after.enabled());
        assertEquals(v0, marker.current().version());
    }

    @Test
    void recordRunCanDisable() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        PeriodicTask t = tasks.create(task("once", interval.id()).oneOff(true).build());

        assertTrue(tasks.recordRun("once", clock.instant(), 1, false));

        assertFalse(tasks.findById(t.id()).orElseThrow().enabled());
    }

    @Test
    void recordRunOnMissingTask() {
        assertFalse(tasks.recordRun("ghost", clock.instant(), 1, true));
    }

    @Test
    void findByName() {
        IntervalSchedule interval = intervals.create(1, IntervalPeriod.MINUTES);
        tasks.create(task("named", interval.id()).build());

        Optional<PeriodicTask> found = tasks.findByName("named");
        assertTrue(found.isPresent());
        assertTrue(tasks.findByName("other").isEmpty());
    }
}
