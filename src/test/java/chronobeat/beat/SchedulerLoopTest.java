package chronobeat.beat;

import chronobeat.MutableClock;
import chronobeat.TestDatabases;
import chronobeat.exception.DispatchUnavailableException;
import chronobeat.model.CrontabSchedule;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.model.PeriodicTask;
import chronobeat.store.Database;
import chronobeat.store.JdbcChangeMarkerRepository;
import chronobeat.store.JdbcCrontabRepository;
import chronobeat.store.JdbcIntervalRepository;
import chronobeat.store.JdbcPeriodicTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerLoopTest {

    private static final Duration REFRESH = Duration.ofSeconds(5);
    private static final Duration MIN_TICK = Duration.ofSeconds(1);

    private Database db;
    private MutableClock clock;
    private FlakyTaskRepository tasks;
    private JdbcChangeMarkerRepository marker;
    private JdbcCrontabRepository crontabs;
    private IntervalSchedule everyMinute;
    private RecordingDispatcher dispatcher;
    private SchedulerLoop loop;

    /**
     * Task repository whose bookkeeping writes can be made to fail.
     */
    static class FlakyTaskRepository extends JdbcPeriodicTaskRepository {
        volatile boolean failRecordRun;

        FlakyTaskRepository(Database db, Clock clock) {
            super(db, clock);
        }

        @Override
        public boolean recordRun(String name, Instant lastRunAt, int totalRunCount, boolean enabled) {
            if (failRecordRun) {
                throw new RuntimeException("database is read-only");
            }
            return super.recordRun(name, lastRunAt, totalRunCount, enabled);
        }
    }

    @BeforeEach
    void setup() {
        db = TestDatabases.fresh("test-loop");
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        tasks = new FlakyTaskRepository(db, clock);
        marker = new JdbcChangeMarkerRepository(db, clock);
        crontabs = new JdbcCrontabRepository(db, clock);
        everyMinute = new JdbcIntervalRepository(db, clock).create(1, IntervalPeriod.MINUTES);
        dispatcher = new RecordingDispatcher();

        ScheduleCache cache = new ScheduleCache(tasks, marker, REFRESH, null);
        loop = new SchedulerLoop(cache, dispatcher, clock, REFRESH, MIN_TICK, Duration.ofSeconds(2));
    }

    @AfterEach
    void teardown() {
        db.close();
    }

    private PeriodicTask.Builder task(String name) {
        return PeriodicTask.builder().name(name).task("jobs." + name).intervalId(everyMinute.id());
    }

    private PeriodicTask stored(String name) {
        return tasks.findByName(name).orElseThrow();
    }

    @Test
    void intervalTaskRunsOncePerInterval() {
        tasks.create(task("tick").args(List.of(1)).kwargs(Map.of("x", "y")).queue("fast").build());
        Instant start = clock.instant();

        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());
        RecordingDispatcher.Call call = dispatcher.calls().get(0);
        assertEquals("jobs.tick", call.taskName());
        assertEquals(List.of(1), call.args());
        assertEquals(Map.of("x", "y"), call.kwargs());
        assertEquals("fast", call.options().queue());
        assertEquals(start, stored("tick").lastRunAt());
        assertEquals(1, stored("tick").totalRunCount());

        clock.advance(Duration.ofSeconds(30));
        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());

        clock.advance(Duration.ofSeconds(30));
        loop.runCycle();
        assertEquals(2, dispatcher.calls().size());
        assertEquals(2, stored("tick").totalRunCount());
    }

    @Test
    void oneOffTaskDispatchedExactlyOnce() {
        tasks.create(task("once").oneOff(true).build());

        loop.runCycle();
        clock.advance(Duration.ofMinutes(5));
        loop.runCycle();
        clock.advance(REFRESH);
        loop.runCycle();

        assertEquals(List.of("once"), dispatcher.periodicTaskNames());
        assertFalse(stored("once").enabled());
        assertEquals(1, stored("once").totalRunCount());
    }

    @Test
    @DisplayName("Unavailable dispatch leaves the entry due and bookkeeping untouched")
    void dispatchUnavailableRetriesNextCycle() {
        tasks.create(task("tick").build());
        dispatcher.failWith(new DispatchUnavailableException("broker down"));

        loop.runCycle();
        loop.runCycle();

        assertTrue(dispatcher.calls().isEmpty());
        assertTrue(loop.dispatchUnavailable());
        assertNull(stored("tick").lastRunAt());
        assertEquals(0, stored("tick").totalRunCount());
        assertNull(loop.cache().entries().get("tick").lastRunAt());

        dispatcher.recover();
        clock.advance(MIN_TICK);
        loop.runCycle();

        assertEquals(1, dispatcher.calls().size());
        assertFalse(loop.dispatchUnavailable());
        assertEquals(clock.instant(), stored("tick").lastRunAt());
    }

    @Test
    @DisplayName("A crontab firing lost to an outage is dispatched once the outage ends, even in a later minute")
    void crontabOutageAcrossMinuteBoundary() {
        CrontabSchedule hourly = crontabs.create(new CrontabSchedule(0, "0", "*", "*", "*", "*", "UTC"));
        tasks.create(PeriodicTask.builder().name("hourly").task("jobs.hourly").crontabId(hourly.id()).build());
        clock.advance(Duration.ofSeconds(50));
        dispatcher.failWith(new DispatchUnavailableException("broker down"));

        loop.runCycle();
        assertTrue(dispatcher.calls().isEmpty());

        dispatcher.recover();
        clock.advance(Duration.ofSeconds(15));
        loop.runCycle();

        assertEquals(List.of("hourly"), dispatcher.periodicTaskNames());
        assertEquals(Instant.parse("2024-01-01T10:01:05Z"), stored("hourly").lastRunAt());

        clock.advance(Duration.ofMinutes(1));
        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());
    }

    @Test
    void undispatchedEntryReleasedWhenTaskDisabled() {
        PeriodicTask t = tasks.create(task("tick").build());
        dispatcher.failWith(new DispatchUnavailableException("broker down"));
        loop.runCycle();

        tasks.setEnabled(t.id(), false);
        dispatcher.recover();
        clock.advance(REFRESH);
        loop.runCycle();

        assertTrue(dispatcher.calls().isEmpty());
    }

    @Test
    void unexpectedDispatchErrorDoesNotStopOtherEntries() {
        tasks.create(task("a").build());
        tasks.create(task("b").build());
        dispatcher.failWith(new IllegalStateException("bug"));

        loop.runCycle();
        dispatcher.recover();
        loop.runCycle();

        assertEquals(List.of("a", "b"), dispatcher.periodicTaskNames());
    }

    @Test
    @DisplayName("An entry whose evaluation throws is isolated from the others")
    void brokenEntryIsolated() {
        // Feb 31st never happens; next-due search fails
        CrontabSchedule never = crontabs.create(new CrontabSchedule(0, "0", "0", "*", "31", "2", "UTC"));
        tasks.create(PeriodicTask.builder().name("broken").task("jobs.broken").crontabId(never.id()).build());
        tasks.create(task("healthy").build());

        Duration sleep = loop.runCycle();

        assertEquals(List.of("healthy"), dispatcher.periodicTaskNames());
        assertTrue(sleep.compareTo(MIN_TICK) >= 0);

        clock.advance(Duration.ofMinutes(1));
        loop.runCycle();
        assertEquals(List.of("healthy", "healthy"), dispatcher.periodicTaskNames());
    }

    @Test
    @DisplayName("Failed bookkeeping writes stay pending and the in-memory state stays authoritative")
    void persistenceFailureStaysPending() {
        tasks.create(task("tick").build());
        tasks.failRecordRun = true;
        Instant firstRun = clock.instant();

        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());
        assertEquals(1, loop.cache().pendingCount());
        assertNull(stored("tick").lastRunAt());

        // a reload forced by the marker must not make the task due again
        marker.bump();
        clock.advance(Duration.ofSeconds(10));
        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());
        assertEquals(1, loop.cache().pendingCount());

        tasks.failRecordRun = false;
        clock.advance(Duration.ofSeconds(10));
        loop.runCycle();
        assertEquals(0, loop.cache().pendingCount());
        assertEquals(firstRun, stored("tick").lastRunAt());
        assertEquals(1, stored("tick").totalRunCount());
    }

    @Test
    void expiredTaskIsDisabledNotDispatched() {
        tasks.create(task("old").expiresAt(clock.instant().minusSeconds(1)).build());

        loop.runCycle();

        assertTrue(dispatcher.calls().isEmpty());
        assertFalse(stored("old").enabled());
        assertFalse(loop.cache().entries().containsKey("old"));
    }

    @Test
    void relativeExpiryResolvedAtDispatch() {
        tasks.create(task("short").expireSeconds(30).build());

        loop.runCycle();

        assertEquals(clock.instant().plusSeconds(30), dispatcher.calls().get(0).options().expiresAt());
    }

    @Test
    void futureStartTimeHoldsTaskBack() {
        tasks.create(task("later").startTime(clock.instant().plus(Duration.ofMinutes(10))).build());

        loop.runCycle();
        assertTrue(dispatcher.calls().isEmpty());

        clock.advance(Duration.ofMinutes(10));
        loop.runCycle();
        assertEquals(1, dispatcher.calls().size());
    }

    @Test
    void adminDisableIsPickedUp() {
        PeriodicTask t = tasks.create(task("tick").build());
        loop.runCycle();

        tasks.setEnabled(t.id(), false);
        clock.advance(Duration.ofMinutes(1));
        loop.runCycle();

        assertEquals(1, dispatcher.calls().size());
        assertFalse(stored("tick").enabled());
    }

    @Test
    void sleepIsClampedToRefreshAndMinTick() {
        assertEquals(REFRESH, loop.runCycle());

        tasks.create(task("tick").build());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(REFRESH, loop.runCycle());

        clock.advance(Duration.ofSeconds(57));
        assertEquals(Duration.ofSeconds(3), loop.runCycle());

        clock.advance(Duration.ofMillis(2500));
        assertEquals(MIN_TICK, loop.runCycle());
    }

    @Test
    void runAndStopFlushesAndTerminates() throws Exception {
        tasks.create(task("tick").build());
        Thread thread = new Thread(loop, "test-beat");
        thread.start();

        long deadline = System.currentTimeMillis() + 5000;
        while (dispatcher.calls().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        loop.stop();

        assertTrue(loop.awaitStopped(Duration.ofSeconds(5)));
        assertEquals(LoopState.SHUTTING_DOWN, loop.state());
        assertEquals(1, dispatcher.calls().size());
        assertEquals(0, loop.cache().pendingCount());
        assertEquals(1, stored("tick").totalRunCount());
    }
}
