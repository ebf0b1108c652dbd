package chronobeat.beat;

import chronobeat.MutableClock;
import chronobeat.TestDatabases;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import chronobeat.store.Database;
import chronobeat.store.JdbcTaskResultRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultReaper functionality.
 */
class ResultReaperTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(10);

    private static Database db;
    private static JdbcTaskResultRepository repo;

    private MutableClock clock;
    private ResultReaper reaper;

    @BeforeAll
    static void setup() {
        db = TestDatabases.fresh("test-reaper");
        repo = new JdbcTaskResultRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanResults() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_results");
            conn.commit();
        }
        clock = MutableClock.at("2024-01-01T12:00:00Z");
        reaper = new ResultReaper(repo, TIMEOUT, clock);
    }

    private void saveAndClaim(String id) {
        repo.save(TaskResult.builder()
                .id(id)
                .taskName("jobs.work")
                .status(TaskResultStatus.PENDING)
                .dateCreated(clock.instant())
                .build());
        assertEquals(1, repo.claim("worker-1", null, 1, clock.instant()).size());
    }

    @Test
    void failsResultStuckPastTimeout() {
        saveAndClaim("stuck");

        clock.advance(TIMEOUT.plusSeconds(1));
        int reaped = reaper.reapStuckResults();

        assertEquals(1, reaped);
        TaskResult updated = repo.findById("stuck").orElseThrow();
        assertEquals(TaskResultStatus.FAILURE, updated.status());
        assertEquals(clock.instant(), updated.dateDone());
        assertTrue(updated.traceback().contains("worker-1"));
    }

    @Test
    void leavesRecentlyStartedResults() {
        saveAndClaim("recent");

        clock.advance(TIMEOUT.minusSeconds(1));

        assertEquals(0, reaper.reapStuckResults());
        assertEquals(TaskResultStatus.STARTED, repo.findById("recent").orElseThrow().status());
    }

    @Test
    void leavesFinishedResults() {
        saveAndClaim("done");
        repo.complete("done", "worker-1", "{\"rows\":3}", clock.instant());

        clock.advance(TIMEOUT.multipliedBy(2));

        assertEquals(0, reaper.reapStuckResults());
        assertEquals(TaskResultStatus.SUCCESS, repo.findById("done").orElseThrow().status());
    }

    @Test
    void runReapsStuckResults() {
        saveAndClaim("a");
        clock.advance(TIMEOUT.plusMinutes(1));

        reaper.run();

        assertEquals(TaskResultStatus.FAILURE, repo.findById("a").orElseThrow().status());
    }
}
