package chronobeat.store;

import chronobeat.model.ResultCompleteOutcome;
import chronobeat.model.ResultFailOutcome;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import chronobeat.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskResultRepository.
 * Uses pessimistic locking for atomic claiming.
 */
public class JdbcTaskResultRepository implements TaskResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskResultRepository.class);

    private final Database db;

    public JdbcTaskResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskResult result) {
        String sql = """
                    INSERT INTO task_results (id, task_name, periodic_task_name, status, args, kwargs, queue, priority,
                                              expires_at, worker_id, attempts, result, traceback,
                                              date_created, date_started, date_done)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.id());
            ps.setString(2, result.taskName());
            ps.setString(3, result.periodicTaskName());
            ps.setString(4, result.status().name());
            ps.setString(5, JdbcSupport.toJson(result.args()));
            ps.setString(6, JdbcSupport.toJson(result.kwargs()));
            ps.setString(7, result.queue());
            ps.setInt(8, result.priority());
            JdbcSupport.setInstant(ps, 9, result.expiresAt());
            ps.setString(10, result.workerId());
            ps.setInt(11, result.attempts());
            ps.setString(12, result.result());
            ps.setString(13, result.traceback());
            JdbcSupport.setInstant(ps, 14, result.dateCreated());
            JdbcSupport.setInstant(ps, 15, result.dateStarted());
            JdbcSupport.setInstant(ps, 16, result.dateDone());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task result: " + result.id(), e);
        }
    }

    @Override
    public Optional<TaskResult> findById(String id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM task_results WHERE id = ?")) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task result: " + id, e);
        }
    }

    @Override
    public List<TaskResult> find(String taskName, TaskResultStatus status, int offset, int limit) {
        String sql = "SELECT * FROM task_results" + whereClause(taskName, status)
                + " ORDER BY date_created DESC, id LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = bindFilter(ps, taskName, status);
            ps.setInt(idx++, limit);
            ps.setInt(idx, offset);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list task results", e);
        }
    }

    @Override
    public int count(String taskName, TaskResultStatus status) {
        String sql = "SELECT COUNT(*) FROM task_results" + whereClause(taskName, status);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindFilter(ps, taskName, status);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task results", e);
        }
    }

    @Override
    public Map<TaskResultStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM task_results GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<TaskResultStatus, Integer> counts = new EnumMap<>(TaskResultStatus.class);
            while (rs.next()) {
                counts.put(TaskResultStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task results by status", e);
        }
    }

    @Override
    public List<TaskResult> claim(String workerId, String queue, int maxResults, Instant now) {
        // Use SELECT FOR UPDATE to lock rows, then update them
        String selectSql = "SELECT * FROM task_results WHERE status IN ('PENDING', 'RETRY')"
                + (queue != null ? " AND queue = ?" : "")
                + " ORDER BY priority DESC, date_created LIMIT ? FOR UPDATE";

        String startSql = """
                    UPDATE task_results
                    SET status = 'STARTED', worker_id = ?, date_started = ?, attempts = attempts + 1
                    WHERE id = ?
                """;

        String expireSql = """
                    UPDATE task_results
                    SET status = 'FAILURE', traceback = 'expired before execution', date_done = ?
                    WHERE id = ?
                """;

        List<TaskResult> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement startPs = conn.prepareStatement(startSql);
                    PreparedStatement expirePs = conn.prepareStatement(expireSql)) {

                int idx = 1;
                if (queue != null) {
                    selectPs.setString(idx++, queue);
                }
                selectPs.setInt(idx, maxResults);

                int expired = 0;
                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        TaskResult row = mapRow(rs);

                        if (row.expiresAt() != null && !row.expiresAt().isAfter(now)) {
                            JdbcSupport.setInstant(expirePs, 1, now);
                            expirePs.setString(2, row.id());
                            expirePs.addBatch();
                            expired++;
                            continue;
                        }

                        startPs.setString(1, workerId);
                        JdbcSupport.setInstant(startPs, 2, now);
                        startPs.setString(3, row.id());
                        startPs.addBatch();

                        claimed.add(TaskResult.builder()
                                .id(row.id())
                                .taskName(row.taskName())
                                .periodicTaskName(row.periodicTaskName())
                                .status(TaskResultStatus.STARTED)
                                .args(row.args())
                                .kwargs(row.kwargs())
                                .queue(row.queue())
                                .priority(row.priority())
                                .expiresAt(row.expiresAt())
                                .workerId(workerId)
                                .attempts(row.attempts() + 1)
                                .dateCreated(row.dateCreated())
                                .dateStarted(now)
                                .build());
                    }
                }

                if (!claimed.isEmpty()) {
                    startPs.executeBatch();
                }
                if (expired > 0) {
                    expirePs.executeBatch();
                    log.info("Failed {} expired task result(s) instead of handing them out", expired);
                }

                conn.commit();

                if (!claimed.isEmpty()) {
                    log.debug("Claimed {} task results for worker {}", claimed.size(), workerId);
                }

                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim task results for worker: " + workerId, e);
        }
    }

    @Override
    public ResultCompleteOutcome complete(String id, String workerId, String resultJson, Instant now) {
        Optional<TaskResult> current = findById(id);
        if (current.isEmpty()) {
            return ResultCompleteOutcome.NOT_FOUND;
        }

        TaskResult row = current.get();
        if (row.isTerminal()) {
            return ResultCompleteOutcome.ALREADY_DONE;
        }
        if (row.status() != TaskResultStatus.STARTED || !workerId.equals(row.workerId())) {
            log.warn("Worker {} tried to complete result {} held by {} ({})", workerId, id, row.workerId(),
                    row.status());
            return ResultCompleteOutcome.WRONG_WORKER;
        }

        String sql = """
                    UPDATE task_results
                    SET status = 'SUCCESS', result = ?, date_done = ?
                    WHERE id = ? AND worker_id = ? AND status = 'STARTED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resultJson);
            JdbcSupport.setInstant(ps, 2, now);
            ps.setString(3, id);
            ps.setString(4, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Result {} completed by worker {}", id, workerId);
                return ResultCompleteOutcome.COMPLETED;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete task result: " + id, e);
        }

        // lost a race: re-read to report the state that won
        return findById(id)
                .map(r -> r.isTerminal() ? ResultCompleteOutcome.ALREADY_DONE : ResultCompleteOutcome.WRONG_WORKER)
                .orElse(ResultCompleteOutcome.NOT_FOUND);
    }

    @Override
    public ResultFailOutcome fail(String id, String workerId, String traceback, boolean retriable, Instant now) {
        Optional<TaskResult> current = findById(id);
        if (current.isEmpty()) {
            return ResultFailOutcome.NOT_FOUND;
        }

        TaskResult row = current.get();
        if (row.isTerminal()) {
            return ResultFailOutcome.ALREADY_TERMINAL;
        }
        if (row.status() != TaskResultStatus.STARTED || !workerId.equals(row.workerId())) {
            log.warn("Worker {} tried to fail result {} held by {} ({})", workerId, id, row.workerId(), row.status());
            return ResultFailOutcome.WRONG_WORKER;
        }

        String sql = retriable
                ? """
                            UPDATE task_results
                            SET status = 'RETRY', traceback = ?, worker_id = NULL, date_started = NULL
                            WHERE id = ? AND worker_id = ? AND status = 'STARTED'
                        """
                : """
                            UPDATE task_results
                            SET status = 'FAILURE', traceback = ?, date_done = ?
                            WHERE id = ? AND worker_id = ? AND status = 'STARTED'
                        """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, traceback);
            if (!retriable) {
                JdbcSupport.setInstant(ps, idx++, now);
            }
            ps.setString(idx++, id);
            ps.setString(idx, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Result {} failed by worker {} (retry={})", id, workerId, retriable);
                return retriable ? ResultFailOutcome.RETRY : ResultFailOutcome.FAILED;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail task result: " + id, e);
        }

        return findById(id)
                .map(r -> r.isTerminal() ? ResultFailOutcome.ALREADY_TERMINAL : ResultFailOutcome.WRONG_WORKER)
                .orElse(ResultFailOutcome.NOT_FOUND);
    }

    @Override
    public List<TaskResult> findStuckStarted(Instant startedBefore) {
        String sql = """
                    SELECT * FROM task_results
                    WHERE status = 'STARTED' AND date_started < ?
                    ORDER BY date_started
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            JdbcSupport.setInstant(ps, 1, startedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck task results", e);
        }
    }

    @Override
    public boolean markFailed(String id, String traceback, Instant now) {
        String sql = """
                    UPDATE task_results
                    SET status = 'FAILURE', traceback = ?, date_done = ?
                    WHERE id = ? AND status NOT IN ('SUCCESS', 'FAILURE')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, traceback);
            JdbcSupport.setInstant(ps, 2, now);
            ps.setString(3, id);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Result {} marked as FAILURE: {}", id, traceback);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark task result as failed: " + id, e);
        }
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        String sql = "DELETE FROM task_results WHERE status IN ('SUCCESS', 'FAILURE') AND date_done < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            JdbcSupport.setInstant(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Deleted {} task results finished before {}", deleted, cutoff);
            }
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete old task results", e);
        }
    }

    private String whereClause(String taskName, TaskResultStatus status) {
        if (taskName != null && status != null) {
            return " WHERE task_name = ? AND status = ?";
        }
        if (taskName != null) {
            return " WHERE task_name = ?";
        }
        if (status != null) {
            return " WHERE status = ?";
        }
        return "";
    }

    private int bindFilter(PreparedStatement ps, String taskName, TaskResultStatus status) throws SQLException {
        int idx = 1;
        if (taskName != null) {
            ps.setString(idx++, taskName);
        }
        if (status != null) {
            ps.setString(idx++, status.name());
        }
        return idx;
    }

    private List<TaskResult> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskResult> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskResult mapRow(ResultSet rs) throws SQLException {
        return TaskResult.builder()
                .id(rs.getString("id"))
                .taskName(rs.getString("task_name"))
                .periodicTaskName(rs.getString("periodic_task_name"))
                .status(TaskResultStatus.valueOf(rs.getString("status")))
                .args(JdbcSupport.readList(rs.getString("args")))
                .kwargs(JdbcSupport.readMap(rs.getString("kwargs")))
                .queue(rs.getString("queue"))
                .priority(rs.getInt("priority"))
                .expiresAt(JdbcSupport.getInstant(rs, "expires_at"))
                .workerId(rs.getString("worker_id"))
                .attempts(rs.getInt("attempts"))
                .result(rs.getString("result"))
                .traceback(rs.getString("traceback"))
                .dateCreated(JdbcSupport.getInstant(rs, "date_created"))
                .dateStarted(JdbcSupport.getInstant(rs, "date_started"))
                .dateDone(JdbcSupport.getInstant(rs, "date_done"))
                .build();
    }
}
