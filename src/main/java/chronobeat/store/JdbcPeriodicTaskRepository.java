package chronobeat.store;

import chronobeat.exception.ValidationException;
import chronobeat.model.CrontabSchedule;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.model.PeriodicTask;
import chronobeat.repository.PeriodicTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of PeriodicTaskRepository.
 * Lookups join the bound interval/crontab so callers get resolved schedules.
 */
public class JdbcPeriodicTaskRepository implements PeriodicTaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPeriodicTaskRepository.class);

    private static final String SELECT_JOINED = """
                SELECT t.*,
                       i.every AS i_every, i.period AS i_period,
                       c.minute AS c_minute, c.hour AS c_hour, c.day_of_week AS c_day_of_week,
                       c.day_of_month AS c_day_of_month, c.month_of_year AS c_month_of_year,
                       c.timezone AS c_timezone
                FROM periodic_tasks t
                LEFT JOIN interval_schedules i ON i.id = t.interval_id
                LEFT JOIN crontab_schedules c ON c.id = t.crontab_id
            """;

    private final Database db;
    private final Clock clock;

    public JdbcPeriodicTaskRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public PeriodicTask create(PeriodicTask task) {
        String sql = """
                    INSERT INTO periodic_tasks (name, task, interval_id, crontab_id, args, kwargs, queue, priority,
                                                expires_at, expire_seconds, one_off, start_time, enabled,
                                                description, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = clock.instant();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                int idx = bindDefinition(ps, task);
                JdbcSupport.setInstant(ps, idx++, now);
                JdbcSupport.setInstant(ps, idx, now);
                ps.executeUpdate();

                long id;
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for periodic task");
                    }
                    id = keys.getLong(1);
                }

                JdbcSupport.bumpChangeMarker(conn, now);
                conn.commit();

                log.debug("Created periodic task {} ({})", id, task.name());
                return task.toBuilder()
                        .id(id)
                        .lastRunAt(null)
                        .totalRunCount(0)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new ValidationException("Periodic task name already exists or schedule is missing: " + task.name(),
                    e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create periodic task: " + task.name(), e);
        }
    }

    @Override
    public Optional<PeriodicTask> findById(long id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SELECT_JOINED + " WHERE t.id = ?")) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find periodic task: " + id, e);
        }
    }

    @Override
    public Optional<PeriodicTask> findByName(String name) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SELECT_JOINED + " WHERE t.name = ?")) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find periodic task: " + name, e);
        }
    }

    @Override
    public List<PeriodicTask> findAll(Boolean enabled, int offset, int limit) {
        String sql = SELECT_JOINED
                + (enabled != null ? " WHERE t.enabled = ?" : "")
                + " ORDER BY t.name LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            if (enabled != null) {
                ps.setBoolean(idx++, enabled);
            }
            ps.setInt(idx++, limit);
            ps.setInt(idx, offset);

            List<PeriodicTask> tasks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapRow(rs));
                }
            }
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list periodic tasks", e);
        }
    }

    @Override
    public int count(Boolean enabled) {
        String sql = "SELECT COUNT(*) FROM periodic_tasks" + (enabled != null ? " WHERE enabled = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (enabled != null) {
                ps.setBoolean(1, enabled);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count periodic tasks", e);
        }
    }

    @Override
    public List<PeriodicTask> findEnabledWithSchedules() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SELECT_JOINED + " WHERE t.enabled = TRUE ORDER BY t.name");
                ResultSet rs = ps.executeQuery()) {

            List<PeriodicTask> tasks = new ArrayList<>();
            while (rs.next()) {
                try {
                    tasks.add(mapRow(rs));
                } catch (IllegalStateException | IllegalArgumentException e) {
                    log.error("Skipping periodic task {}: {}", rs.getString("name"), e.getMessage());
                }
            }
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load enabled periodic tasks", e);
        }
    }

    @Override
    public boolean update(PeriodicTask task) {
        String sql = """
                    UPDATE periodic_tasks
                    SET name = ?, task = ?, interval_id = ?, crontab_id = ?, args = ?, kwargs = ?, queue = ?,
                        priority = ?, expires_at = ?, expire_seconds = ?, one_off = ?, start_time = ?, enabled = ?,
                        description = ?, updated_at = ?
                    WHERE id = ?
                """;

        Instant now = clock.instant();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int idx = bindDefinition(ps, task);
                JdbcSupport.setInstant(ps, idx++, now);
                ps.setLong(idx, task.id());

                int updated = ps.executeUpdate();
                if (updated > 0) {
                    JdbcSupport.bumpChangeMarker(conn, now);
                }
                conn.commit();
                return updated > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new ValidationException("Periodic task name already exists or schedule is missing: " + task.name(),
                    e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update periodic task: " + task.id(), e);
        }
    }

    @Override
    public boolean setEnabled(long id, boolean enabled) {
        String sql = "UPDATE periodic_tasks SET enabled = ?, updated_at = ? WHERE id = ?";

        Instant now = clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, enabled);
            JdbcSupport.setInstant(ps, 2, now);
            ps.setLong(3, id);

            int updated = ps.executeUpdate();
            if (updated > 0) {
                JdbcSupport.bumpChangeMarker(conn, now);
            }
            conn.commit();

            if (updated > 0) {
                log.debug("Periodic task {} {}", id, enabled ? "enabled" : "disabled");
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set enabled for periodic task: " + id, e);
        }
    }

    @Override
    public boolean delete(long id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM periodic_tasks WHERE id = ?")) {

            ps.setLong(1, id);
            int deleted = ps.executeUpdate();
            if (deleted > 0) {
                JdbcSupport.bumpChangeMarker(conn, clock.instant());
            }
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete periodic task: " + id, e);
        }
    }

    @Override
    public boolean recordRun(String name, Instant lastRunAt, int totalRunCount, boolean enabled) {
        // never re-enables: an admin disable that raced the loop wins
        String sql = """
                    UPDATE periodic_tasks
                    SET last_run_at = ?, total_run_count = ?, enabled = (enabled AND ?)
                    WHERE name = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            JdbcSupport.setInstant(ps, 1, lastRunAt);
            ps.setInt(2, totalRunCount);
            ps.setBoolean(3, enabled);
            ps.setString(4, name);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record run for periodic task: " + name, e);
        }
    }

    @Override
    public int countByIntervalId(long intervalId) {
        try (Connection conn = db.getConnection()) {
            return JdbcSupport.count(conn, "SELECT COUNT(*) FROM periodic_tasks WHERE interval_id = ?", intervalId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks for interval: " + intervalId, e);
        }
    }

    @Override
    public int countByCrontabId(long crontabId) {
        try (Connection conn = db.getConnection()) {
            return JdbcSupport.count(conn, "SELECT COUNT(*) FROM periodic_tasks WHERE crontab_id = ?", crontabId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks for crontab: " + crontabId, e);
        }
    }

    /**
     * Bind name through description (14 parameters).
     *
     * @return index of the next parameter
     */
    private int bindDefinition(PreparedStatement ps, PeriodicTask task) throws SQLException {
        ps.setString(1, task.name());
        ps.setString(2, task.task());
        JdbcSupport.setLongOrNull(ps, 3, task.intervalId());
        JdbcSupport.setLongOrNull(ps, 4, task.crontabId());
        ps.setString(5, JdbcSupport.toJson(task.args()));
        ps.setString(6, JdbcSupport.toJson(task.kwargs()));
        ps.setString(7, task.queue());
        JdbcSupport.setIntOrNull(ps, 8, task.priority());
        JdbcSupport.setInstant(ps, 9, task.expiresAt());
        JdbcSupport.setIntOrNull(ps, 10, task.expireSeconds());
        ps.setBoolean(11, task.oneOff());
        JdbcSupport.setInstant(ps, 12, task.startTime());
        ps.setBoolean(13, task.enabled());
        ps.setString(14, task.description());
        return 15;
    }

    private PeriodicTask mapRow(ResultSet rs) throws SQLException {
        Long intervalId = JdbcSupport.getLongOrNull(rs, "interval_id");
        Long crontabId = JdbcSupport.getLongOrNull(rs, "crontab_id");

        IntervalSchedule interval = null;
        String period = rs.getString("i_period");
        if (intervalId != null && period != null) {
            interval = new IntervalSchedule(intervalId, rs.getInt("i_every"), IntervalPeriod.valueOf(period));
        }

        CrontabSchedule crontab = null;
        if (crontabId != null && rs.getString("c_minute") != null) {
            crontab = new CrontabSchedule(
                    crontabId,
                    rs.getString("c_minute"),
                    rs.getString("c_hour"),
                    rs.getString("c_day_of_week"),
                    rs.getString("c_day_of_month"),
                    rs.getString("c_month_of_year"),
                    rs.getString("c_timezone"));
        }

        return PeriodicTask.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .task(rs.getString("task"))
                .intervalId(intervalId)
                .crontabId(crontabId)
                .interval(interval)
                .crontab(crontab)
                .args(JdbcSupport.readList(rs.getString("args")))
                .kwargs(JdbcSupport.readMap(rs.getString("kwargs")))
                .queue(rs.getString("queue"))
                .priority(JdbcSupport.getIntOrNull(rs, "priority"))
                .expiresAt(JdbcSupport.getInstant(rs, "expires_at"))
                .expireSeconds(JdbcSupport.getIntOrNull(rs, "expire_seconds"))
                .oneOff(rs.getBoolean("one_off"))
                .startTime(JdbcSupport.getInstant(rs, "start_time"))
                .enabled(rs.getBoolean("enabled"))
                .lastRunAt(JdbcSupport.getInstant(rs, "last_run_at"))
                .totalRunCount(rs.getInt("total_run_count"))
                .description(rs.getString("description"))
                .createdAt(JdbcSupport.getInstant(rs, "created_at"))
                .updatedAt(JdbcSupport.getInstant(rs, "updated_at"))
                .build();
    }
}
