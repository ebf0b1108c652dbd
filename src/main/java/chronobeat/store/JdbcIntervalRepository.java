package chronobeat.store;

import chronobeat.exception.ScheduleInUseException;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.repository.IntervalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of IntervalRepository.
 */
public class JdbcIntervalRepository implements IntervalRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcIntervalRepository.class);
    private static final String REFERENCING_TASKS = "SELECT COUNT(*) FROM periodic_tasks WHERE interval_id = ?";

    private final Database db;
    private final Clock clock;

    public JdbcIntervalRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public IntervalSchedule create(int every, IntervalPeriod period) {
        String sql = "INSERT INTO interval_schedules (every, period) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setInt(1, every);
            ps.setString(2, period.name());
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for interval");
                }
                id = keys.getLong(1);
            }

            JdbcSupport.bumpChangeMarker(conn, clock.instant());
            conn.commit();

            log.debug("Created interval {}: every {} {}", id, every, period);
            return new IntervalSchedule(id, every, period);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create interval", e);
        }
    }

    @Override
    public Optional<IntervalSchedule> findById(long id) {
        String sql = "SELECT * FROM interval_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find interval: " + id, e);
        }
    }

    @Override
    public List<IntervalSchedule> findAll() {
        String sql = "SELECT * FROM interval_schedules ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<IntervalSchedule> intervals = new ArrayList<>();
            while (rs.next()) {
                intervals.add(mapRow(rs));
            }
            return intervals;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list intervals", e);
        }
    }

    @Override
    public boolean update(IntervalSchedule interval) {
        String sql = "UPDATE interval_schedules SET every = ?, period = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, interval.every());
            ps.setString(2, interval.period().name());
            ps.setLong(3, interval.id());

            int updated = ps.executeUpdate();
            if (updated > 0) {
                JdbcSupport.bumpChangeMarker(conn, clock.instant());
            }
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update interval: " + interval.id(), e);
        }
    }

    int countReferencingTasks(Connection conn, long id) throws SQLException {
        return JdbcSupport.count(conn, REFERENCING_TASKS, id);
    }

    @Override
    public boolean delete(long id) {
        try (Connection conn = db.getConnection()) {
            try {
                int referencing = countReferencingTasks(conn, id);
                if (referencing > 0) {
                    conn.rollback();
                    throw new ScheduleInUseException("interval", id, referencing);
                }

                int deleted;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM interval_schedules WHERE id = ?")) {
                    ps.setLong(1, id);
                    deleted = ps.executeUpdate();
                } catch (SQLException e) {
                    if (!JdbcSupport.isForeignKeyViolation(e)) {
                        throw e;
                    }
                    // a task was bound between the count and the delete
                    conn.rollback();
                    throw new ScheduleInUseException("interval", id,
                            Math.max(1, JdbcSupport.count(conn, REFERENCING_TASKS, id)));
                }
                if (deleted > 0) {
                    JdbcSupport.bumpChangeMarker(conn, clock.instant());
                }
                conn.commit();

                if (deleted > 0) {
                    log.debug("Deleted interval {}", id);
                }
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete interval: " + id, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM interval_schedules");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count intervals", e);
        }
    }

    static IntervalSchedule mapRow(ResultSet rs) throws SQLException {
        return new IntervalSchedule(
                rs.getLong("id"),
                rs.getInt("every"),
                IntervalPeriod.valueOf(rs.getString("period")));
    }
}
