package chronobeat.store;

import chronobeat.exception.ScheduleInUseException;
import chronobeat.model.CrontabSchedule;
import chronobeat.repository.CrontabRepository;
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
 * JDBC implementation of CrontabRepository.
 */
public class JdbcCrontabRepository implements CrontabRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCrontabRepository.class);
    private static final String REFERENCING_TASKS = "SELECT COUNT(*) FROM periodic_tasks WHERE crontab_id = ?";

    private final Database db;
    private final Clock clock;

    public JdbcCrontabRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public CrontabSchedule create(CrontabSchedule crontab) {
        String sql = """
                    INSERT INTO crontab_schedules (minute, hour, day_of_week, day_of_month, month_of_year, timezone)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            bindFields(ps, crontab);
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for crontab");
                }
                id = keys.getLong(1);
            }

            JdbcSupport.bumpChangeMarker(conn, clock.instant());
            conn.commit();

            log.debug("Created crontab {}: {}", id, crontab.display());
            return new CrontabSchedule(id, crontab.minute(), crontab.hour(), crontab.dayOfWeek(),
                    crontab.dayOfMonth(), crontab.monthOfYear(), crontab.timezone());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create crontab", e);
        }
    }

    @Override
    public Optional<CrontabSchedule> findById(long id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM crontab_schedules WHERE id = ?")) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find crontab: " + id, e);
        }
    }

    @Override
    public List<CrontabSchedule> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM crontab_schedules ORDER BY id");
                ResultSet rs = ps.executeQuery()) {

            List<CrontabSchedule> crontabs = new ArrayList<>();
            while (rs.next()) {
                crontabs.add(mapRow(rs));
            }
            return crontabs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list crontabs", e);
        }
    }

    @Override
    public boolean update(CrontabSchedule crontab) {
        String sql = """
                    UPDATE crontab_schedules
                    SET minute = ?, hour = ?, day_of_week = ?, day_of_month = ?, month_of_year = ?, timezone = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindFields(ps, crontab);
            ps.setLong(7, crontab.id());

            int updated = ps.executeUpdate();
            if (updated > 0) {
                JdbcSupport.bumpChangeMarker(conn, clock.instant());
            }
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update crontab: " + crontab.id(), e);
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
                    throw new ScheduleInUseException("crontab", id, referencing);
                }

                int deleted;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM crontab_schedules WHERE id = ?")) {
                    ps.setLong(1, id);
                    deleted = ps.executeUpdate();
                } catch (SQLException e) {
                    if (!JdbcSupport.isForeignKeyViolation(e)) {
                        throw e;
                    }
                    // a task was bound between the count and the delete
                    conn.rollback();
                    throw new ScheduleInUseException("crontab", id,
                            Math.max(1, JdbcSupport.count(conn, REFERENCING_TASKS, id)));
                }
                if (deleted > 0) {
                    JdbcSupport.bumpChangeMarker(conn, clock.instant());
                }
                conn.commit();

                if (deleted > 0) {
                    log.debug("Deleted crontab {}", id);
                }
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete crontab: " + id, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM crontab_schedules");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count crontabs", e);
        }
    }

    private void bindFields(PreparedStatement ps, CrontabSchedule crontab) throws SQLException {
        ps.setString(1, crontab.minute());
        ps.setString(2, crontab.hour());
        ps.setString(3, crontab.dayOfWeek());
        ps.setString(4, crontab.dayOfMonth());
        ps.setString(5, crontab.monthOfYear());
        ps.setString(6, crontab.timezone());
    }

    static CrontabSchedule mapRow(ResultSet rs) throws SQLException {
        return new CrontabSchedule(
                rs.getLong("id"),
                rs.getString("minute"),
                rs.getString("hour"),
                rs.getString("day_of_week"),
                rs.getString("day_of_month"),
                rs.getString("month_of_year"),
                rs.getString("timezone"));
    }
}
