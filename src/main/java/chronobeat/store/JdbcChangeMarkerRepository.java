package chronobeat.store;

import chronobeat.model.ChangeMarker;
import chronobeat.repository.ChangeMarkerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;

/**
 * JDBC implementation of ChangeMarkerRepository.
 */
public class JdbcChangeMarkerRepository implements ChangeMarkerRepository {

    private final Database db;
    private final Clock clock;

    public JdbcChangeMarkerRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public ChangeMarker current() {
        try (Connection conn = db.getConnection()) {
            ChangeMarker marker = read(conn);
            conn.commit();
            return marker;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read change marker", e);
        }
    }

    @Override
    public ChangeMarker bump() {
        try (Connection conn = db.getConnection()) {
            JdbcSupport.bumpChangeMarker(conn, clock.instant());
            ChangeMarker marker = read(conn);
            conn.commit();
            return marker;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to bump change marker", e);
        }
    }

    private ChangeMarker read(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT version, last_update FROM periodic_tasks_changed WHERE id = 1");
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("Change marker row is missing");
            }
            return new ChangeMarker(rs.getLong("version"), JdbcSupport.getInstant(rs, "last_update"));
        }
    }
}
