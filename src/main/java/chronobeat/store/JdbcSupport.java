package chronobeat.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Column helpers shared by the JDBC repositories.
 */
final class JdbcSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JdbcSupport() {
    }

    static void setInstant(PreparedStatement ps, int idx, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(idx, instant.atOffset(ZoneOffset.UTC));
        } else {
            ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static void setIntOrNull(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(idx, value);
        } else {
            ps.setNull(idx, Types.INTEGER);
        }
    }

    static void setLongOrNull(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(idx, value);
        } else {
            ps.setNull(idx, Types.BIGINT);
        }
    }

    static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalStateException if the stored text is not a JSON array
     */
    static List<Object> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored args are not a JSON array: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalStateException if the stored text is not a JSON object
     */
    static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored kwargs are not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Bump the change marker on the caller's connection. The caller commits.
     */
    static void bumpChangeMarker(Connection conn, Instant now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE periodic_tasks_changed SET version = version + 1, last_update = ? WHERE id = 1")) {
            setInstant(ps, 1, now);
            ps.executeUpdate();
        }
    }

    static int count(Connection conn, String sql, long param) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Referential integrity violation, as reported by H2 (typed exception) or
     * PostgreSQL (SQLSTATE 23503).
     */
    static boolean isForeignKeyViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException || "23503".equals(e.getSQLState());
    }
}
