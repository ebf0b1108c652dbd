package chronobeat.store;

import chronobeat.config.SchedulerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Locale;

/**
 * Owns the pooled connections for the schedule tables and the result log, and
 * creates those tables on startup. Connections come out of the pool with
 * auto-commit off; repositories commit or roll back themselves.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig pool = new HikariConfig();
        pool.setPoolName("chronobeat-db-pool");
        pool.setJdbcUrl(withCrontabColumns(jdbcUrl));
        pool.setMaximumPoolSize(poolSize);
        pool.setMinimumIdle(Math.min(2, poolSize));
        pool.setConnectionTimeout(Duration.ofSeconds(5).toMillis());
        pool.setIdleTimeout(Duration.ofMinutes(5).toMillis());
        pool.setAutoCommit(false);

        this.dataSource = new HikariDataSource(pool);
        log.info("Opened {} (pool size {})", jdbcUrl, poolSize);

        initSchema();
    }

    /**
     * H2 2.x reserves MINUTE and HOUR, which name two crontab_schedules columns.
     * H2 URLs that do not set NON_KEYWORDS get it appended.
     */
    static String withCrontabColumns(String jdbcUrl) {
        if (!jdbcUrl.startsWith("jdbc:h2:") || jdbcUrl.toUpperCase(Locale.ROOT).contains("NON_KEYWORDS=")) {
            return jdbcUrl;
        }
        return jdbcUrl + ";NON_KEYWORDS=MINUTE,HOUR";
    }

    /**
     * Borrow a pooled connection; close it to return it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS interval_schedules (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            every           INT NOT NULL,
                            period          VARCHAR(16) NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS crontab_schedules (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            minute          VARCHAR(240) DEFAULT '*' NOT NULL,
                            hour            VARCHAR(96) DEFAULT '*' NOT NULL,
                            day_of_week     VARCHAR(64) DEFAULT '*' NOT NULL,
                            day_of_month    VARCHAR(124) DEFAULT '*' NOT NULL,
                            month_of_year   VARCHAR(64) DEFAULT '*' NOT NULL,
                            timezone        VARCHAR(64) DEFAULT 'UTC' NOT NULL
                        );
                    """);

            // ---------- PERIODIC TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS periodic_tasks (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            name            VARCHAR(200) NOT NULL UNIQUE,
                            task            VARCHAR(200) NOT NULL,
                            interval_id     BIGINT REFERENCES interval_schedules(id),
                            crontab_id      BIGINT REFERENCES crontab_schedules(id),
                            args            CLOB,
                            kwargs          CLOB,
                            queue           VARCHAR(200),
                            priority        INT,
                            expires_at      TIMESTAMP WITH TIME ZONE,
                            expire_seconds  INT,
                            one_off         BOOLEAN DEFAULT FALSE NOT NULL,
                            start_time      TIMESTAMP WITH TIME ZONE,
                            enabled         BOOLEAN DEFAULT TRUE NOT NULL,
                            last_run_at     TIMESTAMP WITH TIME ZONE,
                            total_run_count INT DEFAULT 0 NOT NULL,
                            description     VARCHAR(2048),
                            created_at      TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- CHANGE MARKER ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS periodic_tasks_changed (
                            id              INT PRIMARY KEY,
                            version         BIGINT DEFAULT 0 NOT NULL,
                            last_update     TIMESTAMP WITH TIME ZONE NOT NULL
                        );
                    """);

            // ---------- TASK RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_results (
                            id                  VARCHAR(64) PRIMARY KEY,
                            task_name           VARCHAR(200) NOT NULL,
                            periodic_task_name  VARCHAR(200),
                            status              VARCHAR(16) DEFAULT 'PENDING' NOT NULL,
                            args                CLOB,
                            kwargs              CLOB,
                            queue               VARCHAR(200),
                            priority            INT DEFAULT 0 NOT NULL,
                            expires_at          TIMESTAMP WITH TIME ZONE,
                            worker_id           VARCHAR(64),
                            attempts            INT DEFAULT 0 NOT NULL,
                            result              CLOB,
                            traceback           CLOB,
                            date_created        TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            date_started        TIMESTAMP WITH TIME ZONE,
                            date_done           TIMESTAMP WITH TIME ZONE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_periodic_tasks_enabled ON periodic_tasks(enabled);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_periodic_tasks_interval ON periodic_tasks(interval_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_periodic_tasks_crontab ON periodic_tasks(crontab_id);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_results_status_priority ON task_results(status, priority DESC, date_created);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_task_name ON task_results(task_name);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_date_done ON task_results(date_done);");

            st.executeBatch();
            ensureChangeMarkerRow(conn);
            conn.commit();

            log.info("Scheduler tables ready");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create scheduler tables", e);
        }
    }

    private void ensureChangeMarkerRow(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM periodic_tasks_changed WHERE id = 1");
                ResultSet rs = ps.executeQuery()) {
            if (rs.next() && rs.getInt(1) > 0) {
                return;
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO periodic_tasks_changed (id, version, last_update) VALUES (1, 0, CURRENT_TIMESTAMP)")) {
            ps.executeUpdate();
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Connection pool shut down");
        }
    }
}
