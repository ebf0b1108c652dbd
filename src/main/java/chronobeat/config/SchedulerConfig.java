package chronobeat.config;

import java.time.Duration;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/chronobeat;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;NON_KEYWORDS=MINUTE,HOUR";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Beat loop settings
    private Duration refreshInterval = Duration.ofSeconds(5);
    private Duration minTick = Duration.ofSeconds(1);
    private Duration dispatchTimeout = Duration.ofSeconds(10);
    private Duration unboundTaskPeriod = null; // unbound tasks are skipped unless set

    // Result settings
    private Duration resultStartedTimeout = Duration.ofMinutes(30);
    private Duration resultReaperInterval = Duration.ofSeconds(60);

    // Auth settings (optional)
    private String workerKey = null; // If set, workers must provide X-Chronobeat-Key header

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        // Override from environment variables
        String dbUrl = System.getenv("CHRONOBEAT_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("CHRONOBEAT_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String port = System.getenv("CHRONOBEAT_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String refreshMs = System.getenv("CHRONOBEAT_REFRESH_INTERVAL_MS");
        if (refreshMs != null && !refreshMs.isBlank()) {
            config.refreshInterval = Duration.ofMillis(Long.parseLong(refreshMs.trim()));
        }

        String minTickMs = System.getenv("CHRONOBEAT_MIN_TICK_MS");
        if (minTickMs != null && !minTickMs.isBlank()) {
            config.minTick = Duration.ofMillis(Long.parseLong(minTickMs.trim()));
        }

        String dispatchTimeoutMs = System.getenv("CHRONOBEAT_DISPATCH_TIMEOUT_MS");
        if (dispatchTimeoutMs != null && !dispatchTimeoutMs.isBlank()) {
            config.dispatchTimeout = Duration.ofMillis(Long.parseLong(dispatchTimeoutMs.trim()));
        }

        String unboundPeriod = System.getenv("CHRONOBEAT_UNBOUND_TASK_PERIOD_S");
        if (unboundPeriod != null && !unboundPeriod.isBlank()) {
            config.unboundTaskPeriod = Duration.ofSeconds(Long.parseLong(unboundPeriod.trim()));
        }

        String resultTimeout = System.getenv("CHRONOBEAT_RESULT_TIMEOUT_S");
        if (resultTimeout != null && !resultTimeout.isBlank()) {
            config.resultStartedTimeout = Duration.ofSeconds(Long.parseLong(resultTimeout.trim()));
        }

        String workerKey = System.getenv("CHRONOBEAT_WORKER_KEY");
        if (workerKey != null && !workerKey.isBlank()) {
            config.workerKey = workerKey;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration refreshInterval() {
        return refreshInterval;
    }

    public Duration minTick() {
        return minTick;
    }

    public Duration dispatchTimeout() {
        return dispatchTimeout;
    }

    /** Period used for tasks bound to no schedule, or null to exclude them. */
    public Duration unboundTaskPeriod() {
        return unboundTaskPeriod;
    }

    public Duration resultStartedTimeout() {
        return resultStartedTimeout;
    }

    public Duration resultReaperInterval() {
        return resultReaperInterval;
    }

    public String workerKey() {
        return workerKey;
    }

    public boolean hasWorkerKey() {
        return workerKey != null && !workerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public SchedulerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public SchedulerConfig withRefreshInterval(Duration interval) {
        this.refreshInterval = interval;
        return this;
    }

    public SchedulerConfig withMinTick(Duration tick) {
        this.minTick = tick;
        return this;
    }

    public SchedulerConfig withDispatchTimeout(Duration timeout) {
        this.dispatchTimeout = timeout;
        return this;
    }

    public SchedulerConfig withUnboundTaskPeriod(Duration period) {
        this.unboundTaskPeriod = period;
        return this;
    }

    public SchedulerConfig withResultStartedTimeout(Duration timeout) {
        this.resultStartedTimeout = timeout;
        return this;
    }

    public SchedulerConfig withResultReaperInterval(Duration interval) {
        this.resultReaperInterval = interval;
        return this;
    }

    public SchedulerConfig withWorkerKey(String key) {
        this.workerKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", refreshInterval=" + refreshInterval +
                ", minTick=" + minTick +
                ", unboundTaskPeriod=" + unboundTaskPeriod +
                ", workerKeySet=" + hasWorkerKey() +
                '}';
    }
}
