package chronobeat.config;

import chronobeat.api.internal.v1.WorkerController;
import chronobeat.api.v1.CrontabController;
import chronobeat.api.v1.HealthController;
import chronobeat.api.v1.IntervalController;
import chronobeat.api.v1.PeriodicTaskController;
import chronobeat.api.v1.StatisticsController;
import chronobeat.api.v1.TaskResultController;
import chronobeat.beat.Beat;
import chronobeat.beat.ResultReaper;
import chronobeat.beat.ScheduleCache;
import chronobeat.beat.SchedulerLoop;
import chronobeat.dispatch.JdbcTaskDispatcher;
import chronobeat.dispatch.TaskDispatcher;
import chronobeat.repository.ChangeMarkerRepository;
import chronobeat.repository.CrontabRepository;
import chronobeat.repository.IntervalRepository;
import chronobeat.repository.PeriodicTaskRepository;
import chronobeat.repository.TaskResultRepository;
import chronobeat.server.RouterHandler;
import chronobeat.service.ScheduleAdminService;
import chronobeat.service.TaskResultService;
import chronobeat.store.Database;
import chronobeat.store.JdbcChangeMarkerRepository;
import chronobeat.store.JdbcCrontabRepository;
import chronobeat.store.JdbcIntervalRepository;
import chronobeat.store.JdbcPeriodicTaskRepository;
import chronobeat.store.JdbcTaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * deps.startBeat(); // start the scheduler loop and result reaper
 * ScheduleAdminService admin = deps.adminService();
 * // ... use services ...
 * deps.close(); // flush bookkeeping, close the pool
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final Database database;

    private final IntervalRepository intervalRepository;
    private final CrontabRepository crontabRepository;
    private final PeriodicTaskRepository taskRepository;
    private final ChangeMarkerRepository markerRepository;
    private final TaskResultRepository resultRepository;

    private final TaskDispatcher dispatcher;
    private final ScheduleAdminService adminService;
    private final TaskResultService resultService;
    private final Beat beat;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(SchedulerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.intervalRepository = new JdbcIntervalRepository(database, clock);
        this.crontabRepository = new JdbcCrontabRepository(database, clock);
        this.taskRepository = new JdbcPeriodicTaskRepository(database, clock);
        this.markerRepository = new JdbcChangeMarkerRepository(database, clock);
        this.resultRepository = new JdbcTaskResultRepository(database);

        // Services
        this.dispatcher = new JdbcTaskDispatcher(resultRepository, clock);
        this.adminService = new ScheduleAdminService(intervalRepository, crontabRepository, taskRepository,
                resultRepository, dispatcher, clock);
        this.resultService = new TaskResultService(resultRepository, clock);

        // Beat
        ScheduleCache cache = new ScheduleCache(taskRepository, markerRepository, config.refreshInterval(),
                config.unboundTaskPeriod());
        SchedulerLoop loop = new SchedulerLoop(cache, dispatcher, clock, config.refreshInterval(),
                config.minTick(), config.dispatchTimeout());
        ResultReaper reaper = new ResultReaper(resultRepository, config.resultStartedTimeout(), clock);
        this.beat = new Beat(loop, reaper, config.resultReaperInterval());

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create with a fixed or test clock.
     */
    public static Dependencies create(SchedulerConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    public SchedulerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public IntervalRepository intervalRepository() {
        return intervalRepository;
    }

    public CrontabRepository crontabRepository() {
        return crontabRepository;
    }

    public PeriodicTaskRepository taskRepository() {
        return taskRepository;
    }

    public ChangeMarkerRepository markerRepository() {
        return markerRepository;
    }

    public TaskResultRepository resultRepository() {
        return resultRepository;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public ScheduleAdminService adminService() {
        return adminService;
    }

    public TaskResultService resultService() {
        return resultService;
    }

    public Beat beat() {
        return beat;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, beat))
                    .registerController(new StatisticsController(adminService))
                    .registerController(new IntervalController(adminService))
                    .registerController(new CrontabController(adminService))
                    .registerController(new PeriodicTaskController(adminService))
                    .registerController(new TaskResultController(resultService))
                    .registerController(new WorkerController(resultService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the scheduler loop and the result reaper.
     */
    public void startBeat() {
        beat.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop the beat first so pending bookkeeping is flushed while the pool is open
        try {
            beat.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping beat: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
