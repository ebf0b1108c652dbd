package chronobeat.service;

import chronobeat.dispatch.DispatchOptions;
import chronobeat.dispatch.TaskDispatcher;
import chronobeat.exception.ValidationException;
import chronobeat.model.CrontabSchedule;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.model.PeriodicTask;
import chronobeat.model.TaskResultStatus;
import chronobeat.model.TaskStatistics;
import chronobeat.repository.CrontabRepository;
import chronobeat.repository.IntervalRepository;
import chronobeat.repository.PeriodicTaskRepository;
import chronobeat.repository.TaskResultRepository;
import chronobeat.schedule.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Admin operations on schedules and periodic tasks.
 * Validates input before anything reaches the store; the repositories bump
 * the change marker so the beat loop picks every mutation up.
 */
public class ScheduleAdminService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleAdminService.class);

    static final int MAX_PRIORITY = 255;

    private final IntervalRepository intervalRepository;
    private final CrontabRepository crontabRepository;
    private final PeriodicTaskRepository taskRepository;
    private final TaskResultRepository resultRepository;
    private final TaskDispatcher dispatcher;
    private final Clock clock;

    public ScheduleAdminService(IntervalRepository intervalRepository, CrontabRepository crontabRepository,
            PeriodicTaskRepository taskRepository, TaskResultRepository resultRepository,
            TaskDispatcher dispatcher, Clock clock) {
        this.intervalRepository = intervalRepository;
        this.crontabRepository = crontabRepository;
        this.taskRepository = taskRepository;
        this.resultRepository = resultRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    // ---------- intervals ----------

    public List<IntervalSchedule> listIntervals() {
        return intervalRepository.findAll();
    }

    public Optional<IntervalSchedule> getInterval(long id) {
        return intervalRepository.findById(id);
    }

    public IntervalSchedule createInterval(int every, IntervalPeriod period) {
        validateInterval(every, period);
        IntervalSchedule created = intervalRepository.create(every, period);
        log.info("Created interval {} ({})", created.id(), created.display());
        return created;
    }

    public Optional<IntervalSchedule> updateInterval(long id, int every, IntervalPeriod period) {
        validateInterval(every, period);
        IntervalSchedule updated = new IntervalSchedule(id, every, period);
        if (!intervalRepository.update(updated)) {
            return Optional.empty();
        }
        log.info("Updated interval {} ({})", id, updated.display());
        return Optional.of(updated);
    }

    /**
     * @return false if not found
     * @throws chronobeat.exception.ScheduleInUseException if a task uses it
     */
    public boolean deleteInterval(long id) {
        boolean deleted = intervalRepository.delete(id);
        if (deleted) {
            log.info("Deleted interval {}", id);
        }
        return deleted;
    }

    // ---------- crontabs ----------

    public List<CrontabSchedule> listCrontabs() {
        return crontabRepository.findAll();
    }

    public Optional<CrontabSchedule> getCrontab(long id) {
        return crontabRepository.findById(id);
    }

    public CrontabSchedule createCrontab(CrontabSchedule crontab) {
        validateCrontab(crontab);
        CrontabSchedule created = crontabRepository.create(crontab);
        log.info("Created crontab {} ({})", created.id(), created.display());
        return created;
    }

    public Optional<CrontabSchedule> updateCrontab(long id, CrontabSchedule crontab) {
        CrontabSchedule updated = new CrontabSchedule(id, crontab.minute(), crontab.hour(), crontab.dayOfWeek(),
                crontab.dayOfMonth(), crontab.monthOfYear(), crontab.timezone());
        validateCrontab(updated);
        if (!crontabRepository.update(updated)) {
            return Optional.empty();
        }
        log.info("Updated crontab {} ({})", id, updated.display());
        return Optional.of(updated);
    }

    /**
     * @return false if not found
     * @throws chronobeat.exception.ScheduleInUseException if a task uses it
     */
    public boolean deleteCrontab(long id) {
        boolean deleted = crontabRepository.delete(id);
        if (deleted) {
            log.info("Deleted crontab {}", id);
        }
        return deleted;
    }

    // ---------- periodic tasks ----------

    public List<PeriodicTask> listTasks(Boolean enabled, int offset, int limit) {
        return taskRepository.findAll(enabled, Math.max(offset, 0), Math.max(limit, 1));
    }

    public int countTasks(Boolean enabled) {
        return taskRepository.count(enabled);
    }

    public Optional<PeriodicTask> getTask(long id) {
        return taskRepository.findById(id);
    }

    public PeriodicTask createTask(TaskFields fields) {
        requireText(fields.name(), "name");
        requireText(fields.task(), "task");

        PeriodicTask draft = PeriodicTask.builder()
                .name(trimToNull(fields.name()))
                .task(trimToNull(fields.task()))
                .intervalId(fields.intervalId())
                .crontabId(fields.crontabId())
                .args(fields.args())
                .kwargs(fields.kwargs())
                .queue(trimToNull(fields.queue()))
                .priority(fields.priority())
                .expiresAt(fields.expiresAt())
                .expireSeconds(fields.expireSeconds())
                .oneOff(Boolean.TRUE.equals(fields.oneOff()))
                .startTime(fields.startTime())
                .enabled(fields.enabled() == null || fields.enabled())
                .description(fields.description())
                .build();

        validateTask(draft, null);

        PeriodicTask created = taskRepository.create(draft);
        log.info("Created periodic task {} ({}) -> {}", created.id(), created.name(), created.task());
        return taskRepository.findById(created.id()).orElse(created);
    }

    public Optional<PeriodicTask> updateTask(long id, TaskFields fields) {
        Optional<PeriodicTask> existing = taskRepository.findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        if (fields.name() != null) {
            requireText(fields.name(), "name");
        }
        if (fields.task() != null) {
            requireText(fields.task(), "task");
        }
        if (fields.intervalId() != null && fields.crontabId() != null) {
            throw new ValidationException("Exactly one of interval_id or crontab_id must be set");
        }
        if (fields.expiresAt() != null && fields.expireSeconds() != null) {
            throw new ValidationException("Only one of expires_at or expire_seconds may be set");
        }

        PeriodicTask.Builder builder = existing.get().toBuilder();

        if (fields.name() != null) {
            builder.name(trimToNull(fields.name()));
        }
        if (fields.task() != null) {
            builder.task(trimToNull(fields.task()));
        }
        if (fields.intervalId() != null) {
            builder.intervalId(fields.intervalId()).crontabId(null);
        }
        if (fields.crontabId() != null) {
            builder.crontabId(fields.crontabId()).intervalId(null);
        }
        if (fields.args() != null) {
            builder.args(fields.args());
        }
        if (fields.kwargs() != null) {
            builder.kwargs(fields.kwargs());
        }
        if (fields.queue() != null) {
            builder.queue(trimToNull(fields.queue()));
        }
        if (fields.priority() != null) {
            builder.priority(fields.priority());
        }
        if (fields.expiresAt() != null) {
            builder.expiresAt(fields.expiresAt()).expireSeconds(null);
        }
        if (fields.expireSeconds() != null) {
            builder.expireSeconds(fields.expireSeconds()).expiresAt(null);
        }
        if (fields.oneOff() != null) {
            builder.oneOff(fields.oneOff());
        }
        if (fields.startTime() != null) {
            builder.startTime(fields.startTime());
        }
        if (fields.enabled() != null) {
            builder.enabled(fields.enabled());
        }
        if (fields.description() != null) {
            builder.description(fields.description());
        }

        PeriodicTask draft = builder.build();
        validateTask(draft, id);

        if (!taskRepository.update(draft)) {
            return Optional.empty();
        }
        log.info("Updated periodic task {} ({})", id, draft.name());
        return taskRepository.findById(id);
    }

    public boolean deleteTask(long id) {
        boolean deleted = taskRepository.delete(id);
        if (deleted) {
            log.info("Deleted periodic task {}", id);
        }
        return deleted;
    }

    public Optional<PeriodicTask> enableTask(long id) {
        return setEnabled(id, true);
    }

    public Optional<PeriodicTask> disableTask(long id) {
        return setEnabled(id, false);
    }

    private Optional<PeriodicTask> setEnabled(long id, boolean enabled) {
        if (!taskRepository.setEnabled(id, enabled)) {
            return Optional.empty();
        }
        log.info("Periodic task {} {}", id, enabled ? "enabled" : "disabled");
        return taskRepository.findById(id);
    }

    /**
     * Dispatch a task immediately, outside its schedule. Run bookkeeping is not
     * touched, so the regular schedule is unaffected.
     *
     * @return dispatch id, or empty if the task does not exist
     * @throws chronobeat.exception.DispatchUnavailableException if the execution system is unavailable
     */
    public Optional<String> runTaskNow(long id) {
        Optional<PeriodicTask> task = taskRepository.findById(id);
        if (task.isEmpty()) {
            return Optional.empty();
        }

        PeriodicTask t = task.get();
        String dispatchId = dispatcher.dispatch(t.task(), t.args(), t.kwargs(),
                DispatchOptions.forTask(t, clock.instant()));
        log.info("Periodic task {} ({}) run now as {}", t.id(), t.name(), dispatchId);
        return Optional.of(dispatchId);
    }

    public TaskStatistics getTaskStatistics() {
        int total = taskRepository.count(null);
        int enabled = taskRepository.count(Boolean.TRUE);
        Map<TaskResultStatus, Integer> byStatus = resultRepository.countByStatus();
        int totalResults = byStatus.values().stream().mapToInt(Integer::intValue).sum();

        return new TaskStatistics(
                total,
                enabled,
                total - enabled,
                intervalRepository.count(),
                crontabRepository.count(),
                totalResults,
                byStatus);
    }

    // ---------- validation ----------

    private void validateInterval(int every, IntervalPeriod period) {
        if (period == null) {
            throw new ValidationException("period is required");
        }
        if (every <= 0) {
            throw new ValidationException("every must be positive, got " + every);
        }
    }

    private void validateCrontab(CrontabSchedule crontab) {
        CronSchedule schedule;
        try {
            schedule = crontab.toSchedule();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid crontab: " + e.getMessage(), e);
        }
        try {
            schedule.nextAfter(clock.instant());
        } catch (IllegalStateException e) {
            throw new ValidationException("Crontab " + crontab.expression() + " never matches", e);
        }
    }

    private void validateTask(PeriodicTask draft, Long existingId) {
        if (!draft.hasSingleBinding()) {
            throw new ValidationException("Exactly one of interval_id or crontab_id must be set");
        }
        if (draft.intervalId() != null && intervalRepository.findById(draft.intervalId()).isEmpty()) {
            throw new ValidationException("Interval " + draft.intervalId() + " does not exist");
        }
        if (draft.crontabId() != null && crontabRepository.findById(draft.crontabId()).isEmpty()) {
            throw new ValidationException("Crontab " + draft.crontabId() + " does not exist");
        }
        if (draft.priority() != null && (draft.priority() < 0 || draft.priority() > MAX_PRIORITY)) {
            throw new ValidationException("priority must be between 0 and " + MAX_PRIORITY);
        }
        if (draft.expiresAt() != null && draft.expireSeconds() != null) {
            throw new ValidationException("Only one of expires_at or expire_seconds may be set");
        }
        if (draft.expireSeconds() != null && draft.expireSeconds() <= 0) {
            throw new ValidationException("expire_seconds must be positive");
        }

        Optional<PeriodicTask> sameName = taskRepository.findByName(draft.name());
        if (sameName.isPresent() && (existingId == null || sameName.get().id() != existingId)) {
            throw new ValidationException("Periodic task name already exists: " + draft.name());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
