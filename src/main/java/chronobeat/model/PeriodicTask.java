package chronobeat.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable periodic task definition plus its run bookkeeping.
 * Exactly one of {@link #intervalId()} / {@link #crontabId()} is set for any
 * task created through the admin API.
 */
public final class PeriodicTask {
    private final long id;
    private final String name;
    private final String task; // name understood by the execution system
    private final Long intervalId;
    private final Long crontabId;
    private final IntervalSchedule interval; // populated when loaded with schedules
    private final CrontabSchedule crontab;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final String queue;
    private final Integer priority;
    private final Instant expiresAt;
    private final Integer expireSeconds;
    private final boolean oneOff;
    private final Instant startTime;
    private final boolean enabled;
    private final Instant lastRunAt;
    private final int totalRunCount;
    private final String description;
    private final Instant createdAt;
    private final Instant updatedAt;

    private PeriodicTask(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.task = Objects.requireNonNull(builder.task, "task is required");
        this.intervalId = builder.intervalId;
        this.crontabId = builder.crontabId;
        this.interval = builder.interval;
        this.crontab = builder.crontab;
        // args/kwargs may contain JSON nulls
        this.args = builder.args != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.args))
                : List.of();
        this.kwargs = builder.kwargs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs))
                : Map.of();
        this.queue = builder.queue;
        this.priority = builder.priority;
        this.expiresAt = builder.expiresAt;
        this.expireSeconds = builder.expireSeconds;
        this.oneOff = builder.oneOff;
        this.startTime = builder.startTime;
        this.enabled = builder.enabled;
        this.lastRunAt = builder.lastRunAt;
        this.totalRunCount = builder.totalRunCount;
        this.description = builder.description;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String task() {
        return task;
    }

    public Long intervalId() {
        return intervalId;
    }

    public Long crontabId() {
        return crontabId;
    }

    public IntervalSchedule interval() {
        return interval;
    }

    public CrontabSchedule crontab() {
        return crontab;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    public String queue() {
        return queue;
    }

    public Integer priority() {
        return priority;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Integer expireSeconds() {
        return expireSeconds;
    }

    public boolean oneOff() {
        return oneOff;
    }

    public Instant startTime() {
        return startTime;
    }

    public boolean enabled() {
        return enabled;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public int totalRunCount() {
        return totalRunCount;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True when the task has exactly one schedule binding */
    public boolean hasSingleBinding() {
        return (intervalId != null) != (crontabId != null);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .task(task)
                .intervalId(intervalId)
                .crontabId(crontabId)
                .interval(interval)
                .crontab(crontab)
                .args(args)
                .kwargs(kwargs)
                .queue(queue)
                .priority(priority)
                .expiresAt(expiresAt)
                .expireSeconds(expireSeconds)
                .oneOff(oneOff)
                .startTime(startTime)
                .enabled(enabled)
                .lastRunAt(lastRunAt)
                .totalRunCount(totalRunCount)
                .description(description)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String name;
        private String task;
        private Long intervalId;
        private Long crontabId;
        private IntervalSchedule interval;
        private CrontabSchedule crontab;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private String queue;
        private Integer priority;
        private Instant expiresAt;
        private Integer expireSeconds;
        private boolean oneOff = false;
        private Instant startTime;
        private boolean enabled = true;
        private Instant lastRunAt;
        private int totalRunCount = 0;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder task(String task) {
            this.task = task;
            return this;
        }

        public Builder intervalId(Long intervalId) {
            this.intervalId = intervalId;
            return this;
        }

        public Builder crontabId(Long crontabId) {
            this.crontabId = crontabId;
            return this;
        }

        public Builder interval(IntervalSchedule interval) {
            this.interval = interval;
            return this;
        }

        public Builder crontab(CrontabSchedule crontab) {
            this.crontab = crontab;
            return this;
        }

        public Builder args(List<Object> args) {
            this.args = args;
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder expireSeconds(Integer expireSeconds) {
            this.expireSeconds = expireSeconds;
            return this;
        }

        public Builder oneOff(boolean oneOff) {
            this.oneOff = oneOff;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder totalRunCount(int totalRunCount) {
            this.totalRunCount = totalRunCount;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public PeriodicTask build() {
            return new PeriodicTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeriodicTask other))
            return false;
        return id == other.id && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "PeriodicTask{id=" + id + ", name='" + name + "', task='" + task + "', enabled=" + enabled + "}";
    }
}
