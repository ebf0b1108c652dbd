package chronobeat.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One dispatched execution of a task and its outcome.
 * Written by the dispatcher (PENDING) and by workers afterwards.
 */
public final class TaskResult {
    private final String id; // dispatch id
    private final String taskName;
    private final String periodicTaskName; // null for ad-hoc runs
    private final TaskResultStatus status;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final String queue;
    private final int priority;
    private final Instant expiresAt;
    private final String workerId;
    private final int attempts;
    private final String result; // JSON
    private final String traceback;
    private final Instant dateCreated;
    private final Instant dateStarted;
    private final Instant dateDone;

    private TaskResult(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName is required");
        this.periodicTaskName = builder.periodicTaskName;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.args = builder.args != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.args))
                : List.of();
        this.kwargs = builder.kwargs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs))
                : Map.of();
        this.queue = builder.queue;
        this.priority = builder.priority;
        this.expiresAt = builder.expiresAt;
        this.workerId = builder.workerId;
        this.attempts = builder.attempts;
        this.result = builder.result;
        this.traceback = builder.traceback;
        this.dateCreated = builder.dateCreated;
        this.dateStarted = builder.dateStarted;
        this.dateDone = builder.dateDone;
    }

    public String id() {
        return id;
    }

    public String taskName() {
        return taskName;
    }

    public String periodicTaskName() {
        return periodicTaskName;
    }

    public TaskResultStatus status() {
        return status;
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

    public int priority() {
        return priority;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public String workerId() {
        return workerId;
    }

    public int attempts() {
        return attempts;
    }

    public String result() {
        return result;
    }

    public String traceback() {
        return traceback;
    }

    public Instant dateCreated() {
        return dateCreated;
    }

    public Instant dateStarted() {
        return dateStarted;
    }

    public Instant dateDone() {
        return dateDone;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskName;
        private String periodicTaskName;
        private TaskResultStatus status = TaskResultStatus.PENDING;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private String queue;
        private int priority = 0;
        private Instant expiresAt;
        private String workerId;
        private int attempts = 0;
        private String result;
        private String traceback;
        private Instant dateCreated;
        private Instant dateStarted;
        private Instant dateDone;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder periodicTaskName(String periodicTaskName) {
            this.periodicTaskName = periodicTaskName;
            return this;
        }

        public Builder status(TaskResultStatus status) {
            this.status = status;
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

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder traceback(String traceback) {
            this.traceback = traceback;
            return this;
        }

        public Builder dateCreated(Instant dateCreated) {
            this.dateCreated = dateCreated;
            return this;
        }

        public Builder dateStarted(Instant dateStarted) {
            this.dateStarted = dateStarted;
            return this;
        }

        public Builder dateDone(Instant dateDone) {
            this.dateDone = dateDone;
            return this;
        }

        public TaskResult build() {
            return new TaskResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskResult other))
            return false;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskResult{id='" + id + "', task='" + taskName + "', status=" + status + "}";
    }
}
