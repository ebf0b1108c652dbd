package chronobeat.dispatch;

import chronobeat.model.PeriodicTask;

import java.time.Instant;

/**
 * Per-dispatch routing and expiry.
 *
 * @param queue            destination queue, or null for the default
 * @param priority         priority, or null for the default
 * @param expiresAt        absolute expiry, or null
 * @param periodicTaskName periodic task that triggered the dispatch, or null
 */
public record DispatchOptions(String queue, Integer priority, Instant expiresAt, String periodicTaskName) {

    public static DispatchOptions none() {
        return new DispatchOptions(null, null, null, null);
    }

    /**
     * Options of a periodic task, with a relative expiry resolved against
     * {@code now}.
     */
    public static DispatchOptions forTask(PeriodicTask task, Instant now) {
        Instant expiresAt = task.expiresAt();
        if (expiresAt == null && task.expireSeconds() != null) {
            expiresAt = now.plusSeconds(task.expireSeconds());
        }
        return new DispatchOptions(task.queue(), task.priority(), expiresAt, task.name());
    }
}
