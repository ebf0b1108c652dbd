package chronobeat.repository;

import chronobeat.model.PeriodicTask;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for periodic task definitions.
 * Admin mutations bump the change marker; run bookkeeping does not.
 */
public interface PeriodicTaskRepository {

    /**
     * Insert a new task definition.
     *
     * @param task definition; id, bookkeeping and timestamps are ignored
     * @return the stored task with id and timestamps populated
     */
    PeriodicTask create(PeriodicTask task);

    Optional<PeriodicTask> findById(long id);

    Optional<PeriodicTask> findByName(String name);

    /**
     * List tasks ordered by name.
     *
     * @param enabled filter on the enabled flag, or null for all
     * @param offset  rows to skip
     * @param limit   maximum rows
     */
    List<PeriodicTask> findAll(Boolean enabled, int offset, int limit);

    int count(Boolean enabled);

    /**
     * Load every enabled task with its interval/crontab row joined in.
     * Used by the schedule cache for a full reload.
     */
    List<PeriodicTask> findEnabledWithSchedules();

    /**
     * Replace the definition fields (name, task, bindings, args, kwargs, queue,
     * priority, expiry, one-off, start time, enabled, description).
     * Run bookkeeping is left untouched.
     *
     * @return true if the row existed
     */
    boolean update(PeriodicTask task);

    boolean setEnabled(long id, boolean enabled);

    boolean delete(long id);

    /**
     * Write run bookkeeping from the beat loop.
     * Does not bump the change marker.
     *
     * @param name          task name
     * @param lastRunAt     last dispatch instant
     * @param totalRunCount total dispatches
     * @param enabled       false to disable (one-off fired or expired)
     * @return true if the row existed
     */
    boolean recordRun(String name, Instant lastRunAt, int totalRunCount, boolean enabled);

    /**
     * Count tasks referencing an interval (any enabled state).
     */
    int countByIntervalId(long intervalId);

    /**
     * Count tasks referencing a crontab (any enabled state).
     */
    int countByCrontabId(long crontabId);
}
