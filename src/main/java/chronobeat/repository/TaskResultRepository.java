package chronobeat.repository;

import chronobeat.model.ResultCompleteOutcome;
import chronobeat.model.ResultFailOutcome;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for task results.
 */
public interface TaskResultRepository {

    /**
     * Insert a new result row.
     *
     * @param result the result to save
     */
    void save(TaskResult result);

    Optional<TaskResult> findById(String id);

    /**
     * List results, newest first.
     *
     * @param taskName filter on task name, or null
     * @param status   filter on status, or null
     * @param offset   rows to skip
     * @param limit    maximum rows
     */
    List<TaskResult> find(String taskName, TaskResultStatus status, int offset, int limit);

    int count(String taskName, TaskResultStatus status);

    /**
     * Count results grouped by status. Statuses with no rows are absent.
     */
    Map<TaskResultStatus, Integer> countByStatus();

    /**
     * Atomically claim up to N results for a worker.
     * Moves PENDING/RETRY rows to STARTED in priority order. Rows whose
     * expiry has passed are failed instead of being handed out.
     *
     * @param workerId   the claiming worker
     * @param queue      only claim rows of this queue, or null for any
     * @param maxResults maximum rows to claim
     * @param now        claim instant
     * @return claimed results
     */
    List<TaskResult> claim(String workerId, String queue, int maxResults, Instant now);

    /**
     * Idempotent complete: STARTED → SUCCESS.
     *
     * @param resultJson serialized return value, may be null
     */
    ResultCompleteOutcome complete(String id, String workerId, String resultJson, Instant now);

    /**
     * Idempotent fail: STARTED → RETRY when retriable, otherwise FAILURE.
     */
    ResultFailOutcome fail(String id, String workerId, String traceback, boolean retriable, Instant now);

    /**
     * Find results that have been STARTED for too long.
     *
     * @param startedBefore results started before this instant are stuck
     */
    List<TaskResult> findStuckStarted(Instant startedBefore);

    /**
     * Mark a non-terminal result as FAILURE.
     *
     * @return true if updated
     */
    boolean markFailed(String id, String traceback, Instant now);

    /**
     * Delete finished results done before the cutoff.
     *
     * @return number of rows deleted
     */
    int deleteFinishedBefore(Instant cutoff);
}
