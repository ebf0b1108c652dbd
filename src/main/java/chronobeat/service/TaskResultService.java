package chronobeat.service;

import chronobeat.exception.ValidationException;
import chronobeat.model.ResultCompleteOutcome;
import chronobeat.model.ResultFailOutcome;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import chronobeat.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for task results.
 * Covers the worker protocol (claim, complete, fail) and admin reads/cleanup.
 */
public class TaskResultService {

    private static final Logger log = LoggerFactory.getLogger(TaskResultService.class);

    static final int MAX_CLAIM = 10;
    static final int DEFAULT_CLEANUP_DAYS = 30;
    static final int MAX_CLEANUP_DAYS = 365;

    private final TaskResultRepository resultRepository;
    private final Clock clock;

    public TaskResultService(TaskResultRepository resultRepository, Clock clock) {
        this.resultRepository = resultRepository;
        this.clock = clock;
    }

    /**
     * Claim results for a worker.
     * Atomically assigns up to maxResults (capped at 10) to the worker.
     */
    public List<TaskResult> claim(String workerId, String queue, int maxResults) {
        if (workerId == null || workerId.isBlank()) {
            throw new ValidationException("worker_id is required");
        }
        if (maxResults <= 0) {
            throw new ValidationException("max_results must be positive");
        }

        String queueFilter = queue == null || queue.isBlank() ? null : queue.trim();
        return resultRepository.claim(workerId, queueFilter, Math.min(maxResults, MAX_CLAIM), clock.instant());
    }

    /**
     * Complete a result with idempotent outcome.
     */
    public ResultCompleteOutcome complete(String resultId, String workerId, String resultJson) {
        requireIds(resultId, workerId);

        ResultCompleteOutcome outcome = resultRepository.complete(resultId, workerId, resultJson, clock.instant());

        if (outcome == ResultCompleteOutcome.COMPLETED) {
            log.info("Result {} completed by worker {}", resultId, workerId);
        } else if (outcome == ResultCompleteOutcome.ALREADY_DONE) {
            log.debug("Result {} already finished (idempotent)", resultId);
        } else {
            log.warn("Failed to complete result {} by worker {} - outcome: {}", resultId, workerId, outcome);
        }

        return outcome;
    }

    /**
     * Report a failure with idempotent outcome.
     */
    public ResultFailOutcome fail(String resultId, String workerId, String traceback, boolean retriable) {
        requireIds(resultId, workerId);

        ResultFailOutcome outcome = resultRepository.fail(resultId, workerId, traceback, retriable, clock.instant());

        if (outcome == ResultFailOutcome.RETRY) {
            log.info("Result {} failed on worker {}, will retry", resultId, workerId);
        } else if (outcome == ResultFailOutcome.FAILED) {
            log.info("Result {} permanently failed", resultId);
        } else if (outcome == ResultFailOutcome.ALREADY_TERMINAL) {
            log.debug("Result {} already terminal (idempotent)", resultId);
        } else {
            log.warn("Failed to report failure for result {} by worker {} - outcome: {}", resultId, workerId,
                    outcome);
        }

        return outcome;
    }

    public Optional<TaskResult> findById(String resultId) {
        return resultRepository.findById(resultId);
    }

    public List<TaskResult> find(String taskName, TaskResultStatus status, int offset, int limit) {
        return resultRepository.find(blankToNull(taskName), status, Math.max(offset, 0), Math.max(limit, 1));
    }

    public int count(String taskName, TaskResultStatus status) {
        return resultRepository.count(blankToNull(taskName), status);
    }

    /**
     * Delete finished results older than the given number of days.
     *
     * @param days 1..365, null for the default of 30
     * @return number of results deleted
     */
    public int cleanup(Integer days) {
        int d = days != null ? days : DEFAULT_CLEANUP_DAYS;
        if (d < 1 || d > MAX_CLEANUP_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_CLEANUP_DAYS);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(d));
        int deleted = resultRepository.deleteFinishedBefore(cutoff);
        log.info("Result cleanup: {} results older than {} days deleted", deleted, d);
        return deleted;
    }

    private void requireIds(String resultId, String workerId) {
        if (resultId == null || resultId.isBlank()) {
            throw new ValidationException("result id is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new ValidationException("worker_id is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
