package chronobeat.beat;

import chronobeat.model.TaskResult;
import chronobeat.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background job that fails task results stuck in STARTED.
 *
 * Results get stuck when a worker dies after claiming or loses the
 * completion call. Anything STARTED longer than the timeout is marked FAILURE.
 */
public class ResultReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultReaper.class);

    private final TaskResultRepository resultRepository;
    private final Duration startedTimeout;
    private final Clock clock;

    public ResultReaper(TaskResultRepository resultRepository, Duration startedTimeout, Clock clock) {
        this.resultRepository = resultRepository;
        this.startedTimeout = startedTimeout;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckResults();
        } catch (Exception e) {
            log.error("Result reaper error", e);
        }
    }

    /**
     * Find and fail stuck STARTED results.
     *
     * @return number of results failed
     */
    public int reapStuckResults() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(startedTimeout);

        List<TaskResult> stuck = resultRepository.findStuckStarted(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck results found");
            return 0;
        }

        int failed = 0;
        for (TaskResult result : stuck) {
            try {
                String reason = "No completion from worker " + result.workerId() + " within "
                        + startedTimeout.toSeconds() + "s";
                if (resultRepository.markFailed(result.id(), reason, now)) {
                    failed++;
                    log.warn("Result {} ({}) failed: stuck in STARTED since {}",
                            result.id(), result.taskName(), result.dateStarted());
                }
            } catch (Exception e) {
                log.error("Failed to reap result {}", result.id(), e);
            }
        }

        log.info("Result reaper: {} failed, {} total stuck", failed, stuck.size());
        return failed;
    }
}
