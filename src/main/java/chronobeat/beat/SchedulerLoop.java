package chronobeat.beat;

import chronobeat.dispatch.DispatchOptions;
import chronobeat.dispatch.TaskDispatcher;
import chronobeat.exception.DispatchUnavailableException;
import chronobeat.exception.EntryEvaluationException;
import chronobeat.exception.PersistenceSyncException;
import chronobeat.schedule.DueCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The beat loop: refresh the cache, find due entries, dispatch them, write
 * bookkeeping back, then sleep until the next due time or refresh boundary.
 *
 * One instance runs on one thread. A failure in one entry never aborts the
 * cycle for the others.
 */
public class SchedulerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final ScheduleCache cache;
    private final TaskDispatcher dispatcher;
    private final Clock clock;
    private final Duration refreshInterval;
    private final Duration minTick;
    private final Duration dispatchTimeout;

    private final ExecutorService dispatchExecutor;
    private final DispatchOutageLog outageLog = new DispatchOutageLog();

    // task name -> definition key that failed evaluation
    private final Map<String, String> broken = new HashMap<>();
    // task name -> last run at the time its dispatch failed; stays due until dispatched
    private final Map<String, Instant> undispatched = new HashMap<>();

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile LoopState state = LoopState.IDLE_WAIT;
    private volatile Instant lastCycleAt;

    public SchedulerLoop(ScheduleCache cache, TaskDispatcher dispatcher, Clock clock,
            Duration refreshInterval, Duration minTick, Duration dispatchTimeout) {
        this.cache = cache;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
        this.minTick = minTick;
        this.dispatchTimeout = dispatchTimeout;
        this.dispatchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chronobeat-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        log.info("Beat loop started (refresh every {}ms, min tick {}ms)",
                refreshInterval.toMillis(), minTick.toMillis());
        try {
            while (stopSignal.getCount() > 0) {
                Duration sleep;
                try {
                    sleep = runCycle();
                } catch (RuntimeException e) {
                    log.error("Beat cycle failed", e);
                    sleep = minTick;
                }
                if (stopSignal.await(sleep.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = LoopState.SHUTTING_DOWN;
            logSyncFailures(cache.syncPending());
            dispatchExecutor.shutdownNow();
            stopped.countDown();
            log.info("Beat loop stopped");
        }
    }

    /**
     * Run one cycle.
     *
     * @return how long to sleep before the next cycle
     */
    public Duration runCycle() {
        Instant now = clock.instant();
        lastCycleAt = now;

        state = LoopState.EVALUATING;
        try {
            if (cache.refreshIfStale(now)) {
                log.debug("Schedule cache refreshed: {} entries", cache.size());
            }
        } catch (RuntimeException e) {
            log.warn("Schedule reload failed, keeping {} cached entries: {}", cache.size(), e.getMessage());
        }

        Instant nextWake = now.plus(refreshInterval);
        List<ScheduleEntry> due = new ArrayList<>();

        undispatched.keySet().retainAll(cache.entries().keySet());
        for (ScheduleEntry entry : cache.entries().values()) {
            if (isBroken(entry)) {
                continue;
            }
            if (entry.isExpired(now)) {
                log.info("Periodic task {} expired at {}, disabling", entry.name(), entry.task().expiresAt());
                cache.disable(entry);
                continue;
            }
            if (stillUndispatched(entry)) {
                due.add(entry);
                continue;
            }
            try {
                DueCheck check = entry.evaluate(now);
                if (check.due()) {
                    due.add(entry);
                } else if (check.nextDue().isBefore(nextWake)) {
                    nextWake = check.nextDue();
                }
            } catch (RuntimeException e) {
                markBroken(entry, e);
            }
        }

        state = LoopState.DISPATCHING;
        for (ScheduleEntry entry : due) {
            if (stopSignal.getCount() == 0) {
                break;
            }
            String dispatchId;
            try {
                dispatchId = dispatch(entry, now);
            } catch (DispatchUnavailableException e) {
                outageLog.failed(entry.name(), e);
                undispatched.put(entry.name(), entry.lastRunAt());
                continue;
            } catch (RuntimeException e) {
                log.error("Dispatch of {} failed, retrying next cycle", entry.name(), e);
                undispatched.put(entry.name(), entry.lastRunAt());
                continue;
            }
            outageLog.succeeded();
            undispatched.remove(entry.name());

            ScheduleEntry updated = cache.recordRun(entry, now);
            log.info("Dispatched {} ({}) as {}", entry.name(), entry.task().task(), dispatchId);

            if (!entry.task().oneOff()) {
                try {
                    Instant next = updated.evaluate(now).nextDue();
                    if (next.isAfter(now) && next.isBefore(nextWake)) {
                        nextWake = next;
                    }
                } catch (RuntimeException e) {
                    markBroken(updated, e);
                }
            }
        }

        state = LoopState.BOOKKEEPING;
        logSyncFailures(cache.syncPending());

        state = LoopState.IDLE_WAIT;
        return clamp(Duration.between(now, nextWake));
    }

    private String dispatch(ScheduleEntry entry, Instant now) {
        DispatchOptions options = DispatchOptions.forTask(entry.task(), now);
        Future<String> future = dispatchExecutor.submit(() -> dispatcher.dispatch(
                entry.task().task(), entry.task().args(), entry.task().kwargs(), options));
        try {
            return future.get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DispatchUnavailableException(
                    "Dispatch of " + entry.name() + " timed out after " + dispatchTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DispatchUnavailableException("Interrupted while dispatching " + entry.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DispatchUnavailableException("Dispatch of " + entry.name() + " failed", cause);
        }
    }

    /**
     * An entry whose dispatch failed is due again until a dispatch succeeds,
     * even once its matching minute has passed. A run recorded since (by a
     * reload) releases it.
     */
    private boolean stillUndispatched(ScheduleEntry entry) {
        if (!undispatched.containsKey(entry.name())) {
            return false;
        }
        if (Objects.equals(undispatched.get(entry.name()), entry.lastRunAt())) {
            return true;
        }
        undispatched.remove(entry.name());
        return false;
    }

    private boolean isBroken(ScheduleEntry entry) {
        String key = broken.get(entry.name());
        if (key == null) {
            return false;
        }
        if (key.equals(entry.definitionKey())) {
            return true;
        }
        broken.remove(entry.name());
        log.info("Periodic task {} changed, evaluating it again", entry.name());
        return false;
    }

    private void markBroken(ScheduleEntry entry, RuntimeException cause) {
        EntryEvaluationException error = new EntryEvaluationException(entry.name(), cause);
        broken.put(entry.name(), entry.definitionKey());
        log.error("{}; skipping it until its definition changes", error.getMessage(), cause);
    }

    private void logSyncFailures(List<PersistenceSyncException> failures) {
        for (PersistenceSyncException failure : failures) {
            log.warn("{}, will retry: {}", failure.getMessage(), failure.getCause().getMessage());
        }
    }

    private Duration clamp(Duration sleep) {
        if (sleep.compareTo(minTick) < 0) {
            return minTick;
        }
        if (sleep.compareTo(refreshInterval) > 0) {
            return refreshInterval;
        }
        return sleep;
    }

    /**
     * Signal the loop to stop. Pending bookkeeping is flushed on the way out.
     */
    public void stop() {
        stopSignal.countDown();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public LoopState state() {
        return state;
    }

    public Instant lastCycleAt() {
        return lastCycleAt;
    }

    public boolean dispatchUnavailable() {
        return outageLog.inOutage();
    }

    public ScheduleCache cache() {
        return cache;
    }
}
