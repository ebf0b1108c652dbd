package chronobeat.beat;

import chronobeat.exception.PersistenceSyncException;
import chronobeat.model.ChangeMarker;
import chronobeat.model.PeriodicTask;
import chronobeat.repository.ChangeMarkerRepository;
import chronobeat.repository.PeriodicTaskRepository;
import chronobeat.schedule.EverySchedule;
import chronobeat.schedule.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory snapshot of every enabled periodic task, keyed by name.
 *
 * The snapshot is immutable and replaced wholesale on reload or after a run,
 * so readers on other threads never see a half-updated map. All mutating
 * methods are called from the beat loop thread only.
 */
public class ScheduleCache {

    private static final Logger log = LoggerFactory.getLogger(ScheduleCache.class);

    private final PeriodicTaskRepository taskRepository;
    private final ChangeMarkerRepository markerRepository;
    private final Duration refreshInterval;
    private final Duration unboundTaskPeriod;

    private volatile Map<String, ScheduleEntry> entries = Map.of();
    private volatile Instant lastReload;
    private ChangeMarker loadedMarker;

    private final Map<String, PendingSync> pending = new LinkedHashMap<>();
    private final Set<String> reportedDefinitions = new HashSet<>();

    /**
     * @param refreshInterval   maximum age of the snapshot
     * @param unboundTaskPeriod period for tasks bound to no schedule, or null to
     *                          exclude them
     */
    public ScheduleCache(PeriodicTaskRepository taskRepository, ChangeMarkerRepository markerRepository,
            Duration refreshInterval, Duration unboundTaskPeriod) {
        this.taskRepository = taskRepository;
        this.markerRepository = markerRepository;
        this.refreshInterval = refreshInterval;
        this.unboundTaskPeriod = unboundTaskPeriod;
    }

    /**
     * Reload from the store if never loaded, if the change marker moved since
     * the last load, or if the snapshot is older than the refresh interval.
     *
     * @return true if a reload happened
     */
    public boolean refreshIfStale(Instant now) {
        ChangeMarker marker = markerRepository.current();

        boolean stale = lastReload == null
                || marker.isNewerThan(loadedMarker)
                || Duration.between(lastReload, now).compareTo(refreshInterval) >= 0;
        if (!stale) {
            return false;
        }

        reload(marker, now);
        return true;
    }

    /**
     * Unconditional full reload.
     */
    public void reload(Instant now) {
        reload(markerRepository.current(), now);
    }

    private void reload(ChangeMarker marker, Instant now) {
        List<PeriodicTask> tasks = taskRepository.findEnabledWithSchedules();

        Map<String, ScheduleEntry> fresh = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();

        for (PeriodicTask task : tasks) {
            String key = task.name() + "@" + task.updatedAt();
            seen.add(key);

            Schedule schedule = resolve(task, reportedDefinitions.contains(key));
            if (schedule == null) {
                continue;
            }

            ScheduleEntry entry = ScheduleEntry.of(task, schedule);

            PendingSync unsynced = pending.get(task.name());
            if (unsynced != null) {
                if (!unsynced.enabled()) {
                    continue;
                }
                if (unsynced.isNewerThan(task.lastRunAt())) {
                    entry = entry.withBookkeeping(unsynced.lastRunAt(), unsynced.totalRunCount());
                }
            }

            fresh.put(task.name(), entry);
        }

        reportedDefinitions.retainAll(seen);

        entries = Collections.unmodifiableMap(fresh);
        loadedMarker = marker;
        lastReload = now;

        log.debug("Schedule cache reloaded: {} entries (marker version {})", fresh.size(), marker.version());
    }

    /**
     * Resolve the task's binding into a schedule, or null to exclude it.
     * Problems are logged once per definition.
     */
    private Schedule resolve(PeriodicTask task, boolean alreadyReported) {
        String key = task.name() + "@" + task.updatedAt();

        if (task.intervalId() == null && task.crontabId() == null) {
            if (unboundTaskPeriod != null) {
                if (!alreadyReported) {
                    log.warn("Periodic task {} has no schedule, running it every {}s", task.name(),
                            unboundTaskPeriod.toSeconds());
                    reportedDefinitions.add(key);
                }
                return new EverySchedule(unboundTaskPeriod, "every " + unboundTaskPeriod.toSeconds() + " seconds");
            }
            if (!alreadyReported) {
                log.error("Periodic task {} has no schedule and is excluded", task.name());
                reportedDefinitions.add(key);
            }
            return null;
        }

        try {
            if (!task.hasSingleBinding()) {
                throw new IllegalArgumentException("bound to both an interval and a crontab");
            }
            if (task.interval() != null) {
                return task.interval().toSchedule();
            }
            if (task.crontab() != null) {
                return task.crontab().toSchedule();
            }
            throw new IllegalArgumentException("bound schedule no longer exists");
        } catch (IllegalArgumentException e) {
            if (!alreadyReported) {
                log.error("Periodic task {} is excluded: {}", task.name(), e.getMessage());
                reportedDefinitions.add(key);
            }
            return null;
        }
    }

    /**
     * Current snapshot, immutable.
     */
    public Map<String, ScheduleEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Instant lastReload() {
        return lastReload;
    }

    /**
     * Record a successful dispatch: bump the entry's bookkeeping and queue it
     * for sync. One-off entries leave the snapshot and are queued for disable.
     *
     * @return the updated entry
     */
    public ScheduleEntry recordRun(ScheduleEntry entry, Instant at) {
        ScheduleEntry updated = entry.withRun(at);
        boolean keep = !entry.task().oneOff();

        Map<String, ScheduleEntry> next = new LinkedHashMap<>(entries);
        if (keep) {
            next.put(updated.name(), updated);
        } else {
            next.remove(updated.name());
        }
        entries = Collections.unmodifiableMap(next);

        pending.put(updated.name(), PendingSync.of(updated, keep));
        return updated;
    }

    /**
     * Drop an entry from the snapshot and queue it for disable.
     */
    public void disable(ScheduleEntry entry) {
        Map<String, ScheduleEntry> next = new LinkedHashMap<>(entries);
        next.remove(entry.name());
        entries = Collections.unmodifiableMap(next);

        pending.put(entry.name(), PendingSync.of(entry, false));
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Write queued bookkeeping to the store. Entries that fail stay queued and
     * are retried on the next call.
     *
     * @return failures, empty if everything was written
     */
    public List<PersistenceSyncException> syncPending() {
        List<PersistenceSyncException> failures = new ArrayList<>();

        for (PendingSync sync : new ArrayList<>(pending.values())) {
            try {
                boolean found = taskRepository.recordRun(sync.name(), sync.lastRunAt(), sync.totalRunCount(),
                        sync.enabled());
                if (!found) {
                    log.debug("Periodic task {} was deleted before its run info was synced", sync.name());
                }
                pending.remove(sync.name(), sync);
            } catch (RuntimeException e) {
                failures.add(new PersistenceSyncException(sync.name(), e));
            }
        }
        return failures;
    }
}
