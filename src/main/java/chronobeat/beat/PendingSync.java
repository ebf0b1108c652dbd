package chronobeat.beat;

import java.time.Instant;

/**
 * Run bookkeeping not yet written back to the store.
 */
record PendingSync(String name, Instant lastRunAt, int totalRunCount, boolean enabled) {

    static PendingSync of(ScheduleEntry entry, boolean enabled) {
        return new PendingSync(entry.name(), entry.lastRunAt(), entry.totalRunCount(), enabled);
    }

    /** True if this bookkeeping is more recent than what the store returned. */
    boolean isNewerThan(Instant storedLastRunAt) {
        return lastRunAt != null && (storedLastRunAt == null || lastRunAt.isAfter(storedLastRunAt));
    }
}
