package chronobeat.model;

import java.time.Instant;

/**
 * Single-row signal bumped by every schedule mutation.
 *
 * @param version    incremented on each bump, compared by the schedule cache
 * @param lastUpdate time of the latest bump
 */
public record ChangeMarker(long version, Instant lastUpdate) {

    public boolean isNewerThan(ChangeMarker other) {
        return other == null || version > other.version;
    }
}
