package chronobeat.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of GET /api/v1/health. The beat fields are omitted when the database is down.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("beat") String beat,
        @JsonProperty("cachedEntries") Integer cachedEntries,
        @JsonProperty("pendingSync") Integer pendingSync,
        @JsonProperty("dispatchUnavailable") Boolean dispatchUnavailable,
        @JsonProperty("lastCycleAt") Instant lastCycleAt) {

    public static HealthResponse healthy(String uptime, String version, String beat, int cachedEntries,
            int pendingSync, boolean dispatchUnavailable, Instant lastCycleAt) {
        return new HealthResponse("healthy", "ok", uptime, version, beat, cachedEntries, pendingSync,
                dispatchUnavailable, lastCycleAt);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null);
    }
}
