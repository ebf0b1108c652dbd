package chronobeat.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for claiming dispatched tasks.
 * POST /internal/v1/results/claim
 */
public record ClaimResultsRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("queue") String queue,
        @JsonProperty("maxResults") Integer maxResults) {
    /** Default max results if not specified */
    public static final int DEFAULT_MAX_RESULTS = 1;

    /** Maximum results allowed per claim */
    public static final int MAX_ALLOWED = 10;

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (maxResults != null && maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
        if (maxResults != null && maxResults > MAX_ALLOWED) {
            throw new IllegalArgumentException("maxResults cannot exceed " + MAX_ALLOWED);
        }
    }

    public int maxResultsOrDefault() {
        return maxResults != null ? maxResults : DEFAULT_MAX_RESULTS;
    }
}
