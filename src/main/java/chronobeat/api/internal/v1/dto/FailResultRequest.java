package chronobeat.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting a failed task.
 * POST /internal/v1/results/{id}/fail
 */
public record FailResultRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("traceback") String traceback,
        @JsonProperty("retriable") Boolean retriable) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }

    /** Failures are final unless the worker asks for a retry */
    public boolean isRetriable() {
        return Boolean.TRUE.equals(retriable);
    }
}
