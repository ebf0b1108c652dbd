package chronobeat.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for reporting a finished task.
 * POST /internal/v1/results/{id}/complete
 */
public record CompleteResultRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("result") JsonNode result) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }
}
