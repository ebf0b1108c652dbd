package chronobeat.api.internal.v1.dto;

import chronobeat.model.TaskResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for claimed tasks.
 * POST /internal/v1/results/claim
 */
public record ClaimResultsResponse(
        @JsonProperty("results") List<ClaimedResult> results) {

    /**
     * A single claimed task: what to run and with which arguments.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClaimedResult(
            @JsonProperty("id") String id,
            @JsonProperty("taskName") String taskName,
            @JsonProperty("args") List<Object> args,
            @JsonProperty("kwargs") Map<String, Object> kwargs,
            @JsonProperty("queue") String queue,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("expiresAt") Instant expiresAt) {

        public static ClaimedResult from(TaskResult r) {
            return new ClaimedResult(r.id(), r.taskName(), r.args(), r.kwargs(), r.queue(), r.attempts(),
                    r.expiresAt());
        }
    }

    public static ClaimResultsResponse from(List<TaskResult> results) {
        return new ClaimResultsResponse(results.stream().map(ClaimedResult::from).toList());
    }
}
