package chronobeat.api.v1.dto;

import chronobeat.model.TaskResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a task result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResultResponse(
        @JsonProperty("id") String id,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("periodicTaskName") String periodicTaskName,
        @JsonProperty("status") String status,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("queue") String queue,
        @JsonProperty("priority") int priority,
        @JsonProperty("expiresAt") Instant expiresAt,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("attempts") int attempts,
        @JsonRawValue @JsonProperty("result") String result,
        @JsonProperty("traceback") String traceback,
        @JsonProperty("dateCreated") Instant dateCreated,
        @JsonProperty("dateStarted") Instant dateStarted,
        @JsonProperty("dateDone") Instant dateDone) {

    public static TaskResultResponse from(TaskResult r) {
        return new TaskResultResponse(
                r.id(),
                r.taskName(),
                r.periodicTaskName(),
                r.status().name(),
                r.args(),
                r.kwargs(),
                r.queue(),
                r.priority(),
                r.expiresAt(),
                r.workerId(),
                r.attempts(),
                r.result(),
                r.traceback(),
                r.dateCreated(),
                r.dateStarted(),
                r.dateDone());
    }
}
