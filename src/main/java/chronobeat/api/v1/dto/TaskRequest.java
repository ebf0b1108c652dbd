package chronobeat.api.v1.dto;

import chronobeat.service.TaskFields;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating or updating a periodic task.
 * On update, absent fields keep their current value.
 */
public record TaskRequest(
        @JsonProperty("name") String name,
        @JsonProperty("task") String task,
        @JsonProperty("intervalId") Long intervalId,
        @JsonProperty("crontabId") Long crontabId,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("queue") String queue,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("expiresAt") Instant expiresAt,
        @JsonProperty("expireSeconds") Integer expireSeconds,
        @JsonProperty("oneOff") Boolean oneOff,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("description") String description) {

    public void validate() {
        if (intervalId != null && crontabId != null) {
            throw new IllegalArgumentException("only one of intervalId and crontabId may be set");
        }
    }

    public TaskFields toFields() {
        return new TaskFields(name, task, intervalId, crontabId, args, kwargs, queue, priority,
                expiresAt, expireSeconds, oneOff, startTime, enabled, description);
    }
}
