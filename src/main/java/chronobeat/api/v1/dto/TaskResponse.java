package chronobeat.api.v1.dto;

import chronobeat.model.PeriodicTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a periodic task.
 * GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("task") String task,
        @JsonProperty("intervalId") Long intervalId,
        @JsonProperty("crontabId") Long crontabId,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs,
        @JsonProperty("queue") String queue,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("expiresAt") Instant expiresAt,
        @JsonProperty("expireSeconds") Integer expireSeconds,
        @JsonProperty("oneOff") boolean oneOff,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("lastRunAt") Instant lastRunAt,
        @JsonProperty("totalRunCount") int totalRunCount,
        @JsonProperty("description") String description,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /** Create response from domain model */
    public static TaskResponse from(PeriodicTask t) {
        return new TaskResponse(
                t.id(),
                t.name(),
                t.task(),
                t.intervalId(),
                t.crontabId(),
                describeSchedule(t),
                t.args(),
                t.kwargs(),
                t.queue(),
                t.priority(),
                t.expiresAt(),
                t.expireSeconds(),
                t.oneOff(),
                t.startTime(),
                t.enabled(),
                t.lastRunAt(),
                t.totalRunCount(),
                t.description(),
                t.createdAt(),
                t.updatedAt());
    }

    private static String describeSchedule(PeriodicTask t) {
        if (t.interval() != null) {
            return t.interval().display();
        }
        if (t.crontab() != null) {
            return t.crontab().display();
        }
        return null;
    }
}
