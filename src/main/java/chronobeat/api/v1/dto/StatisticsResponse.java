package chronobeat.api.v1.dto;

import chronobeat.model.TaskResultStatus;
import chronobeat.model.TaskStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for aggregate statistics.
 * GET /api/v1/statistics
 */
public record StatisticsResponse(
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("enabledTasks") int enabledTasks,
        @JsonProperty("disabledTasks") int disabledTasks,
        @JsonProperty("intervalSchedules") int intervalSchedules,
        @JsonProperty("crontabSchedules") int crontabSchedules,
        @JsonProperty("totalResults") int totalResults,
        @JsonProperty("resultsByStatus") Map<String, Integer> resultsByStatus) {

    /** Every status is listed, zero when absent */
    public static StatisticsResponse from(TaskStatistics stats) {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (TaskResultStatus status : TaskResultStatus.values()) {
            byStatus.put(status.name(), stats.resultsByStatus().getOrDefault(status, 0));
        }
        return new StatisticsResponse(
                stats.totalTasks(),
                stats.enabledTasks(),
                stats.disabledTasks(),
                stats.intervalSchedules(),
                stats.crontabSchedules(),
                stats.totalResults(),
                byStatus);
    }
}
