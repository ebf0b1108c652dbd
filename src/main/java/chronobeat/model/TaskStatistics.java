package chronobeat.model;

import java.util.Map;

/**
 * Aggregate counts for the admin dashboard.
 */
public record TaskStatistics(
        int totalTasks,
        int enabledTasks,
        int disabledTasks,
        int intervalSchedules,
        int crontabSchedules,
        int totalResults,
        Map<TaskResultStatus, Integer> resultsByStatus) {
}
