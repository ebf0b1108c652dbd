package chronobeat.api.v1.dto;

import chronobeat.model.CrontabSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a crontab schedule.
 */
public record CrontabResponse(
        @JsonProperty("id") long id,
        @JsonProperty("minute") String minute,
        @JsonProperty("hour") String hour,
        @JsonProperty("dayOfWeek") String dayOfWeek,
        @JsonProperty("dayOfMonth") String dayOfMonth,
        @JsonProperty("monthOfYear") String monthOfYear,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("display") String display) {

    public static CrontabResponse from(CrontabSchedule crontab) {
        return new CrontabResponse(
                crontab.id(),
                crontab.minute(),
                crontab.hour(),
                crontab.dayOfWeek(),
                crontab.dayOfMonth(),
                crontab.monthOfYear(),
                crontab.timezone(),
                crontab.display());
    }
}
