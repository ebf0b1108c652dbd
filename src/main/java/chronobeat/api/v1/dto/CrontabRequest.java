package chronobeat.api.v1.dto;

import chronobeat.model.CrontabSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating or replacing a crontab schedule.
 * Missing fields default to "*", a missing timezone to UTC.
 */
public record CrontabRequest(
        @JsonProperty("minute") String minute,
        @JsonProperty("hour") String hour,
        @JsonProperty("dayOfWeek") String dayOfWeek,
        @JsonProperty("dayOfMonth") String dayOfMonth,
        @JsonProperty("monthOfYear") String monthOfYear,
        @JsonProperty("timezone") String timezone) {

    public CrontabSchedule toModel() {
        return new CrontabSchedule(0, minute, hour, dayOfWeek, dayOfMonth, monthOfYear, timezone);
    }
}
