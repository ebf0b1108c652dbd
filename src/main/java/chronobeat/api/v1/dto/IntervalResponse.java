package chronobeat.api.v1.dto;

import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for an interval schedule.
 */
public record IntervalResponse(
        @JsonProperty("id") long id,
        @JsonProperty("every") int every,
        @JsonProperty("period") IntervalPeriod period,
        @JsonProperty("display") String display) {

    public static IntervalResponse from(IntervalSchedule interval) {
        return new IntervalResponse(interval.id(), interval.every(), interval.period(), interval.display());
    }
}
