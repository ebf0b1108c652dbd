package chronobeat.api.v1.dto;

import chronobeat.model.IntervalPeriod;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating or replacing an interval schedule.
 * POST /api/v1/schedules/intervals, PUT /api/v1/schedules/intervals/{id}
 */
public record IntervalRequest(
        @JsonProperty("every") Integer every,
        @JsonProperty("period") IntervalPeriod period) {

    public void validate() {
        if (every == null) {
            throw new IllegalArgumentException("every is required");
        }
        if (period == null) {
            throw new IllegalArgumentException("period is required");
        }
    }
}
