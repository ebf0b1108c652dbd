package chronobeat.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A page of a listing plus the total number of matching items.
 */
public record PageResponse<T>(
        @JsonProperty("items") List<T> items,
        @JsonProperty("total") int total,
        @JsonProperty("offset") int offset,
        @JsonProperty("limit") int limit) {
}
