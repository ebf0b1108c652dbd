package chronobeat.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement a worker gets back when it reports a result.
 * {@code willRetry} is only present on failure reports.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("willRetry") Boolean willRetry) {

    public static OperationResponse accepted() {
        return new OperationResponse(true, null, null);
    }

    public static OperationResponse failureRecorded(boolean willRetry) {
        return new OperationResponse(true, null, willRetry);
    }

    public static OperationResponse rejected(String reason) {
        return new OperationResponse(false, reason, null);
    }

    public static OperationResponse unknownResult() {
        return rejected("result_not_found");
    }

    public static OperationResponse heldByAnotherWorker() {
        return rejected("not_assigned_to_worker");
    }
}
