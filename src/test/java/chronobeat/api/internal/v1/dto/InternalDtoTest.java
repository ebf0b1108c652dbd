package chronobeat.api.internal.v1.dto;

import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void claimRequestDeserialization() throws Exception {
        String json = """
                {
                  "workerId": "worker-7",
                  "queue": "reports",
                  "maxResults": 4
                }
                """;

        ClaimResultsRequest req = mapper.readValue(json, ClaimResultsRequest.class);

        assertEquals("worker-7", req.workerId());
        assertEquals("reports", req.queue());
        assertEquals(4, req.maxResultsOrDefault());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void claimRequestValidation() {
        assertEquals(1, new ClaimResultsRequest("w", null, null).maxResultsOrDefault());

        assertThrows(IllegalArgumentException.class, new ClaimResultsRequest("", null, 1)::validate);
        assertThrows(IllegalArgumentException.class, new ClaimResultsRequest("w", null, 0)::validate);
        assertThrows(IllegalArgumentException.class, new ClaimResultsRequest("w", null, 11)::validate);
    }

    @Test
    void completeRequestKeepsArbitraryResultJson() throws Exception {
        CompleteResultRequest req = mapper.readValue(
                "{\"workerId\": \"w\", \"result\": {\"rows\": [1, 2], \"ok\": true}}", CompleteResultRequest.class);

        assertDoesNotThrow(req::validate);
        assertEquals(2, req.result().get("rows").size());
        assertThrows(IllegalArgumentException.class, new CompleteResultRequest(" ", null)::validate);
    }

    @Test
    void failRequestIsFinalUnlessRetriable() throws Exception {
        FailResultRequest plain = mapper.readValue("{\"workerId\": \"w\", \"traceback\": \"boom\"}",
                FailResultRequest.class);
        FailResultRequest retry = mapper.readValue("{\"workerId\": \"w\", \"retriable\": true}",
                FailResultRequest.class);

        assertFalse(plain.isRetriable());
        assertTrue(retry.isRetriable());
        assertThrows(IllegalArgumentException.class, new FailResultRequest(null, "x", true)::validate);
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String success = mapper.writeValueAsString(OperationResponse.accepted());
        assertTrue(success.contains("\"ok\":true"));
        assertFalse(success.contains("error"));
        assertFalse(success.contains("willRetry"));

        String retry = mapper.writeValueAsString(OperationResponse.failureRecorded(true));
        assertTrue(retry.contains("\"willRetry\":true"));

        String notFound = mapper.writeValueAsString(OperationResponse.unknownResult());
        assertTrue(notFound.contains("\"ok\":false"));
        assertTrue(notFound.contains("result_not_found"));
    }

    @Test
    void claimResponseCarriesDispatchPayload() throws Exception {
        TaskResult result = TaskResult.builder()
                .id("r-1")
                .taskName("jobs.work")
                .status(TaskResultStatus.STARTED)
                .args(List.of("a"))
                .kwargs(Map.of("k", 1))
                .queue("reports")
                .attempts(2)
                .expiresAt(Instant.parse("2024-01-01T12:00:00Z"))
                .dateCreated(Instant.parse("2024-01-01T11:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(ClaimResultsResponse.from(List.of(result)));

        assertTrue(json.contains("\"id\":\"r-1\""));
        assertTrue(json.contains("\"taskName\":\"jobs.work\""));
        assertTrue(json.contains("\"attempts\":2"));
        assertTrue(json.contains("\"expiresAt\":\"2024-01-01T12:00:00Z\""));
    }
}
