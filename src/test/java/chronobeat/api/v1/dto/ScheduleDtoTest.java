package chronobeat.api.v1.dto;

import chronobeat.model.CrontabSchedule;
import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;
import chronobeat.model.PeriodicTask;
import chronobeat.model.TaskResultStatus;
import chronobeat.model.TaskStatistics;
import chronobeat.service.TaskFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleDtoTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void intervalRequestParsesPeriodCaseInsensitively() throws Exception {
        IntervalRequest req = mapper.readValue("{\"every\": 15, \"period\": \"MINUTES\"}", IntervalRequest.class);

        assertEquals(15, req.every());
        assertEquals(IntervalPeriod.MINUTES, req.period());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void intervalRequestRejectsUnknownPeriod() {
        assertThrows(JsonProcessingException.class,
                () -> mapper.readValue("{\"every\": 1, \"period\": \"fortnights\"}", IntervalRequest.class));
        assertThrows(IllegalArgumentException.class, new IntervalRequest(null, IntervalPeriod.DAYS)::validate);
        assertThrows(IllegalArgumentException.class, new IntervalRequest(3, null)::validate);
    }

    @Test
    void intervalResponseUsesLowercasePeriod() throws Exception {
        String json = mapper.writeValueAsString(
                IntervalResponse.from(new IntervalSchedule(4, 10, IntervalPeriod.SECONDS)));

        assertTrue(json.contains("\"period\":\"seconds\""));
        assertTrue(json.contains("\"display\":\"every 10 seconds\""));
    }

    @Test
    void crontabRequestFillsWildcardsAndTimezone() throws Exception {
        CrontabRequest req = mapper.readValue("{\"minute\": \"*/15\", \"hour\": \"9-17\"}", CrontabRequest.class);

        CrontabSchedule model = req.toModel();

        assertEquals("*/15 9-17 * * *", model.expression());
        assertEquals("UTC", model.timezone());
    }

    @Test
    void taskRequestRejectsBothBindings() throws Exception {
        TaskRequest both = mapper.readValue(
                "{\"name\": \"n\", \"task\": \"t\", \"intervalId\": 1, \"crontabId\": 2}", TaskRequest.class);
        assertThrows(IllegalArgumentException.class, both::validate);

        TaskRequest one = mapper.readValue("""
                {
                  "name": "n",
                  "task": "t",
                  "crontabId": 2,
                  "expiresAt": "2024-06-01T00:00:00Z",
                  "oneOff": true
                }
                """, TaskRequest.class);
        assertDoesNotThrow(one::validate);

        TaskFields fields = one.toFields();
        assertEquals(2L, fields.crontabId());
        assertNull(fields.intervalId());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), fields.expiresAt());
        assertTrue(fields.oneOff());
        assertNull(fields.enabled());
    }

    @Test
    void taskResponseDescribesBoundSchedule() throws Exception {
        PeriodicTask task = PeriodicTask.builder()
                .id(7)
                .name("nightly")
                .task("jobs.nightly")
                .crontabId(3L)
                .crontab(new CrontabSchedule(3, "0", "4", "*", "*", "*", "Europe/Paris"))
                .build();

        TaskResponse response = TaskResponse.from(task);

        assertEquals("0 4 * * * (m/h/dM/MY/d) Europe/Paris", response.schedule());
        String json = mapper.writeValueAsString(response);
        assertTrue(json.contains("\"crontabId\":3"));
        assertFalse(json.contains("intervalId"));
    }

    @Test
    void statisticsListEveryStatus() {
        TaskStatistics stats = new TaskStatistics(3, 2, 1, 1, 1, 5, Map.of(TaskResultStatus.SUCCESS, 5));

        StatisticsResponse response = StatisticsResponse.from(stats);

        assertEquals(TaskResultStatus.values().length, response.resultsByStatus().size());
        assertEquals(5, response.resultsByStatus().get("SUCCESS"));
        assertEquals(0, response.resultsByStatus().get("PENDING"));
    }
}
