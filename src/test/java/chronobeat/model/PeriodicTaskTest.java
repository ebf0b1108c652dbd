package chronobeat.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicTaskTest {

    @Test
    void buildMinimalTask() {
        PeriodicTask task = PeriodicTask.builder()
                .name("cleanup")
                .task("jobs.cleanup")
                .intervalId(1L)
                .build();

        assertEquals("cleanup", task.name());
        assertTrue(task.enabled());
        assertFalse(task.oneOff());
        assertEquals(0, task.totalRunCount());
        assertNull(task.lastRunAt());
        assertEquals(List.of(), task.args());
        assertTrue(task.kwargs().isEmpty());
        assertTrue(task.hasSingleBinding());
    }

    @Test
    void nameAndTaskAreRequired() {
        assertThrows(NullPointerException.class, () -> PeriodicTask.builder().task("jobs.x").build());
        assertThrows(NullPointerException.class, () -> PeriodicTask.builder().name("x").build());
    }

    @Test
    void bindingMustBeExactlyOne() {
        PeriodicTask.Builder builder = PeriodicTask.builder().name("x").task("jobs.x");

        assertFalse(builder.build().hasSingleBinding());
        assertFalse(builder.intervalId(1L).crontabId(2L).build().hasSingleBinding());
        assertTrue(builder.intervalId(null).build().hasSingleBinding());
    }

    @Test
    void argsKeepJsonNullsAndAreImmutable() {
        List<Object> args = new ArrayList<>(Arrays.asList("a", null));

        PeriodicTask task = PeriodicTask.builder().name("x").task("jobs.x").crontabId(2L).args(args).build();
        args.add("b");

        assertEquals(Arrays.asList("a", null), task.args());
        assertThrows(UnsupportedOperationException.class, () -> task.args().add("c"));
    }

    @Test
    void toBuilderCopiesEverything() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        PeriodicTask original = PeriodicTask.builder()
                .id(9)
                .name("report")
                .task("jobs.report")
                .intervalId(1L)
                .queue("reports")
                .priority(3)
                .expireSeconds(60)
                .oneOff(true)
                .startTime(now)
                .lastRunAt(now)
                .totalRunCount(4)
                .createdAt(now)
                .updatedAt(now)
                .build();

        PeriodicTask copy = original.toBuilder().build();
        PeriodicTask disabled = original.toBuilder().enabled(false).build();

        assertEquals(original, copy);
        assertEquals("reports", copy.queue());
        assertEquals(4, copy.totalRunCount());
        assertFalse(disabled.enabled());
        assertTrue(original.enabled());
    }
}
