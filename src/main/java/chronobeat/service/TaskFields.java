package chronobeat.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Definition fields of a periodic task as supplied by an admin.
 * For updates a null field means "keep the current value"; setting one
 * schedule binding clears the other.
 */
public record TaskFields(
        String name,
        String task,
        Long intervalId,
        Long crontabId,
        List<Object> args,
        Map<String, Object> kwargs,
        String queue,
        Integer priority,
        Instant expiresAt,
        Integer expireSeconds,
        Boolean oneOff,
        Instant startTime,
        Boolean enabled,
        String description) {
}
