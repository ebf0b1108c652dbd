package chronobeat.dispatch;

import chronobeat.exception.DispatchUnavailableException;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import chronobeat.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Dispatcher backed by the task_results table: each dispatch inserts a
 * PENDING row that workers claim through the internal API.
 */
public class JdbcTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskDispatcher.class);

    private final TaskResultRepository resultRepository;
    private final Clock clock;

    public JdbcTaskDispatcher(TaskResultRepository resultRepository, Clock clock) {
        this.resultRepository = resultRepository;
        this.clock = clock;
    }

    @Override
    public String dispatch(String taskName, List<Object> args, Map<String, Object> kwargs,
            DispatchOptions options) {
        String id = UUID.randomUUID().toString();

        TaskResult pending = TaskResult.builder()
                .id(id)
                .taskName(taskName)
                .periodicTaskName(options.periodicTaskName())
                .status(TaskResultStatus.PENDING)
                .args(args)
                .kwargs(kwargs)
                .queue(options.queue())
                .priority(options.priority() != null ? options.priority() : 0)
                .expiresAt(options.expiresAt())
                .dateCreated(clock.instant())
                .build();

        try {
            resultRepository.save(pending);
        } catch (RuntimeException e) {
            throw new DispatchUnavailableException("Cannot enqueue task " + taskName + ": " + e.getMessage(), e);
        }

        log.debug("Dispatched {} as {}", taskName, id);
        return id;
    }
}
