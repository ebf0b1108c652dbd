package chronobeat.dispatch;

import chronobeat.exception.DispatchUnavailableException;

import java.util.List;
import java.util.Map;

/**
 * Hands a due task to the execution system.
 */
public interface TaskDispatcher {

    /**
     * Enqueue one execution of a task.
     *
     * @param taskName name understood by the execution system
     * @param args     positional arguments, passed verbatim
     * @param kwargs   keyword arguments, passed verbatim
     * @param options  routing and expiry options
     * @return id of the dispatched execution
     * @throws DispatchUnavailableException if the execution system cannot
     *                                      accept the task right now
     */
    String dispatch(String taskName, List<Object> args, Map<String, Object> kwargs, DispatchOptions options);
}
