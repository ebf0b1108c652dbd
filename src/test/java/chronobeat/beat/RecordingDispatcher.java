package chronobeat.beat;

import chronobeat.dispatch.DispatchOptions;
import chronobeat.dispatch.TaskDispatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dispatcher that records calls and can be told to fail.
 */
class RecordingDispatcher implements TaskDispatcher {

    record Call(String taskName, List<Object> args, Map<String, Object> kwargs, DispatchOptions options) {
    }

    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile RuntimeException failWith;

    @Override
    public String dispatch(String taskName, List<Object> args, Map<String, Object> kwargs,
            DispatchOptions options) {
        RuntimeException failure = failWith;
        if (failure != null) {
            throw failure;
        }
        calls.add(new Call(taskName, args, kwargs, options));
        return "dispatch-" + calls.size();
    }

    void failWith(RuntimeException e) {
        this.failWith = e;
    }

    void recover() {
        this.failWith = null;
    }

    List<Call> calls() {
        return List.copyOf(calls);
    }

    List<String> periodicTaskNames() {
        return calls().stream().map(c -> c.options().periodicTaskName()).toList();
    }
}
