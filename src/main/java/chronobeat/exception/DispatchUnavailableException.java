package chronobeat.exception;

/**
 * The execution system could not accept a task. Transient: the entry stays due.
 */
public class DispatchUnavailableException extends SchedulerException {

    public DispatchUnavailableException(String message) {
        super(ErrorCode.DISPATCH_UNAVAILABLE, message);
    }

    public DispatchUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DISPATCH_UNAVAILABLE, message, cause);
    }
}
