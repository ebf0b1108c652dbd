package chronobeat.exception;

/**
 * Malformed schedule or task definition. Raised by the admin API, never by the loop.
 */
public class ValidationException extends SchedulerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
