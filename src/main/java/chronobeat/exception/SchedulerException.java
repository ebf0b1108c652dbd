package chronobeat.exception;

/**
 * Base class for all scheduler errors.
 */
public class SchedulerException extends RuntimeException {

    private final ErrorCode errorCode;

    public SchedulerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SchedulerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return String.format("%s[%d]: %s", getClass().getSimpleName(), errorCode.code(), getMessage());
    }
}
