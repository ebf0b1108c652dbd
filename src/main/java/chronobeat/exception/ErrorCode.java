package chronobeat.exception;

/**
 * Stable numeric codes for scheduler errors, echoed by the admin API.
 */
public enum ErrorCode {
    VALIDATION(1),
    SCHEDULE_IN_USE(2),
    DISPATCH_UNAVAILABLE(3),
    PERSISTENCE_SYNC(4),
    ENTRY_EVALUATION(5);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
