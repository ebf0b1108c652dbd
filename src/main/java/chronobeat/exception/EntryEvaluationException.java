package chronobeat.exception;

/**
 * Due-time computation for a single schedule entry failed.
 */
public class EntryEvaluationException extends SchedulerException {

    private final String taskName;

    public EntryEvaluationException(String taskName, Throwable cause) {
        super(ErrorCode.ENTRY_EVALUATION, "Cannot evaluate schedule for task " + taskName + ": " + cause.getMessage(),
                cause);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
