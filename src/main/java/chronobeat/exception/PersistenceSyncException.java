package chronobeat.exception;

/**
 * Writing run bookkeeping back to the store failed.
 */
public class PersistenceSyncException extends SchedulerException {

    private final String taskName;

    public PersistenceSyncException(String taskName, Throwable cause) {
        super(ErrorCode.PERSISTENCE_SYNC, "Failed to sync run info for task " + taskName, cause);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
