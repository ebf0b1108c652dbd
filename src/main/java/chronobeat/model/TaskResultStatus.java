package chronobeat.model;

/**
 * Execution status of a dispatched task.
 */
public enum TaskResultStatus {
    /** Dispatched, waiting for a worker */
    PENDING,
    /** Claimed by a worker */
    STARTED,
    /** Finished successfully */
    SUCCESS,
    /** Finished with an error */
    FAILURE,
    /** Failed, waiting to be claimed again */
    RETRY;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
