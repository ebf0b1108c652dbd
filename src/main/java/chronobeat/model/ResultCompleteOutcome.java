package chronobeat.model;

/**
 * Outcome of a worker reporting success.
 */
public enum ResultCompleteOutcome {
    /** Result moved to SUCCESS */
    COMPLETED,

    /** Result was already SUCCESS or FAILURE - idempotent success */
    ALREADY_DONE,

    /** No such result */
    NOT_FOUND,

    /** Result is held by a different worker */
    WRONG_WORKER
}
