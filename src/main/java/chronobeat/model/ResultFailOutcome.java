package chronobeat.model;

/**
 * Outcome of a worker reporting failure.
 */
public enum ResultFailOutcome {
    /** Result moved to RETRY and can be claimed again */
    RETRY,

    /** Result moved to FAILURE */
    FAILED,

    /** Result was already terminal - idempotent success */
    ALREADY_TERMINAL,

    /** No such result */
    NOT_FOUND,

    /** Result is held by a different worker */
    WRONG_WORKER
}
