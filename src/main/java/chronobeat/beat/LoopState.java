package chronobeat.beat;

/**
 * Phase of the beat loop.
 */
public enum LoopState {
    IDLE_WAIT,
    EVALUATING,
    DISPATCHING,
    BOOKKEEPING,
    /** Terminal */
    SHUTTING_DOWN
}
