package work.cacm.engine.runtime;

/**
 * Orchestrator run lifecycle: {@code IDLE -> VALIDATING -> (INVALID -> DONE_FAILED) | EXECUTING -> DONE_SUCCESS |
 * DONE_PARTIAL_FAILURE}.
 */
public enum RunState {
    IDLE,
    VALIDATING,
    INVALID,
    EXECUTING,
    DONE_SUCCESS,
    DONE_PARTIAL_FAILURE,
    DONE_FAILED;

    public boolean terminal() {
        return this == DONE_SUCCESS || this == DONE_PARTIAL_FAILURE || this == DONE_FAILED;
    }
}
