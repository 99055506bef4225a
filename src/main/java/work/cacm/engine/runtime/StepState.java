package work.cacm.engine.runtime;

public enum StepState {
    PENDING,
    RESOLVING_INPUTS,
    DISPATCHED,
    CAPTURED,
    FAILED,
    SKIPPED
}
