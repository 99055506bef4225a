package work.cacm.engine.shared;

/**
 * Classifies engine failures. Only {@link #VALIDATION} and {@link #WORKFLOW_LOAD} stop a run before any step executes.
 */
public enum ErrorKind {
    VALIDATION,
    CATALOG_LOAD,
    WORKFLOW_LOAD,
    CAPABILITY_NOT_FOUND,
    WORKER_CONSTRUCTION,
    UNRESOLVED_BINDING,
    WORKER_EXECUTION,
    OUTPUT_BINDING,
    TIMEOUT,
    DELEGATION,
    SKILL_INVOCATION
}
