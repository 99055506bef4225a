package work.cacm.engine.validation;

import work.cacm.engine.model.WorkflowInstance;

/**
 * Checks a workflow before it runs. An invalid report stops the run before any step executes.
 */
@FunctionalInterface
public interface WorkflowValidator {
    ValidationReport validate(WorkflowInstance instance);
}
