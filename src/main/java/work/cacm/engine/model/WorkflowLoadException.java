package work.cacm.engine.model;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

public final class WorkflowLoadException extends EngineException {
    public WorkflowLoadException(String message) {
        super(ErrorKind.WORKFLOW_LOAD, message);
    }

    public WorkflowLoadException(String message, Throwable cause) {
        super(ErrorKind.WORKFLOW_LOAD, message, cause);
    }
}
