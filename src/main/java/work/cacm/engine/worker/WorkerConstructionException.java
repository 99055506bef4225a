package work.cacm.engine.worker;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

public final class WorkerConstructionException extends EngineException {
    private final String workerType;

    public WorkerConstructionException(String workerType, String message) {
        super(ErrorKind.WORKER_CONSTRUCTION, message);
        this.workerType = workerType;
    }

    public WorkerConstructionException(String workerType, String message, Throwable cause) {
        super(ErrorKind.WORKER_CONSTRUCTION, message, cause);
        this.workerType = workerType;
    }

    public String workerType() {
        return workerType;
    }
}
