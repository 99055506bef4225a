package work.cacm.engine.worker;

/**
 * Builds a worker for a registered worker type.
 */
@FunctionalInterface
public interface WorkerFactory {
    Worker create(WorkerCreationContext context) throws Exception;
}
