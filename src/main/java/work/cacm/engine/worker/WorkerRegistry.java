package work.cacm.engine.worker;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps worker type names to factories. Populated at process start, before any orchestrator is built.
 */
public final class WorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, Entry> factories = new ConcurrentHashMap<>();

    public WorkerRegistry register(String workerType, WorkerFactory factory) {
        return register(workerType, factory, null);
    }

    public WorkerRegistry register(String workerType, WorkerFactory factory, String description) {
        Objects.requireNonNull(workerType, "workerType");
        Objects.requireNonNull(factory, "factory");
        var previous = factories.put(workerType, new Entry(workerType, factory, description == null ? "" : description));
        if (previous != null) {
            log.warn("Worker type '{}' already registered. Replacing...", workerType);
        } else {
            log.debug("Registered worker type '{}'", workerType);
        }
        return this;
    }

    public Entry get(String workerType) {
        return workerType == null ? null : factories.get(workerType);
    }

    public boolean contains(String workerType) {
        return get(workerType) != null;
    }

    public void unregister(String workerType) {
        if (workerType != null) {
            factories.remove(workerType);
        }
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(factories);
    }

    public record Entry(String workerType, WorkerFactory factory, String description) {}
}
