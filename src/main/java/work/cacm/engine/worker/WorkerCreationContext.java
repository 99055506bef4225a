package work.cacm.engine.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.cacm.engine.catalog.CapabilityDescriptor;

/**
 * What a {@link WorkerFactory} knows when it builds a worker.
 *
 * @param workerType the registered type being instantiated, also the cache key
 * @param descriptor the capability that caused the construction, if any
 * @param hints construction hints: the capability's catalog hints overlaid with those supplied by the requester
 * @param requestedBy the worker or component that asked for it, {@code orchestrator} for step dispatch
 */
public record WorkerCreationContext(
    String workerType,
    Optional<CapabilityDescriptor> descriptor,
    Map<String, Object> hints,
    String requestedBy
) {
    public static final String ORCHESTRATOR = "orchestrator";

    public WorkerCreationContext {
        Objects.requireNonNull(workerType, "workerType");
        descriptor = descriptor == null ? Optional.empty() : descriptor;
        hints = hints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hints));
        requestedBy = requestedBy == null || requestedBy.isBlank() ? ORCHESTRATOR : requestedBy;
    }

    public Optional<Object> hint(String key) {
        return Optional.ofNullable(hints.get(key));
    }

    public String hintAsString(String key, String fallback) {
        return hint(key).map(String::valueOf).orElse(fallback);
    }
}
