package work.cacm.engine.worker;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cacm.engine.catalog.CapabilityCatalog;
import work.cacm.engine.catalog.CapabilityDescriptor;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.shared.ErrorKind;
import work.cacm.engine.skill.SkillService;

/**
 * Creates, caches and invokes workers.
 *
 * <p>A name resolves to a worker type in two ways: a factory registered directly under the name wins, otherwise the
 * name is looked up as a capability id and the descriptor's worker type is used. Workers are cached by type, so a peer
 * requested by type and a step bound through a capability share one instance for the manager's lifetime.
 *
 * <p>{@link #invoke} is the only call path, for steps and for delegation alike. It tracks the active call chain of the
 * current thread and refuses calls that would re-enter a worker already on the chain or nest deeper than
 * {@code maxDelegationDepth}.
 */
public final class WorkerLifecycleManager {
    public static final int DEFAULT_MAX_DELEGATION_DEPTH = 8;

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycleManager.class);

    private final WorkerRegistry registry;
    private final CapabilityCatalog catalog;
    private final SkillService skills;
    private final int maxDelegationDepth;
    private final Map<String, Worker> cache = new ConcurrentHashMap<>();
    private final ThreadLocal<Deque<Frame>> chain = ThreadLocal.withInitial(ArrayDeque::new);

    public WorkerLifecycleManager(WorkerRegistry registry, CapabilityCatalog catalog, SkillService skills) {
        this(registry, catalog, skills, DEFAULT_MAX_DELEGATION_DEPTH);
    }

    public WorkerLifecycleManager(WorkerRegistry registry, CapabilityCatalog catalog, SkillService skills, int maxDelegationDepth) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = catalog == null ? CapabilityCatalog.empty() : catalog;
        this.skills = skills == null ? SkillService.none() : skills;
        if (maxDelegationDepth < 0) {
            throw new IllegalArgumentException("maxDelegationDepth must be >= 0: " + maxDelegationDepth);
        }
        this.maxDelegationDepth = maxDelegationDepth;
    }

    public Worker getOrCreate(String name) {
        return getOrCreate(name, Map.of(), WorkerCreationContext.ORCHESTRATOR);
    }

    /**
     * Returns the cached worker for {@code name}, constructing and attaching it on first use. The factory sees the
     * catalog hints of the capability named, overlaid with {@code hints}; once cached, later hints are ignored.
     *
     * @throws CapabilityNotFoundException when no factory and no catalog entry match the name
     * @throws WorkerConstructionException when the catalog names an unknown worker type or the factory fails
     */
    public synchronized Worker getOrCreate(String name, Map<String, Object> hints, String requestedBy) {
        var target = resolve(name);
        var cached = cache.get(target.workerType());
        if (cached != null) {
            log.debug("Reusing cached worker '{}' for '{}'", target.workerType(), name);
            return cached;
        }
        var merged = new LinkedHashMap<String, Object>();
        target.descriptor().ifPresent(descriptor -> merged.putAll(descriptor.hints()));
        if (hints != null) {
            merged.putAll(hints);
        }
        var context = new WorkerCreationContext(target.workerType(), target.descriptor(), merged, requestedBy);
        Worker worker;
        try {
            worker = target.entry().factory().create(context);
        } catch (Exception ex) {
            log.error("Failed to construct worker '{}' for '{}': {}", target.workerType(), name, ex.getMessage(), ex);
            throw new WorkerConstructionException(target.workerType(),
                "Failed to construct worker '" + target.workerType() + "': " + ex.getMessage(), ex);
        }
        if (worker == null) {
            throw new WorkerConstructionException(target.workerType(),
                "Factory for worker type '" + target.workerType() + "' returned no worker");
        }
        try {
            worker.attach(this, skills);
        } catch (RuntimeException ex) {
            throw new WorkerConstructionException(target.workerType(),
                "Failed to attach worker '" + target.workerType() + "': " + ex.getMessage(), ex);
        }
        cache.put(target.workerType(), worker);
        log.info("Created worker '{}' for '{}' (requested by {})", target.workerType(), name, context.requestedBy());
        return worker;
    }

    public WorkerResult invoke(String name, String task, Map<String, Object> inputs, SharedContext context) {
        return invoke(name, task, inputs, context, Map.of(), WorkerCreationContext.ORCHESTRATOR);
    }

    /**
     * Runs {@code name} on the current thread. Worker exceptions and guard violations come back as
     * {@link WorkerResult.Error}; only name resolution and construction failures are thrown.
     */
    public WorkerResult invoke(
        String name,
        String task,
        Map<String, Object> inputs,
        SharedContext context,
        Map<String, Object> hints,
        String requestedBy
    ) {
        var target = resolve(name);
        var frames = chain.get();
        try {
            if (frames.stream().anyMatch(frame -> frame.workerType().equals(target.workerType()))) {
                var path = describeChain(frames) + " -> " + target.workerType();
                log.error("Delegation cycle detected: {}", path);
                return WorkerResult.error("Delegation cycle detected: " + path, delegationFields(path));
            }
            if (frames.size() > maxDelegationDepth) {
                var path = describeChain(frames) + " -> " + target.workerType();
                log.error("Delegation depth {} exceeded: {}", maxDelegationDepth, path);
                return WorkerResult.error(
                    "Delegation depth limit (" + maxDelegationDepth + ") exceeded: " + path, delegationFields(path));
            }
            var worker = getOrCreate(name, hints, requestedBy);
            frames.push(new Frame(name, target.workerType(), target.descriptor()));
            try {
                var result = worker.run(task, inputs == null ? Map.of() : inputs, context);
                if (result == null) {
                    return WorkerResult.error("Worker '" + target.workerType() + "' returned no result");
                }
                return result;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return WorkerResult.error("Worker '" + target.workerType() + "' interrupted");
            } catch (Exception ex) {
                log.error("Worker '{}' failed: {}", target.workerType(), ex.getMessage(), ex);
                return WorkerResult.from(ex);
            } finally {
                frames.pop();
            }
        } finally {
            if (frames.isEmpty()) {
                chain.remove();
            }
        }
    }

    /**
     * The capability whose call is running on this thread, if it was dispatched through a catalog entry.
     */
    public Optional<CapabilityDescriptor> currentCapability() {
        var frames = chain.get();
        var top = frames.peek();
        if (top == null) {
            chain.remove();
            return Optional.empty();
        }
        return top.descriptor();
    }

    public List<String> activeChain() {
        var frames = chain.get();
        if (frames.isEmpty()) {
            chain.remove();
            return List.of();
        }
        var names = frames.stream().map(Frame::workerType).collect(Collectors.toList());
        Collections.reverse(names);
        return List.copyOf(names);
    }

    public boolean isCached(String name) {
        if (name == null) {
            return false;
        }
        if (registry.contains(name)) {
            return cache.containsKey(name);
        }
        return catalog.lookup(name).map(descriptor -> cache.containsKey(descriptor.workerType())).orElse(false);
    }

    public Map<String, Worker> cachedWorkers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cache));
    }

    public CapabilityCatalog catalog() {
        return catalog;
    }

    public SkillService skills() {
        return skills;
    }

    public int maxDelegationDepth() {
        return maxDelegationDepth;
    }

    private Target resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new CapabilityNotFoundException(String.valueOf(name));
        }
        var descriptor = catalog.lookup(name);
        var direct = registry.get(name);
        if (direct != null) {
            return new Target(name, direct, descriptor);
        }
        if (descriptor.isEmpty()) {
            throw new CapabilityNotFoundException(name);
        }
        var workerType = descriptor.get().workerType();
        var entry = registry.get(workerType);
        if (entry == null) {
            throw new WorkerConstructionException(workerType,
                "Unknown worker type '" + workerType + "' for capability '" + name + "'");
        }
        return new Target(workerType, entry, descriptor);
    }

    private static String describeChain(Deque<Frame> frames) {
        var names = frames.stream().map(Frame::workerType).collect(Collectors.toList());
        Collections.reverse(names);
        return String.join(" -> ", names);
    }

    private static Map<String, Object> delegationFields(String path) {
        return Map.of("errorKind", ErrorKind.DELEGATION.name(), "chain", path);
    }

    private record Target(String workerType, WorkerRegistry.Entry entry, Optional<CapabilityDescriptor> descriptor) {}

    private record Frame(String name, String workerType, Optional<CapabilityDescriptor> descriptor) {}
}
