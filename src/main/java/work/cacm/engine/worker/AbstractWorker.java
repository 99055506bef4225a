package work.cacm.engine.worker;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cacm.engine.catalog.CapabilityDescriptor;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.shared.EngineException;
import work.cacm.engine.skill.SkillService;

/**
 * Base class wiring a worker to its manager and skill service. Each worker logs through {@code worker.<name>}.
 */
public abstract class AbstractWorker implements Worker {
    protected final Logger log;

    private final String name;
    private volatile WorkerLifecycleManager manager;
    private volatile SkillService skills = SkillService.none();

    protected AbstractWorker(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.log = LoggerFactory.getLogger("worker." + name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void attach(WorkerLifecycleManager manager, SkillService skills) {
        this.manager = manager;
        if (skills != null) {
            this.skills = skills;
        }
        log.debug("Worker '{}' attached", name);
    }

    protected Optional<WorkerLifecycleManager> manager() {
        return Optional.ofNullable(manager);
    }

    protected SkillService skills() {
        return skills;
    }

    protected Optional<CapabilityDescriptor> currentCapability() {
        return manager().flatMap(WorkerLifecycleManager::currentCapability);
    }

    /**
     * Runs a peer through the manager so the delegation guard applies. Never throws.
     */
    protected WorkerResult delegate(String peerName, String task, Map<String, Object> inputs, SharedContext context) {
        var current = manager;
        if (current == null) {
            return WorkerResult.error("Worker '" + name + "' cannot delegate: no lifecycle manager attached");
        }
        log.info("Worker '{}' delegating to '{}'", name, peerName);
        try {
            return current.invoke(peerName, task, inputs, context, Map.of(), name);
        } catch (EngineException ex) {
            log.error("Delegation from '{}' to '{}' failed: {}", name, peerName, ex.getMessage());
            return WorkerResult.error(ex.getMessage(), Map.of("errorKind", ex.kind().name()));
        }
    }
}
