package work.cacm.engine.worker;

import java.util.Map;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.skill.SkillService;

/**
 * An autonomous unit of work bound to steps through the capability catalog.
 *
 * <p>Instances are created and cached by {@link WorkerLifecycleManager}; state kept in fields survives across every
 * step of the orchestrator's lifetime that resolves to the same worker. Delegation to peers goes through the manager
 * handed to {@link #attach}.
 */
public interface Worker {

    String name();

    /**
     * Executes one step.
     *
     * @param task the step description
     * @param inputs resolved step inputs; unresolved ones hold {@code MissingValue.INSTANCE} when the step allows it
     * @param context the run's shared context, written in place
     * @throws Exception any failure; the manager converts it into a {@link WorkerResult.Error}
     */
    WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) throws Exception;

    /**
     * Called once, right after construction and before the worker is cached.
     */
    default void attach(WorkerLifecycleManager manager, SkillService skills) {}
}
