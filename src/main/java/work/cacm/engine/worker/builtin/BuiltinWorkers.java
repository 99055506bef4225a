package work.cacm.engine.worker.builtin;

import work.cacm.engine.worker.WorkerRegistry;

/**
 * Generic workers shipped with the engine so examples and embedding apps run without custom code.
 */
public final class BuiltinWorkers {
    public static final String ECHO = "echo";
    public static final String CONTEXT_WRITER = "context_writer";
    public static final String CONTEXT_READER = "context_reader";
    public static final String SKILL = "skill";
    public static final String DELEGATING = "delegating";

    private BuiltinWorkers() {}

    public static WorkerRegistry register(WorkerRegistry registry) {
        registry.register(ECHO, ctx -> new EchoWorker(ECHO), "Returns its inputs as result fields");
        registry.register(CONTEXT_WRITER, ctx -> new ContextWriterWorker(CONTEXT_WRITER, ctx.hintAsString(ContextWriterWorker.KEY_PREFIX_HINT, "")),
            "Stores step inputs in the shared context");
        registry.register(CONTEXT_READER, ctx -> new ContextReaderWorker(CONTEXT_READER), "Reads shared context entries");
        registry.register(SKILL, ctx -> new SkillWorker(SKILL, ctx.descriptor().flatMap(d -> d.defaultSkill()).orElse(null)),
            "Invokes a skill through the skill service");
        registry.register(DELEGATING, ctx -> new DelegatingWorker(DELEGATING, ctx.hintAsString(DelegatingWorker.DELEGATE_TO, null)),
            "Forwards the step to a peer worker");
        return registry;
    }

    public static WorkerRegistry createRegistry() {
        return register(new WorkerRegistry());
    }
}
