package work.cacm.engine.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cacm.engine.binding.Binding;
import work.cacm.engine.binding.BindingParser;
import work.cacm.engine.binding.BindingResolver;
import work.cacm.engine.binding.BindingScope;
import work.cacm.engine.binding.MissingValue;
import work.cacm.engine.catalog.CapabilityCatalog;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.model.WorkflowInstance;
import work.cacm.engine.model.WorkflowStep;
import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;
import work.cacm.engine.skill.SkillService;
import work.cacm.engine.validation.StructuralWorkflowValidator;
import work.cacm.engine.validation.WorkflowValidator;
import work.cacm.engine.worker.WorkerLifecycleManager;
import work.cacm.engine.worker.WorkerRegistry;
import work.cacm.engine.worker.WorkerResult;

/**
 * Runs workflow instances step by step.
 *
 * <p>A run validates the instance, then for each step resolves its inputs, dispatches the bound worker through the
 * {@link WorkerLifecycleManager} and copies the named result fields to their targets. Step failures never abort the
 * run: the step is reported as failed, its outputs stay unbound and later steps depending on them fail in turn, unless
 * the failed step is {@code required}, in which case the remaining steps are skipped.
 *
 * <p>Workers are cached for the orchestrator's lifetime, so state kept by a worker carries across steps and runs.
 * {@link #run} is not reentrant; use one orchestrator per concurrent run.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final String SOURCE = "Orchestrator";
    private static final String UNKNOWN_CACM = "unknown";

    private final WorkerLifecycleManager workers;
    private final WorkflowValidator validator;
    private final OrchestratorSettings settings;
    private volatile ExecutorService invocationPool;
    private volatile RunState state = RunState.IDLE;

    public Orchestrator(CapabilityCatalog catalog, WorkerRegistry registry, SkillService skills) {
        this(catalog, registry, skills, new StructuralWorkflowValidator(), OrchestratorSettings.defaults());
    }

    public Orchestrator(
        CapabilityCatalog catalog,
        WorkerRegistry registry,
        SkillService skills,
        WorkflowValidator validator,
        OrchestratorSettings settings
    ) {
        this.settings = settings == null ? OrchestratorSettings.defaults() : settings;
        this.validator = validator == null ? new StructuralWorkflowValidator() : validator;
        this.workers = new WorkerLifecycleManager(registry, catalog, skills, this.settings.maxDelegationDepth());
    }

    public WorkerLifecycleManager workers() {
        return workers;
    }

    public OrchestratorSettings settings() {
        return settings;
    }

    public RunState state() {
        return state;
    }

    public OrchestrationResult run(WorkflowInstance instance) {
        return run(instance, null);
    }

    /**
     * Runs {@code instance} against the given context, or a fresh one when {@code sharedContext} is null. Never throws
     * for validation or step failures; those are reported in the result.
     */
    public OrchestrationResult run(WorkflowInstance instance, SharedContext sharedContext) {
        Objects.requireNonNull(instance, "instance");
        var logs = new ExecutionLog();
        var context = sharedContext != null ? sharedContext : new SharedContext(cacmIdOf(instance));

        transition(RunState.VALIDATING);
        logs.info(SOURCE, "Validating CACM instance '" + cacmIdOf(instance) + "'.");
        var report = validator.validate(instance);
        if (!report.valid()) {
            transition(RunState.INVALID);
            for (var error : report.errors()) {
                logs.error("Validator", error.path() + ": " + error.message());
            }
            logs.error(SOURCE, "CACM instance is invalid. " + report.errors().size() + " error(s); no steps executed.");
            transition(RunState.DONE_FAILED);
            return new OrchestrationResult(false, logs.entries(), Map.of(), Map.of(), List.of(), RunState.DONE_FAILED, context);
        }
        logs.info(SOURCE, "CACM instance is valid.");

        transition(RunState.EXECUTING);
        var scope = new BindingScope(instance.inputScope());
        var reports = new ArrayList<StepReport>();
        String haltedBy = null;
        for (var step : instance.steps()) {
            if (haltedBy != null) {
                var message = "Skipped: required step '" + haltedBy + "' failed";
                logs.warn(SOURCE, "Skipping step '" + step.stepId() + "': required step '" + haltedBy + "' failed.");
                reports.add(StepReport.skipped(step.stepId(), step.computeCapabilityRef(), message));
                continue;
            }
            var stepReport = executeStep(step, scope, context, logs);
            reports.add(stepReport);
            if (stepReport.failed() && step.required()) {
                haltedBy = step.stepId();
                logs.error(SOURCE, "Required step '" + step.stepId() + "' failed; remaining steps will be skipped.");
            }
        }

        var failures = reports.stream().filter(r -> r.state() != StepState.CAPTURED).count();
        var finalState = failures == 0 ? RunState.DONE_SUCCESS : RunState.DONE_PARTIAL_FAILURE;
        transition(finalState);
        if (failures == 0) {
            logs.info(SOURCE, "Workflow completed successfully (" + reports.size() + " step(s)).");
        } else {
            logs.warn(SOURCE, "Workflow completed with " + failures + " failed or skipped step(s) of " + reports.size() + ".");
        }
        return new OrchestrationResult(failures == 0, logs.entries(), scope.outputs(), scope.intermediates(), reports,
            finalState, context);
    }

    private StepReport executeStep(WorkflowStep step, BindingScope scope, SharedContext context, ExecutionLog logs) {
        var started = Instant.now();
        var stepId = step.stepId();
        var capability = step.computeCapabilityRef();
        logs.info(SOURCE, "--- Executing Step '" + stepId + "' (" + capability + ") ---");

        log.debug("Step '{}' -> {}", stepId, StepState.RESOLVING_INPUTS);
        var resolution = BindingResolver.resolveAll(step.inputBindings(), scope);
        for (var entry : resolution.unresolved().entrySet()) {
            var ex = entry.getValue();
            logs.warn(SOURCE, "Step '" + stepId + "': input '" + entry.getKey() + "' unresolved (" + ex.getMessage() + ").");
        }
        if (!resolution.complete() && !step.allowMissingInputs()) {
            return fail(step, logs, started, ErrorKind.UNRESOLVED_BINDING,
                "Unresolved input binding(s): " + String.join(", ", resolution.unresolved().keySet()), List.of());
        }

        try {
            workers.getOrCreate(capability);
        } catch (EngineException ex) {
            return fail(step, logs, started, ex.kind(), ex.getMessage(), List.of());
        }

        log.debug("Step '{}' -> {}", stepId, StepState.DISPATCHED);
        WorkerResult result;
        try {
            result = dispatch(step, resolution.values(), context);
        } catch (StepFailure failure) {
            return fail(step, logs, started, failure.kind, failure.getMessage(), List.of());
        }

        if (result instanceof WorkerResult.Error error) {
            logs.error("Worker '" + capability + "'", error.message());
            var kind = ErrorKind.DELEGATION.name().equals(error.fields().get("errorKind"))
                ? ErrorKind.DELEGATION
                : ErrorKind.WORKER_EXECUTION;
            return fail(step, logs, started, kind, error.message(), List.of());
        }

        var warnings = new ArrayList<String>();
        if (result instanceof WorkerResult.Partial partial) {
            for (var warning : partial.warnings()) {
                logs.warn("Worker '" + capability + "'", warning);
                warnings.add(warning);
            }
        }

        var bindingErrors = applyOutputs(step, result, scope, logs, warnings);
        if (!bindingErrors.isEmpty()) {
            return fail(step, logs, started, ErrorKind.OUTPUT_BINDING, String.join("; ", bindingErrors), warnings);
        }
        log.debug("Step '{}' -> {}", stepId, StepState.CAPTURED);
        logs.info(SOURCE, "Step '" + stepId + "' completed (" + result.status() + ").");
        return StepReport.captured(stepId, capability, result.message(), warnings, Duration.between(started, Instant.now()));
    }

    private WorkerResult dispatch(WorkflowStep step, Map<String, Object> inputs, SharedContext context) {
        var timeout = settings.stepTimeout();
        if (timeout.isEmpty()) {
            try {
                return workers.invoke(step.computeCapabilityRef(), step.description(), inputs, context);
            } catch (EngineException ex) {
                throw new StepFailure(ex.kind(), ex.getMessage());
            }
        }
        var future = invocationPool().submit(
            () -> workers.invoke(step.computeCapabilityRef(), step.description(), inputs, context));
        try {
            return future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new StepFailure(ErrorKind.TIMEOUT, "Step '" + step.stepId() + "' timed out after " + timeout.get());
        } catch (ExecutionException ex) {
            var cause = ex.getCause();
            if (cause instanceof EngineException engineException) {
                throw new StepFailure(engineException.kind(), engineException.getMessage());
            }
            throw new StepFailure(ErrorKind.WORKER_EXECUTION, String.valueOf(cause == null ? ex.getMessage() : cause.getMessage()));
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepFailure(ErrorKind.WORKER_EXECUTION, "Interrupted while waiting for step '" + step.stepId() + "'");
        }
    }

    /**
     * Copies result fields to their targets and returns the binding errors that fail the step.
     */
    private List<String> applyOutputs(WorkflowStep step, WorkerResult result, BindingScope scope, ExecutionLog logs,
                                      List<String> warnings) {
        var errors = new ArrayList<String>();
        var missingFields = new ArrayList<String>();
        for (var entry : step.outputBindings().entrySet()) {
            var field = entry.getKey();
            if (!result.hasField(field)) {
                missingFields.add(field);
                continue;
            }
            var value = result.fields().get(field);
            if (MissingValue.isMissing(value)) {
                var warning = "Result field '" + field + "' is unresolved and was not bound";
                logs.warn(SOURCE, "Step '" + step.stepId() + "': " + warning + ".");
                warnings.add(warning);
                continue;
            }
            Binding.Reference target;
            try {
                target = BindingParser.parseReference(entry.getValue());
            } catch (IllegalArgumentException ex) {
                errors.add("Invalid output target for '" + field + "': " + ex.getMessage());
                continue;
            }
            var prior = scope.conflictingWrite(target, step.stepId());
            if (prior.isPresent()) {
                var written = prior.get().path().equals(target.text())
                    ? "'" + target.text() + "'"
                    : "'" + target.text() + "' (overlaps '" + prior.get().path() + "')";
                if (settings.outputConflictPolicy() == OutputConflictPolicy.REJECT) {
                    var message = "Target " + written + " already written by step '" + prior.get().writer() + "'";
                    logs.error(SOURCE, "Step '" + step.stepId() + "': " + message + ".");
                    errors.add(message);
                    continue;
                }
                logs.warn(SOURCE, "Step '" + step.stepId() + "' overwrites " + written + " written by step '"
                    + prior.get().writer() + "'.");
            }
            try {
                scope.write(target, value, step.stepId());
                logs.info(SOURCE, "Step '" + step.stepId() + "': bound '" + field + "' -> " + target.text());
            } catch (IllegalArgumentException | IllegalStateException ex) {
                logs.error(SOURCE, "Step '" + step.stepId() + "': " + ex.getMessage());
                errors.add(ex.getMessage());
            }
        }
        if (!missingFields.isEmpty()) {
            var message = "Result field(s) missing: " + String.join(", ", missingFields);
            if (result instanceof WorkerResult.Partial) {
                logs.warn(SOURCE, "Step '" + step.stepId() + "': " + message + ".");
                warnings.add(message);
            } else {
                errors.add(0, message);
            }
        }
        return errors;
    }

    private StepReport fail(WorkflowStep step, ExecutionLog logs, Instant started, ErrorKind kind, String message,
                            List<String> warnings) {
        log.debug("Step '{}' -> {} ({})", step.stepId(), StepState.FAILED, kind);
        logs.error(SOURCE, "Step '" + step.stepId() + "' failed [" + kind + "]: " + message);
        return StepReport.failed(step.stepId(), step.computeCapabilityRef(), kind, message, warnings,
            Duration.between(started, Instant.now()));
    }

    private void transition(RunState next) {
        log.debug("Run state {} -> {}", state, next);
        state = next;
    }

    private ExecutorService invocationPool() {
        var pool = invocationPool;
        if (pool == null) {
            synchronized (this) {
                pool = invocationPool;
                if (pool == null) {
                    pool = Executors.newCachedThreadPool(new StepThreadFactory());
                    invocationPool = pool;
                }
            }
        }
        return pool;
    }

    @Override
    public void close() {
        var pool = invocationPool;
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static String cacmIdOf(WorkflowInstance instance) {
        return instance.cacmId() == null || instance.cacmId().isBlank() ? UNKNOWN_CACM : instance.cacmId();
    }

    private static final class StepFailure extends RuntimeException {
        private final ErrorKind kind;

        StepFailure(ErrorKind kind, String message) {
            super(message, null, false, false);
            this.kind = kind;
        }
    }

    private static final class StepThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            var thread = new Thread(runnable, "cacm-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
