package work.cacm.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.cacm.engine.catalog.CapabilityCatalog;
import work.cacm.engine.catalog.CapabilityDescriptor;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.model.InputDeclaration;
import work.cacm.engine.model.WorkflowInstance;
import work.cacm.engine.model.WorkflowStep;
import work.cacm.engine.shared.ErrorKind;
import work.cacm.engine.skill.SkillService;
import work.cacm.engine.support.EngineTestSupport;
import work.cacm.engine.validation.StructuralWorkflowValidator;
import work.cacm.engine.worker.builtin.EchoWorker;

class OrchestratorTest {
    private static Orchestrator orchestrator(CapabilityDescriptor... descriptors) {
        return orchestrator(OrchestratorSettings.defaults(), descriptors);
    }

    private static Orchestrator orchestrator(OrchestratorSettings settings, CapabilityDescriptor... descriptors) {
        return new Orchestrator(EngineTestSupport.catalog(descriptors), EngineTestSupport.registry(), SkillService.none(),
            new StructuralWorkflowValidator(), settings);
    }

    private static WorkflowInstance echoChain() {
        return WorkflowInstance.builder("echo-chain")
            .output("x")
            .output("y")
            .step(WorkflowStep.builder("s1", "echo")
                .input("value", "hello")
                .output("value", "cacm.outputs.x")
                .build())
            .step(WorkflowStep.builder("s2", "echo")
                .input("in", "cacm.outputs.x")
                .output("in", "cacm.outputs.y")
                .build())
            .build();
    }

    @Test
    void runsChainedStepsToSuccess() {
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(echoChain());
            assertTrue(result.success(), result.logLines().toString());
            assertEquals(Map.of("x", "hello", "y", "hello"), result.outputs());
            assertEquals(RunState.DONE_SUCCESS, result.finalState());
            assertEquals(RunState.DONE_SUCCESS, orchestrator.state());
            assertEquals(List.of(StepState.CAPTURED, StepState.CAPTURED),
                result.stepReports().stream().map(StepReport::state).toList());
            assertTrue(result.logLines().contains("INFO: Orchestrator: CACM instance is valid."));
            assertTrue(result.logLines().contains("INFO: Orchestrator: --- Executing Step 's1' (echo) ---"));
        }
    }

    @Test
    void reusesOneWorkerInstanceAcrossSteps() {
        try (var orchestrator = orchestrator()) {
            orchestrator.run(echoChain());
            var echo = (EchoWorker) orchestrator.workers().cachedWorkers().get("echo");
            assertEquals(2, echo.invocations());
            assertEquals(1, orchestrator.workers().cachedWorkers().size());
        }
    }

    @Test
    void unresolvedReferenceFailsOnlyDependentSteps() {
        var instance = WorkflowInstance.builder("missing-key")
            .output("a")
            .output("b")
            .output("c")
            .step(WorkflowStep.builder("independent", "echo")
                .input("value", 1)
                .output("value", "cacm.outputs.a")
                .build())
            .step(WorkflowStep.builder("dependent", "echo")
                .input("value", "cacm.outputs.missingKey")
                .output("value", "cacm.outputs.b")
                .build())
            .step(WorkflowStep.builder("downstream", "echo")
                .input("value", "cacm.outputs.b")
                .output("value", "cacm.outputs.c")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertFalse(result.success());
            assertEquals(RunState.DONE_PARTIAL_FAILURE, result.finalState());
            assertEquals(Map.of("a", 1), result.outputs());
            var dependent = result.report("dependent").orElseThrow();
            assertEquals(StepState.FAILED, dependent.state());
            assertEquals(Optional.of(ErrorKind.UNRESOLVED_BINDING), dependent.errorKind());
            assertEquals(Optional.of(ErrorKind.UNRESOLVED_BINDING), result.report("downstream").orElseThrow().errorKind());
            assertTrue(result.logs().stream().anyMatch(entry -> entry.level() == LogLevel.WARN
                && entry.message().contains("missingKey")));
        }
    }

    @Test
    void invalidInstanceRunsNothing() {
        var instance = WorkflowInstance.builder(null)
            .step(WorkflowStep.builder(null, "echo").build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertFalse(result.success());
            assertEquals(RunState.DONE_FAILED, result.finalState());
            assertTrue(result.outputs().isEmpty());
            assertTrue(result.stepReports().isEmpty());
            assertTrue(orchestrator.workers().cachedWorkers().isEmpty());
            var errors = result.logs().stream().filter(entry -> entry.level() == LogLevel.ERROR).map(LogEntry::message).toList();
            assertTrue(errors.contains("cacmId: 'cacmId' is a required property"), errors.toString());
            assertTrue(errors.contains("workflow[0]: 'stepId' is a required property"), errors.toString());
        }
    }

    @Test
    void resolvesNestedInputPaths() {
        var instance = WorkflowInstance.builder("nested")
            .input("params", InputDeclaration.of(Map.of("clientId", "ACME"), "object"))
            .output("client")
            .step(WorkflowStep.builder("s1", "echo")
                .input("clientId", "cacm.inputs.params.value.clientId")
                .output("clientId", "cacm.outputs.client")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertEquals(Map.of("client", "ACME"), result.outputs());
        }
    }

    @Test
    void intermediatesAreVisibleOnlyAfterTheirWriter() {
        var instance = WorkflowInstance.builder("ordering")
            .output("out")
            .step(WorkflowStep.builder("early", "echo")
                .input("value", "intermediate.scratch")
                .build())
            .step(WorkflowStep.builder("writer", "echo")
                .input("value", 7)
                .output("value", "intermediate.scratch")
                .build())
            .step(WorkflowStep.builder("late", "echo")
                .input("value", "intermediate.scratch")
                .output("value", "cacm.outputs.out")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertEquals(StepState.FAILED, result.report("early").orElseThrow().state());
            assertEquals(Map.of("out", 7), result.outputs());
            assertEquals(Map.of("scratch", 7), result.intermediates());
        }
    }

    @Test
    void allowMissingInputsDispatchesWithSentinel() {
        var instance = WorkflowInstance.builder("tolerant")
            .output("present")
            .output("absent")
            .step(WorkflowStep.builder("s1", "echo")
                .allowMissingInputs(true)
                .input("present", "yes")
                .input("absent", "intermediate.nothing")
                .output("present", "cacm.outputs.present")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertTrue(result.success(), result.logLines().toString());
            assertEquals(Map.of("present", "yes"), result.outputs());
        }
    }

    @Test
    void workerErrorAndExceptionFailTheStep() {
        var instance = WorkflowInstance.builder("errors")
            .output("x")
            .step(WorkflowStep.builder("scripted", EngineTestSupport.FAILING).output("value", "cacm.outputs.x").build())
            .step(WorkflowStep.builder("thrown", EngineTestSupport.THROWING).build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertFalse(result.success());
            assertTrue(result.outputs().isEmpty());
            assertEquals(Optional.of(ErrorKind.WORKER_EXECUTION), result.report("scripted").orElseThrow().errorKind());
            var thrown = result.report("thrown").orElseThrow();
            assertEquals(Optional.of(ErrorKind.WORKER_EXECUTION), thrown.errorKind());
            assertEquals("Boom", thrown.message());
        }
    }

    @Test
    void constructionFailuresAreStepLocal() {
        var instance = WorkflowInstance.builder("construction")
            .output("x")
            .step(WorkflowStep.builder("unknown", "no_such_capability").build())
            .step(WorkflowStep.builder("badType", "rate").build())
            .step(WorkflowStep.builder("fine", "echo").input("value", 1).output("value", "cacm.outputs.x").build())
            .build();
        try (var orchestrator = orchestrator(CapabilityDescriptor.of("rate", "rating_engine"))) {
            var result = orchestrator.run(instance);
            assertEquals(Optional.of(ErrorKind.CAPABILITY_NOT_FOUND), result.report("unknown").orElseThrow().errorKind());
            assertEquals(Optional.of(ErrorKind.WORKER_CONSTRUCTION), result.report("badType").orElseThrow().errorKind());
            assertEquals(StepState.CAPTURED, result.report("fine").orElseThrow().state());
            assertEquals(Map.of("x", 1), result.outputs());
        }
    }

    @Test
    void missingSuccessFieldFailsButPartialOnlyWarns() {
        var instance = WorkflowInstance.builder("fields")
            .output("ratio")
            .output("leverage")
            .output("echoed")
            .step(WorkflowStep.builder("partial", EngineTestSupport.PARTIAL)
                .output("current_ratio", "cacm.outputs.ratio")
                .output("debt_to_equity", "cacm.outputs.leverage")
                .build())
            .step(WorkflowStep.builder("strict", "echo")
                .input("value", "v")
                .output("value", "cacm.outputs.echoed")
                .output("nonexistent", "intermediate.never")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            var partial = result.report("partial").orElseThrow();
            assertEquals(StepState.CAPTURED, partial.state());
            assertTrue(partial.warnings().contains("debt_to_equity unavailable"));
            assertTrue(partial.warnings().contains("Result field(s) missing: debt_to_equity"));

            var strict = result.report("strict").orElseThrow();
            assertEquals(Optional.of(ErrorKind.OUTPUT_BINDING), strict.errorKind());
            assertEquals(Map.of("ratio", 1.2, "echoed", "v"), result.outputs());
            assertFalse(result.success());
        }
    }

    @Test
    void requiredStepFailureSkipsTheRest() {
        var instance = WorkflowInstance.builder("required")
            .output("x")
            .step(WorkflowStep.builder("gate", EngineTestSupport.FAILING).required(true).build())
            .step(WorkflowStep.builder("after", "echo").input("value", 1).output("value", "cacm.outputs.x").build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertEquals(StepState.FAILED, result.report("gate").orElseThrow().state());
            assertEquals(StepState.SKIPPED, result.report("after").orElseThrow().state());
            assertTrue(result.outputs().isEmpty());
            assertFalse(orchestrator.workers().isCached("echo"));
            assertEquals(RunState.DONE_PARTIAL_FAILURE, result.finalState());
        }
    }

    @Test
    void stepTimeoutFailsWithTimeoutKind() {
        var settings = OrchestratorSettings.builder().stepTimeout(Duration.ofMillis(100)).build();
        var instance = WorkflowInstance.builder("slow")
            .output("x")
            .step(WorkflowStep.builder("slow", EngineTestSupport.SLEEPY).output("value", "cacm.outputs.x").build())
            .step(WorkflowStep.builder("quick", "echo").input("value", 1).build())
            .build();
        try (var orchestrator = orchestrator(settings)) {
            var result = orchestrator.run(instance);
            assertEquals(Optional.of(ErrorKind.TIMEOUT), result.report("slow").orElseThrow().errorKind());
            assertEquals(StepState.CAPTURED, result.report("quick").orElseThrow().state());
            assertTrue(result.outputs().isEmpty());
        }
    }

    @Test
    void lastWriteWinsByDefault() {
        var instance = conflictingWrites();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertTrue(result.success());
            assertEquals(Map.of("x", "second"), result.outputs());
            assertTrue(result.logs().stream().anyMatch(entry -> entry.level() == LogLevel.WARN
                && entry.message().contains("overwrites 'cacm.outputs.x' written by step 'first'")));
        }
    }

    @Test
    void rejectPolicyKeepsFirstValue() {
        var settings = OrchestratorSettings.builder().outputConflictPolicy(OutputConflictPolicy.REJECT).build();
        try (var orchestrator = orchestrator(settings)) {
            var result = orchestrator.run(conflictingWrites());
            assertFalse(result.success());
            assertEquals(Map.of("x", "first"), result.outputs());
            assertEquals(Optional.of(ErrorKind.OUTPUT_BINDING), result.report("second").orElseThrow().errorKind());
        }
    }

    @Test
    void sharedContextCarriesSideChannelState() {
        var instance = WorkflowInstance.builder("side-channel")
            .output("revenue")
            .step(WorkflowStep.builder("ingest", "context_writer")
                .input("revenue", 1200)
                .input("documentURI", "file:///acme.pdf")
                .input("documentType", "annualReport")
                .build())
            .step(WorkflowStep.builder("read", "context_reader")
                .input("keys", List.of("revenue"))
                .output("revenue", "cacm.outputs.revenue")
                .build())
            .build();
        var context = new SharedContext("side-channel", "session-1");
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance, context);
            assertTrue(result.success(), result.logLines().toString());
            assertSame(context, result.sharedContext());
            assertEquals(Map.of("revenue", 1200), result.outputs());
            assertEquals("file:///acme.pdf", context.getDocumentReference("annualReport").orElseThrow());
        }
    }

    @Test
    void workerStateCarriesAcrossRuns() {
        var instance = WorkflowInstance.builder("counting")
            .output("total")
            .step(WorkflowStep.builder("add", EngineTestSupport.COUNTING)
                .input("amount", 5)
                .output("total", "cacm.outputs.total")
                .build())
            .build();
        try (var orchestrator = orchestrator()) {
            orchestrator.run(instance);
            var second = orchestrator.run(instance);
            assertEquals(Map.of("total", 10), second.outputs());
            assertEquals(10, second.sharedContext().getData("runningTotal").orElseThrow());
        }
    }

    @Test
    void delegationCycleFailsWithDelegationKind() {
        var instance = WorkflowInstance.builder("delegation")
            .step(WorkflowStep.builder("loop", "delegating").input("delegateTo", "delegating").build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertEquals(Optional.of(ErrorKind.DELEGATION), result.report("loop").orElseThrow().errorKind());
        }
    }

    @Test
    void emptyWorkflowSucceeds() {
        try (var orchestrator = new Orchestrator(CapabilityCatalog.empty(), EngineTestSupport.registry(), SkillService.none())) {
            var result = orchestrator.run(WorkflowInstance.builder("empty").build());
            assertTrue(result.success());
            assertTrue(result.stepReports().isEmpty());
        }
    }

    @Test
    void rejectPolicyCatchesParentAndChildWrites() {
        var settings = OrchestratorSettings.builder().outputConflictPolicy(OutputConflictPolicy.REJECT).build();
        try (var orchestrator = orchestrator(settings)) {
            var result = orchestrator.run(nestedWrites("cacm.outputs.report.summary", "cacm.outputs.report"));
            assertFalse(result.success());
            assertEquals(Map.of("report", Map.of("summary", "first")), result.outputs());
            var second = result.report("second").orElseThrow();
            assertEquals(StepState.FAILED, second.state());
            assertEquals(Optional.of(ErrorKind.OUTPUT_BINDING), second.errorKind());

            var reversed = orchestrator.run(nestedWrites("cacm.outputs.report", "cacm.outputs.report.summary"));
            assertEquals(Map.of("report", "first"), reversed.outputs());
            assertEquals(Optional.of(ErrorKind.OUTPUT_BINDING), reversed.report("second").orElseThrow().errorKind());
        }
    }

    @Test
    void overlappingWriteWarnsUnderLastWriteWins() {
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(nestedWrites("cacm.outputs.report.summary", "cacm.outputs.report"));
            assertTrue(result.success(), result.logLines().toString());
            assertEquals(Map.of("report", "second"), result.outputs());
            assertTrue(result.logs().stream().anyMatch(entry -> entry.level() == LogLevel.WARN
                && entry.message().contains("overwrites 'cacm.outputs.report' (overlaps 'cacm.outputs.report.summary')")
                && entry.message().contains("written by step 'first'")));
        }
    }

    @Test
    void siblingPathsDoNotConflict() {
        var settings = OrchestratorSettings.builder().outputConflictPolicy(OutputConflictPolicy.REJECT).build();
        try (var orchestrator = orchestrator(settings)) {
            var result = orchestrator.run(nestedWrites("cacm.outputs.report.summary", "cacm.outputs.report.summaryText"));
            assertTrue(result.success(), result.logLines().toString());
            assertEquals(Map.of("report", Map.of("summary", "first", "summaryText", "second")), result.outputs());
        }
    }

    @Test
    void undeclaredInputFailsTheStepNotTheRun() {
        var instance = WorkflowInstance.builder("undeclared")
            .output("x")
            .step(WorkflowStep.builder("lookup", "echo").input("value", "cacm.inputs.ghost").build())
            .step(WorkflowStep.builder("after", "echo").input("value", "v").output("value", "cacm.outputs.x").build())
            .build();
        try (var orchestrator = orchestrator()) {
            var result = orchestrator.run(instance);
            assertEquals(RunState.DONE_PARTIAL_FAILURE, result.finalState());
            assertEquals(Optional.of(ErrorKind.UNRESOLVED_BINDING), result.report("lookup").orElseThrow().errorKind());
            assertEquals(Map.of("x", "v"), result.outputs());
            assertTrue(result.logs().stream().anyMatch(entry -> entry.level() == LogLevel.WARN
                && entry.message().contains("ghost")));
        }
    }

    @Test
    void catalogHintsReachWorkerFactories() {
        var ingest = CapabilityDescriptor.of("ingest", "context_writer").withHints(Map.of("keyPrefix", "ingested."));
        var forward = CapabilityDescriptor.of("forward", "delegating").withHints(Map.of("delegateTo", "echo"));
        var instance = WorkflowInstance.builder("hints")
            .output("stored")
            .output("echoed")
            .output("peer")
            .step(WorkflowStep.builder("store", "ingest")
                .input("revenue", 1200)
                .output("storedKeys", "cacm.outputs.stored")
                .build())
            .step(WorkflowStep.builder("relay", "forward")
                .input("value", "hi")
                .output("value", "cacm.outputs.echoed")
                .output("delegatedTo", "cacm.outputs.peer")
                .build())
            .build();
        try (var orchestrator = orchestrator(ingest, forward)) {
            var result = orchestrator.run(instance);
            assertTrue(result.success(), result.logLines().toString());
            assertEquals(List.of("ingested.revenue"), result.outputs().get("stored"));
            assertEquals(1200, result.sharedContext().getData("ingested.revenue").orElseThrow());
            assertEquals("hi", result.outputs().get("echoed"));
            assertEquals("echo", result.outputs().get("peer"));
        }
    }

    private static WorkflowInstance nestedWrites(String firstTarget, String secondTarget) {
        return WorkflowInstance.builder("nested")
            .output("report")
            .step(WorkflowStep.builder("first", "echo").input("value", "first").output("value", firstTarget).build())
            .step(WorkflowStep.builder("second", "echo").input("value", "second").output("value", secondTarget).build())
            .build();
    }

    private static WorkflowInstance conflictingWrites() {
        return WorkflowInstance.builder("conflict")
            .output("x")
            .step(WorkflowStep.builder("first", "echo").input("value", "first").output("value", "cacm.outputs.x").build())
            .step(WorkflowStep.builder("second", "echo").input("value", "second").output("value", "cacm.outputs.x").build())
            .build();
    }
}
