package work.cacm.engine.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.cacm.engine.model.WorkflowInstance;
import work.cacm.engine.model.WorkflowLoader;
import work.cacm.engine.model.WorkflowStep;

class StructuralWorkflowValidatorTest {
    private final StructuralWorkflowValidator validator = new StructuralWorkflowValidator();

    private static List<String> paths(ValidationReport report) {
        return report.errors().stream().map(ValidationError::path).toList();
    }

    @Test
    void acceptsWellFormedWorkflow() {
        var instance = WorkflowLoader.load(Path.of("src", "test", "resources", "workflows", "echo-chain.json"));
        var report = validator.validate(instance);
        assertTrue(report.valid(), report.errors().toString());
        assertTrue(report.errors().isEmpty());
    }

    @Test
    void reportsMissingIdsWithPaths() {
        var instance = WorkflowLoader.load(Path.of("src", "test", "resources", "workflows", "invalid.json"));
        var report = validator.validate(instance);
        assertFalse(report.valid());
        assertEquals(List.of("cacmId", "workflow[0]", "workflow[1].outputBindings.value"), paths(report));
        assertEquals("'stepId' is a required property", report.errors().get(1).message());
    }

    @Test
    void requiresWorkflowList() {
        var report = validator.validate(WorkflowInstance.builder("c1").noWorkflow().build());
        assertEquals(List.of("workflow"), paths(report));
    }

    @Test
    void rejectsDuplicateStepIdsAndMissingCapability() {
        var instance = WorkflowInstance.builder("c1")
            .step(WorkflowStep.builder("s1", "echo").build())
            .step(WorkflowStep.builder("s1", " ").build())
            .build();
        var report = validator.validate(instance);
        assertEquals(List.of("workflow[1].stepId", "workflow[1]"), paths(report));
    }

    @Test
    void checksBindingReferences() {
        var instance = WorkflowInstance.builder("c1")
            .input("declared", "value")
            .output("x")
            .step(WorkflowStep.builder("s1", "echo")
                .input("ok", "cacm.inputs.declared")
                .input("undeclared", "cacm.inputs.ghost")
                .input("malformed", "intermediate.")
                .input("literal", "just text")
                .output("a", "cacm.outputs.x")
                .output("b", "intermediate.scratch.value")
                .output("c", "cacm.inputs.declared")
                .output("d", "plain")
                .build())
            .build();
        var report = validator.validate(instance);
        assertEquals(List.of(
            "workflow[0].inputBindings.malformed",
            "workflow[0].outputBindings.c",
            "workflow[0].outputBindings.d"
        ), paths(report));
    }
}
