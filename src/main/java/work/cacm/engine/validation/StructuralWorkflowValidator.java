package work.cacm.engine.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import work.cacm.engine.binding.Binding;
import work.cacm.engine.binding.BindingParser;
import work.cacm.engine.binding.Namespace;
import work.cacm.engine.model.WorkflowInstance;
import work.cacm.engine.model.WorkflowStep;

/**
 * Default validator: required fields, step id uniqueness and reference integrity. It does not check value types.
 */
public final class StructuralWorkflowValidator implements WorkflowValidator {

    @Override
    public ValidationReport validate(WorkflowInstance instance) {
        List<ValidationError> errors = new ArrayList<>();
        if (instance == null) {
            errors.add(new ValidationError("$", "workflow instance is required"));
            return ValidationReport.of(errors);
        }
        if (instance.cacmId() == null || instance.cacmId().isBlank()) {
            errors.add(new ValidationError("cacmId", "'cacmId' is a required property"));
        }
        if (instance.workflow() == null) {
            errors.add(new ValidationError("workflow", "'workflow' is a required property"));
            return ValidationReport.of(errors);
        }

        var seenIds = new HashSet<String>();
        var steps = instance.workflow();
        for (int index = 0; index < steps.size(); index++) {
            validateStep(instance, steps.get(index), index, seenIds, errors);
        }
        return ValidationReport.of(errors);
    }

    private static void validateStep(WorkflowInstance instance, WorkflowStep step, int index, HashSet<String> seenIds,
                                     List<ValidationError> errors) {
        String prefix = "workflow[" + index + "]";
        if (step == null) {
            errors.add(new ValidationError(prefix, "step must be an object"));
            return;
        }
        if (step.stepId() == null || step.stepId().isBlank()) {
            errors.add(new ValidationError(prefix, "'stepId' is a required property"));
        } else if (!seenIds.add(step.stepId())) {
            errors.add(new ValidationError(prefix + ".stepId", "duplicate stepId '" + step.stepId() + "'"));
        }
        if (step.computeCapabilityRef() == null || step.computeCapabilityRef().isBlank()) {
            errors.add(new ValidationError(prefix, "'computeCapabilityRef' is a required property"));
        }

        for (Map.Entry<String, Object> entry : step.inputBindings().entrySet()) {
            var path = prefix + ".inputBindings." + entry.getKey();
            try {
                BindingParser.parse(entry.getValue());
            } catch (IllegalArgumentException ex) {
                errors.add(new ValidationError(path, ex.getMessage()));
            }
        }

        for (Map.Entry<String, String> entry : step.outputBindings().entrySet()) {
            var path = prefix + ".outputBindings." + entry.getKey();
            Binding.Reference target;
            try {
                target = BindingParser.parseReference(entry.getValue());
            } catch (IllegalArgumentException ex) {
                errors.add(new ValidationError(path, "target must be under cacm.outputs or intermediate: " + entry.getValue()));
                continue;
            }
            if (!target.namespace().writable()) {
                errors.add(new ValidationError(path, "target must be under cacm.outputs or intermediate: " + target.text()));
            } else if (target.namespace() == Namespace.OUTPUTS && !instance.outputs().containsKey(target.head())) {
                errors.add(new ValidationError(path, "target '" + target.text() + "' names undeclared output '"
                    + target.head() + "'"));
            }
        }
    }
}
