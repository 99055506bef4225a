package work.cacm.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow.
 *
 * @param inputBindings input name to a reference string ({@code cacm.inputs.*}, {@code cacm.outputs.*},
 *     {@code intermediate.*}) or a literal value
 * @param outputBindings worker result field to a target under {@code cacm.outputs.*} or {@code intermediate.*}
 * @param required when true a failure of this step skips every later step
 * @param allowMissingInputs when true unresolved inputs are passed to the worker as the missing sentinel instead of
 *     failing the step
 */
public record WorkflowStep(
    String stepId,
    String description,
    String computeCapabilityRef,
    Map<String, Object> inputBindings,
    Map<String, String> outputBindings,
    boolean required,
    boolean allowMissingInputs
) {
    public WorkflowStep {
        description = description == null ? "" : description;
        inputBindings = inputBindings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputBindings));
        outputBindings = outputBindings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputBindings));
    }

    public static Builder builder(String stepId, String computeCapabilityRef) {
        return new Builder(stepId, computeCapabilityRef);
    }

    public static final class Builder {
        private final String stepId;
        private final String computeCapabilityRef;
        private String description = "";
        private final Map<String, Object> inputBindings = new LinkedHashMap<>();
        private final Map<String, String> outputBindings = new LinkedHashMap<>();
        private boolean required;
        private boolean allowMissingInputs;

        private Builder(String stepId, String computeCapabilityRef) {
            this.stepId = stepId;
            this.computeCapabilityRef = computeCapabilityRef;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String name, Object binding) {
            inputBindings.put(name, binding);
            return this;
        }

        public Builder output(String field, String target) {
            outputBindings.put(field, target);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder allowMissingInputs(boolean allowMissingInputs) {
            this.allowMissingInputs = allowMissingInputs;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(stepId, description, computeCapabilityRef, inputBindings, outputBindings, required,
                allowMissingInputs);
        }
    }
}
