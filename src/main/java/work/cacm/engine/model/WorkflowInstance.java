package work.cacm.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cacm.engine.shared.Values;

/**
 * A parsed workflow document. Immutable; collections are copied on construction.
 *
 * <p>{@code workflow} is {@code null} when the document has no {@code workflow} entry at all, which the validator
 * reports; an empty list is a valid workflow that does nothing.
 */
public record WorkflowInstance(
    String cacmId,
    String name,
    String version,
    String description,
    Map<String, InputDeclaration> inputs,
    Map<String, OutputDeclaration> outputs,
    List<WorkflowStep> workflow,
    Map<String, Object> metadata
) {
    public WorkflowInstance {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        workflow = workflow == null ? null : Collections.unmodifiableList(new ArrayList<>(workflow));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(Values.copyMap(metadata));
    }

    public List<WorkflowStep> steps() {
        return workflow == null ? List.of() : workflow;
    }

    /**
     * Declared inputs as the raw declaration objects bindings resolve against.
     */
    public Map<String, Object> inputScope() {
        var scope = new LinkedHashMap<String, Object>();
        inputs.forEach((key, declaration) -> scope.put(key, declaration == null ? null : declaration.asMap()));
        return scope;
    }

    public static Builder builder(String cacmId) {
        return new Builder(cacmId);
    }

    public static final class Builder {
        private final String cacmId;
        private String name;
        private String version;
        private String description;
        private final Map<String, InputDeclaration> inputs = new LinkedHashMap<>();
        private final Map<String, OutputDeclaration> outputs = new LinkedHashMap<>();
        private List<WorkflowStep> workflow = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String cacmId) {
            this.cacmId = cacmId;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String inputName, InputDeclaration declaration) {
            inputs.put(inputName, declaration);
            return this;
        }

        public Builder input(String inputName, Object value) {
            return input(inputName, InputDeclaration.of(value));
        }

        public Builder output(String outputName) {
            return output(outputName, OutputDeclaration.of(null));
        }

        public Builder output(String outputName, OutputDeclaration declaration) {
            outputs.put(outputName, declaration);
            return this;
        }

        public Builder step(WorkflowStep step) {
            if (workflow == null) {
                workflow = new ArrayList<>();
            }
            workflow.add(step);
            return this;
        }

        public Builder noWorkflow() {
            this.workflow = null;
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public WorkflowInstance build() {
            return new WorkflowInstance(cacmId, name, version, description, inputs, outputs, workflow, metadata);
        }
    }
}
