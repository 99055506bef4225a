package work.cacm.engine.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps JSON or YAML workflow documents onto {@link WorkflowInstance}.
 *
 * <p>Mapping is lenient: absent or mistyped fields become {@code null} or empty and are left for the validator to
 * report with their path. Only unreadable or syntactically broken documents fail here.
 */
public final class WorkflowLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private WorkflowLoader() {}

    public static WorkflowInstance load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new WorkflowLoadException("Workflow file not found: " + path);
        }
        var fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        var mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in));
        } catch (IOException ex) {
            throw new WorkflowLoadException("Failed to parse workflow " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Parses an in-memory document. YAML is a superset of JSON, so both are accepted.
     */
    public static WorkflowInstance parse(String document) {
        if (document == null || document.isBlank()) {
            throw new WorkflowLoadException("Workflow document is empty");
        }
        try {
            return fromTree(YAML_MAPPER.readTree(document));
        } catch (IOException ex) {
            throw new WorkflowLoadException("Failed to parse workflow document: " + ex.getMessage(), ex);
        }
    }

    public static WorkflowInstance fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new WorkflowLoadException("Workflow document must be an object");
        }
        return new WorkflowInstance(
            text(root, "cacmId"),
            text(root, "name"),
            text(root, "version"),
            text(root, "description"),
            inputs(root.get("inputs")),
            outputs(root.get("outputs")),
            steps(root.get("workflow")),
            toMap(root.get("metadata"))
        );
    }

    private static Map<String, InputDeclaration> inputs(JsonNode node) {
        var inputs = new LinkedHashMap<String, InputDeclaration>();
        if (node == null || !node.isObject()) {
            return inputs;
        }
        node.fields().forEachRemaining(entry -> {
            var value = entry.getValue();
            if (value.isObject()) {
                inputs.put(entry.getKey(), new InputDeclaration(toMap(value)));
            } else {
                inputs.put(entry.getKey(), InputDeclaration.of(toValue(value)));
            }
        });
        return inputs;
    }

    private static Map<String, OutputDeclaration> outputs(JsonNode node) {
        var outputs = new LinkedHashMap<String, OutputDeclaration>();
        if (node == null || !node.isObject()) {
            return outputs;
        }
        node.fields().forEachRemaining(entry -> {
            var value = entry.getValue();
            outputs.put(entry.getKey(), new OutputDeclaration(
                text(value, "type"),
                text(value, "description"),
                value.path("optional").asBoolean(false)
            ));
        });
        return outputs;
    }

    private static List<WorkflowStep> steps(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        var steps = new ArrayList<WorkflowStep>();
        if (!node.isArray()) {
            return steps;
        }
        for (var stepNode : node) {
            steps.add(new WorkflowStep(
                text(stepNode, "stepId"),
                text(stepNode, "description"),
                text(stepNode, "computeCapabilityRef"),
                toMap(stepNode.get("inputBindings")),
                outputBindings(stepNode.get("outputBindings")),
                stepNode.path("required").asBoolean(false),
                stepNode.path("allowMissingInputs").asBoolean(false)
            ));
        }
        return steps;
    }

    private static Map<String, String> outputBindings(JsonNode node) {
        var bindings = new LinkedHashMap<String, String>();
        if (node == null || !node.isObject()) {
            return bindings;
        }
        node.fields().forEachRemaining(entry -> bindings.put(entry.getKey(),
            entry.getValue().isValueNode() ? entry.getValue().asText() : entry.getValue().toString()));
        return bindings;
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>(JSON_MAPPER.convertValue(node, MAP_REF));
    }

    private static Object toValue(JsonNode node) {
        return node == null || node.isNull() ? null : JSON_MAPPER.convertValue(node, Object.class);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field);
        return value.isValueNode() ? value.asText() : null;
    }
}
