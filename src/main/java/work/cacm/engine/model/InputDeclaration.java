package work.cacm.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.cacm.engine.shared.Values;

/**
 * A declared workflow input. The whole declaration object is kept because bindings may walk into it
 * ({@code cacm.inputs.params.value.clientId}); {@code value} is the payload a plain {@code cacm.inputs.params}
 * reference yields.
 */
public record InputDeclaration(Map<String, Object> attributes) {
    public static final String VALUE = "value";
    public static final String TYPE = "type";
    public static final String DESCRIPTION = "description";

    public InputDeclaration {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(Values.copyMap(attributes));
    }

    public static InputDeclaration of(Object value) {
        var attributes = new LinkedHashMap<String, Object>();
        attributes.put(VALUE, value);
        return new InputDeclaration(attributes);
    }

    public static InputDeclaration of(Object value, String type) {
        var attributes = new LinkedHashMap<String, Object>();
        attributes.put(VALUE, value);
        attributes.put(TYPE, type);
        return new InputDeclaration(attributes);
    }

    public boolean hasValue() {
        return attributes.containsKey(VALUE);
    }

    public Object value() {
        return attributes.get(VALUE);
    }

    public Optional<String> type() {
        return attributes.get(TYPE) instanceof String type ? Optional.of(type) : Optional.empty();
    }

    public String description() {
        return attributes.get(DESCRIPTION) instanceof String description ? description : "";
    }

    public Map<String, Object> asMap() {
        return Values.copyMap(attributes);
    }
}
