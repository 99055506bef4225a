package work.cacm.engine.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cacm.engine.shared.Values;

/**
 * Resolves {@link Binding}s against a {@link BindingScope}.
 *
 * <p>Literals resolve to themselves. A reference walks its namespace one segment at a time through objects and list
 * indices. {@code cacm.inputs.NAME} alone yields the declaration's {@code value}; a longer path walks the declaration
 * object itself, e.g. {@code cacm.inputs.params.value.clientId}. Resolved values are copies, so resolving twice against
 * an unchanged scope yields equal values and workers cannot mutate the scope through them.
 */
public final class BindingResolver {
    static final String INPUT_VALUE_KEY = "value";

    private BindingResolver() {}

    /**
     * @throws UnresolvedBindingException when a segment is missing
     */
    public static Object resolve(Binding binding, BindingScope scope) {
        if (binding instanceof Binding.Literal literal) {
            return Values.deepCopy(literal.value());
        }
        var reference = (Binding.Reference) binding;
        var root = scope.root(reference.namespace());
        if (reference.namespace() == Namespace.INPUTS && reference.segments().size() == 1) {
            return Values.deepCopy(inputValue(reference, root));
        }
        return Values.deepCopy(walk(reference, root, reference.segments()));
    }

    /**
     * Resolves every entry of a step's input bindings. Unresolved or malformed entries are bound to
     * {@link MissingValue#INSTANCE} and reported in {@link Resolution#unresolved()}.
     */
    public static Resolution resolveAll(Map<String, Object> bindings, BindingScope scope) {
        var values = new LinkedHashMap<String, Object>();
        var unresolved = new LinkedHashMap<String, UnresolvedBindingException>();
        if (bindings != null) {
            for (var entry : bindings.entrySet()) {
                try {
                    values.put(entry.getKey(), resolve(BindingParser.parse(entry.getValue()), scope));
                } catch (UnresolvedBindingException ex) {
                    values.put(entry.getKey(), MissingValue.INSTANCE);
                    unresolved.put(entry.getKey(), ex);
                } catch (IllegalArgumentException ex) {
                    values.put(entry.getKey(), MissingValue.INSTANCE);
                    unresolved.put(entry.getKey(), new UnresolvedBindingException(
                        String.valueOf(entry.getValue()), "", ex.getMessage()));
                }
            }
        }
        return new Resolution(values, unresolved);
    }

    private static Object inputValue(Binding.Reference reference, Map<String, Object> inputs) {
        if (!inputs.containsKey(reference.head())) {
            throw new UnresolvedBindingException(reference.text(), reference.head());
        }
        var declaration = inputs.get(reference.head());
        var declarationMap = Values.asMap(declaration);
        if (declarationMap == null) {
            return declaration;
        }
        if (!declarationMap.containsKey(INPUT_VALUE_KEY)) {
            throw new UnresolvedBindingException(reference.text(), INPUT_VALUE_KEY);
        }
        return declarationMap.get(INPUT_VALUE_KEY);
    }

    private static Object walk(Binding.Reference reference, Object root, List<String> segments) {
        Object current = root;
        for (var segment : segments) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    throw new UnresolvedBindingException(reference.text(), segment);
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(segment);
                if (index < 0 || index >= list.size()) {
                    throw new UnresolvedBindingException(reference.text(), segment);
                }
                current = list.get(index);
            } else {
                throw new UnresolvedBindingException(reference.text(), segment);
            }
        }
        return current;
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    /**
     * Outcome of {@link #resolveAll}: resolved inputs in binding order plus the failures keyed by input name.
     */
    public record Resolution(Map<String, Object> values, Map<String, UnresolvedBindingException> unresolved) {
        public Resolution {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
        }

        public boolean complete() {
            return unresolved.isEmpty();
        }
    }
}
