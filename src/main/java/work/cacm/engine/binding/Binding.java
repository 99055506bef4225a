package work.cacm.engine.binding;

import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a step binding: either a path into one of the {@link Namespace}s or a literal value.
 */
public sealed interface Binding permits Binding.Reference, Binding.Literal {

    /**
     * A dotted path such as {@code cacm.inputs.params.value.clientId}: namespace {@code INPUTS}, segments
     * {@code [params, value, clientId]}.
     */
    record Reference(Namespace namespace, List<String> segments) implements Binding {
        public Reference {
            Objects.requireNonNull(namespace, "namespace");
            segments = List.copyOf(segments);
            if (segments.isEmpty()) {
                throw new IllegalArgumentException("Reference into " + namespace.root() + " needs at least one segment");
            }
        }

        public String head() {
            return segments.get(0);
        }

        public List<String> tail() {
            return segments.subList(1, segments.size());
        }

        public String text() {
            return namespace.prefix() + String.join(".", segments);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    /**
     * A value bound as-is, including non-string values and strings without a recognized prefix.
     */
    record Literal(Object value) implements Binding {
    }
}
