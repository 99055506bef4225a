package work.cacm.engine.binding;

import java.util.Arrays;

/**
 * Turns raw binding values from a workflow document into {@link Binding}s.
 */
public final class BindingParser {
    private BindingParser() {}

    /**
     * @throws IllegalArgumentException when a recognized prefix is followed by an empty segment
     */
    public static Binding parse(Object raw) {
        if (!(raw instanceof String text)) {
            return new Binding.Literal(raw);
        }
        var namespace = Namespace.match(text);
        if (namespace.isEmpty()) {
            return new Binding.Literal(text);
        }
        var path = text.substring(namespace.get().prefix().length());
        var segments = path.split("\\.", -1);
        for (var segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Malformed reference '" + text + "': empty path segment");
            }
        }
        return new Binding.Reference(namespace.get(), Arrays.asList(segments));
    }

    /**
     * Parses {@code raw} and requires it to be a reference, as output binding targets must be.
     */
    public static Binding.Reference parseReference(Object raw) {
        var binding = parse(raw);
        if (binding instanceof Binding.Reference reference) {
            return reference;
        }
        throw new IllegalArgumentException("Not a namespace reference: " + raw);
    }
}
