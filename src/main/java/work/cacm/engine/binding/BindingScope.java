package work.cacm.engine.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.cacm.engine.shared.Values;

/**
 * The namespaces visible to a run: declared inputs (read-only) plus the outputs and intermediates accumulated so far.
 *
 * <p>Values written by a step are visible to every step that resolves after it and to nothing before it. The scope also
 * remembers which writer last touched each target path so callers can apply a conflict policy to overlapping writes.
 */
public final class BindingScope {
    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs = new LinkedHashMap<>();
    private final Map<String, Object> intermediate = new LinkedHashMap<>();
    private final Map<String, String> writers = new LinkedHashMap<>();

    /**
     * @param inputs declared inputs keyed by name; each value is normally a declaration object carrying {@code value}
     */
    public BindingScope(Map<String, ?> inputs) {
        this.inputs = Collections.unmodifiableMap(Values.copyMap(inputs));
    }

    public Object resolve(Object rawBinding) {
        return BindingResolver.resolve(BindingParser.parse(rawBinding), this);
    }

    Map<String, Object> root(Namespace namespace) {
        return switch (namespace) {
            case INPUTS -> inputs;
            case OUTPUTS -> outputs;
            case INTERMEDIATE -> intermediate;
        };
    }

    public Optional<String> lastWriter(Binding.Reference target) {
        return Optional.ofNullable(writers.get(target.text()));
    }

    /**
     * The most recent write by another writer to {@code target}, to a path inside it, or to a path containing it.
     */
    public Optional<PriorWrite> conflictingWrite(Binding.Reference target, String writer) {
        PriorWrite found = null;
        for (var entry : writers.entrySet()) {
            if (!entry.getValue().equals(writer) && overlaps(entry.getKey(), target.text())) {
                found = new PriorWrite(entry.getKey(), entry.getValue());
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Writes {@code value} at {@code target}, creating intermediate objects as needed.
     *
     * @throws IllegalArgumentException when the target is in the read-only inputs namespace
     * @throws IllegalStateException when a path segment already holds a non-object value
     */
    public void write(Binding.Reference target, Object value, String writer) {
        if (!target.namespace().writable()) {
            throw new IllegalArgumentException("Cannot write into " + target.namespace().root() + ": " + target.text());
        }
        Map<String, Object> current = root(target.namespace());
        var segments = target.segments();
        for (int i = 0; i < segments.size() - 1; i++) {
            var segment = segments.get(i);
            var next = current.get(segment);
            if (next == null) {
                var created = new LinkedHashMap<String, Object>();
                current.put(segment, created);
                current = created;
            } else if (Values.asMap(next) != null) {
                current = Values.asMap(next);
            } else {
                throw new IllegalStateException("Cannot write '" + target.text() + "': segment '" + segment + "' holds a "
                    + Values.typeName(next));
            }
        }
        current.put(segments.get(segments.size() - 1), Values.deepCopy(value));
        var path = target.text();
        // replaced sub-paths no longer hold what their writers wrote
        writers.keySet().removeIf(written -> written.startsWith(path + "."));
        writers.remove(path);
        writers.put(path, writer);
    }

    private static boolean overlaps(String written, String target) {
        return written.equals(target) || written.startsWith(target + ".") || target.startsWith(written + ".");
    }

    public Map<String, Object> outputs() {
        return Values.copyMap(outputs);
    }

    public Map<String, Object> intermediates() {
        return Values.copyMap(intermediate);
    }

    public Map<String, Object> inputs() {
        return inputs;
    }

    /**
     * A target path recorded by {@link #write} together with the writer that wrote it.
     */
    public record PriorWrite(String path, String writer) {}
}
