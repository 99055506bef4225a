package work.cacm.engine.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one worker call.
 *
 * <p>{@link Success} and {@link Partial} expose result fields that output bindings copy into the run's namespaces;
 * {@link Error} marks the step failed and its fields are informational only.
 *
 * <pre>{@code
 * if (result instanceof WorkerResult.Partial partial) {
 *     partial.warnings().forEach(log::warn);
 * }
 * }</pre>
 */
public sealed interface WorkerResult permits WorkerResult.Success, WorkerResult.Error, WorkerResult.Partial {

    String message();

    Map<String, Object> fields();

    /**
     * @return {@code success}, {@code error} or {@code partial}
     */
    String status();

    default Optional<Object> field(String name) {
        return Optional.ofNullable(fields().get(name));
    }

    default boolean hasField(String name) {
        return fields().containsKey(name);
    }

    /**
     * Flat rendering {@code {status, message, ...fields}}; fields never override the two reserved keys.
     */
    default Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status());
        map.put("message", message());
        fields().forEach(map::putIfAbsent);
        if (this instanceof Partial partial && !partial.warnings().isEmpty()) {
            map.putIfAbsent("warnings", partial.warnings());
        }
        return map;
    }

    static Success success(Map<String, ?> fields) {
        return new Success("", copy(fields));
    }

    static Success success(String message, Map<String, ?> fields) {
        return new Success(message, copy(fields));
    }

    static Error error(String message) {
        return new Error(message, Map.of());
    }

    static Error error(String message, Map<String, ?> fields) {
        return new Error(message, copy(fields));
    }

    static Error from(Throwable cause) {
        var message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new Error(message, Map.of("exception", cause.getClass().getName()));
    }

    static Partial partial(String message, Map<String, ?> fields, List<String> warnings) {
        return new Partial(message, copy(fields), warnings);
    }

    record Success(String message, Map<String, Object> fields) implements WorkerResult {
        public Success {
            message = message == null ? "" : message;
            fields = copy(fields);
        }

        @Override
        public String status() {
            return "success";
        }
    }

    record Error(String message, Map<String, Object> fields) implements WorkerResult {
        public Error {
            Objects.requireNonNull(message, "message");
            fields = copy(fields);
        }

        @Override
        public String status() {
            return "error";
        }
    }

    record Partial(String message, Map<String, Object> fields, List<String> warnings) implements WorkerResult {
        public Partial {
            message = message == null ? "" : message;
            fields = copy(fields);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        @Override
        public String status() {
            return "partial";
        }
    }

    private static Map<String, Object> copy(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        // LinkedHashMap keeps field order and tolerates null values
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
