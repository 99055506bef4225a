package work.cacm.engine.worker.builtin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.worker.AbstractWorker;
import work.cacm.engine.worker.WorkerResult;

/**
 * Returns the data store entries named by the {@code keys} input, a list or a comma separated string.
 */
public final class ContextReaderWorker extends AbstractWorker {
    static final String KEYS = "keys";

    public ContextReaderWorker(String name) {
        super(name);
    }

    @Override
    public WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) {
        var keys = keys(inputs.get(KEYS));
        if (keys.isEmpty()) {
            return WorkerResult.error("Input '" + KEYS + "' is required");
        }
        var fields = new LinkedHashMap<String, Object>();
        var missing = new ArrayList<String>();
        for (var key : keys) {
            context.getData(key).ifPresentOrElse(value -> fields.put(key, value), () -> missing.add(key));
        }
        if (missing.isEmpty()) {
            return WorkerResult.success("Read " + fields.size() + " key(s)", fields);
        }
        log.warn("Keys absent from shared context: {}", missing);
        fields.put("missingKeys", List.copyOf(missing));
        var warnings = missing.stream().map(key -> "Key '" + key + "' not found in shared context").toList();
        return WorkerResult.partial("Read " + (keys.size() - missing.size()) + " of " + keys.size() + " key(s)", fields, warnings);
    }

    private static List<String> keys(Object raw) {
        if (raw instanceof List<?> list) {
            return list.stream().filter(item -> item != null).map(String::valueOf).toList();
        }
        if (raw instanceof String str && !str.isBlank()) {
            return Arrays.stream(str.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        return List.of();
    }
}
