package work.cacm.engine.shared;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed map/list values that flow between steps.
 */
public final class Values {
    private Values() {}

    /**
     * Copies nested maps and lists so a consumer cannot mutate the producer's structure. Leaf values are shared.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    public static Map<String, Object> copyMap(Map<String, ?> source) {
        var copy = new LinkedHashMap<String, Object>();
        if (source != null) {
            for (var entry : source.entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
        }
        return copy;
    }

    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
