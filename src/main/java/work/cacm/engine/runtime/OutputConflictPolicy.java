package work.cacm.engine.runtime;

import java.util.Locale;

/**
 * What happens when a step binds an output to a target path an earlier step already wrote.
 */
public enum OutputConflictPolicy {
    /** Overwrite and log a warning. */
    LAST_WRITE_WINS,
    /** Keep the first value and fail the later step. */
    REJECT;

    public static OutputConflictPolicy parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LAST_WRITE_WINS;
        }
        var normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown output conflict policy: " + raw, ex);
        }
    }
}
