package work.cacm.engine.runtime;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the execution log returned to callers.
 */
public record LogEntry(LogLevel level, String source, String message, Instant timestamp) {
    public LogEntry {
        Objects.requireNonNull(level, "level");
        source = source == null ? "" : source;
        message = message == null ? "" : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    @Override
    public String toString() {
        return level + ": " + source + ": " + message;
    }
}
