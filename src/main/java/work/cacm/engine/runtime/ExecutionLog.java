package work.cacm.engine.runtime;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, structured log of one run. Every entry is mirrored to SLF4J at the matching level.
 */
public final class ExecutionLog {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLog.class);

    private final List<LogEntry> entries = new CopyOnWriteArrayList<>();

    public LogEntry info(String source, String message) {
        return append(LogLevel.INFO, source, message);
    }

    public LogEntry warn(String source, String message) {
        return append(LogLevel.WARN, source, message);
    }

    public LogEntry error(String source, String message) {
        return append(LogLevel.ERROR, source, message);
    }

    public LogEntry append(LogLevel level, String source, String message) {
        var entry = new LogEntry(level, source, message, Instant.now());
        entries.add(entry);
        switch (level) {
            case INFO -> log.info("{}: {}", entry.source(), entry.message());
            case WARN -> log.warn("{}: {}", entry.source(), entry.message());
            case ERROR -> log.error("{}: {}", entry.source(), entry.message());
        }
        return entry;
    }

    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    public List<String> lines() {
        return entries.stream().map(LogEntry::toString).toList();
    }
}
