package work.cacm.engine.validation;

import java.util.Objects;

/**
 * A single validation error. {@code path} locates the offending node, e.g. {@code workflow[0].stepId}.
 */
public record ValidationError(String path, String message) {
    public ValidationError {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
