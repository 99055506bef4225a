package work.cacm.engine.validation;

import java.util.List;

public record ValidationReport(boolean valid, List<ValidationError> errors) {
    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A valid report cannot carry errors");
        }
    }

    public static ValidationReport ok() {
        return new ValidationReport(true, List.of());
    }

    public static ValidationReport of(List<ValidationError> errors) {
        return new ValidationReport(errors == null || errors.isEmpty(), errors);
    }
}
