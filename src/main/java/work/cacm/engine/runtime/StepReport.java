package work.cacm.engine.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cacm.engine.shared.ErrorKind;

/**
 * Final state of one step. {@code errorKind} is present only for {@link StepState#FAILED} steps.
 */
public record StepReport(
    String stepId,
    String capabilityRef,
    StepState state,
    Optional<ErrorKind> errorKind,
    String message,
    List<String> warnings,
    Duration elapsed
) {
    public StepReport {
        errorKind = errorKind == null ? Optional.empty() : errorKind;
        message = message == null ? "" : message;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static StepReport captured(String stepId, String capabilityRef, String message, List<String> warnings, Duration elapsed) {
        return new StepReport(stepId, capabilityRef, StepState.CAPTURED, Optional.empty(), message, warnings, elapsed);
    }

    public static StepReport failed(String stepId, String capabilityRef, ErrorKind kind, String message, List<String> warnings,
                                    Duration elapsed) {
        return new StepReport(stepId, capabilityRef, StepState.FAILED, Optional.of(kind), message, warnings, elapsed);
    }

    public static StepReport skipped(String stepId, String capabilityRef, String message) {
        return new StepReport(stepId, capabilityRef, StepState.SKIPPED, Optional.empty(), message, List.of(), Duration.ZERO);
    }

    public boolean failed() {
        return state == StepState.FAILED;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("stepId", stepId);
        map.put("capabilityRef", capabilityRef);
        map.put("state", state.name());
        errorKind.ifPresent(kind -> map.put("errorKind", kind.name()));
        map.put("message", message);
        if (!warnings.isEmpty()) {
            map.put("warnings", warnings);
        }
        map.put("elapsedMs", elapsed.toMillis());
        return map;
    }
}
