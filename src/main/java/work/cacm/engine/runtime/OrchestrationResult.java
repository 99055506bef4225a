package work.cacm.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.shared.Values;

/**
 * Aggregate outcome of one run. {@code outputs} holds every {@code cacm.outputs.*} value bound before the run ended,
 * including those bound before a failure.
 */
public record OrchestrationResult(
    boolean success,
    List<LogEntry> logs,
    Map<String, Object> outputs,
    Map<String, Object> intermediates,
    List<StepReport> stepReports,
    RunState finalState,
    SharedContext sharedContext
) {
    public OrchestrationResult {
        logs = logs == null ? List.of() : List.copyOf(logs);
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(Values.copyMap(outputs));
        intermediates = intermediates == null ? Map.of() : Collections.unmodifiableMap(Values.copyMap(intermediates));
        stepReports = stepReports == null ? List.of() : List.copyOf(stepReports);
    }

    public List<String> logLines() {
        return logs.stream().map(LogEntry::toString).toList();
    }

    public Optional<StepReport> report(String stepId) {
        return stepReports.stream().filter(report -> report.stepId() != null && report.stepId().equals(stepId)).findFirst();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", success);
        map.put("finalState", finalState.name());
        map.put("outputs", outputs);
        map.put("steps", stepReports.stream().map(StepReport::toMap).toList());
        map.put("logs", logLines());
        if (sharedContext != null) {
            map.put("sessionId", sharedContext.sessionId());
        }
        return map;
    }
}
