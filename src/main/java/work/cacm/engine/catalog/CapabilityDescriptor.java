package work.cacm.engine.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog entry for one compute capability. Declared inputs/outputs document the capability and are not enforced at runtime.
 *
 * @param hints construction hints passed to the worker factory the first time the capability's worker type is created
 */
public record CapabilityDescriptor(
    String id,
    String workerType,
    Optional<String> defaultSkill,
    String name,
    String description,
    List<String> inputs,
    List<String> outputs,
    Map<String, Object> hints
) {
    public CapabilityDescriptor {
        Objects.requireNonNull(id, "id");
        workerType = workerType == null || workerType.isBlank() ? id : workerType;
        defaultSkill = defaultSkill == null ? Optional.empty() : defaultSkill.filter(skill -> !skill.isBlank());
        name = name == null ? id : name;
        description = description == null ? "" : description;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        hints = hints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hints));
    }

    public static CapabilityDescriptor of(String id, String workerType) {
        return new CapabilityDescriptor(id, workerType, Optional.empty(), null, null, List.of(), List.of(), Map.of());
    }

    public static CapabilityDescriptor of(String id, String workerType, String defaultSkill) {
        return new CapabilityDescriptor(id, workerType, Optional.ofNullable(defaultSkill), null, null, List.of(), List.of(), Map.of());
    }

    public CapabilityDescriptor withHints(Map<String, Object> hints) {
        return new CapabilityDescriptor(id, workerType, defaultSkill, name, description, inputs, outputs, hints);
    }
}
