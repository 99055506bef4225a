package work.cacm.engine.worker.builtin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cacm.engine.binding.MissingValue;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.shared.ErrorKind;
import work.cacm.engine.shared.Values;
import work.cacm.engine.skill.SkillInvocationException;
import work.cacm.engine.worker.AbstractWorker;
import work.cacm.engine.worker.WorkerResult;

/**
 * Calls a skill with the step inputs as named arguments.
 *
 * <p>The skill is taken from the {@code skill} input, else from the default skill of the capability being served, else
 * from the capability the worker was built for. A map payload becomes the result fields; any other payload is returned
 * as {@code result}. A payload carrying a non-empty {@code errors} entry is a partial result.
 */
public final class SkillWorker extends AbstractWorker {
    static final String SKILL_INPUT = "skill";
    static final String RESULT_FIELD = "result";
    static final String ERRORS_FIELD = "errors";

    private final String fallbackSkill;

    public SkillWorker(String name, String fallbackSkill) {
        super(name);
        this.fallbackSkill = fallbackSkill;
    }

    @Override
    public WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) {
        var skill = skillFor(inputs);
        if (skill == null) {
            return WorkerResult.error("No skill configured for task '" + task + "'");
        }
        var arguments = new LinkedHashMap<String, Object>();
        inputs.forEach((key, value) -> {
            if (!SKILL_INPUT.equals(key) && !MissingValue.isMissing(value)) {
                arguments.put(key, value);
            }
        });
        Object payload;
        try {
            payload = skills().invoke(skill, arguments);
        } catch (SkillInvocationException ex) {
            log.error("Skill {} failed: {}", skill, ex.getMessage());
            return WorkerResult.error(ex.getMessage(), Map.of("errorKind", ErrorKind.SKILL_INVOCATION.name(), "skill", skill));
        }
        var map = Values.asMap(payload);
        if (map == null) {
            var fields = new LinkedHashMap<String, Object>();
            fields.put(RESULT_FIELD, payload);
            return WorkerResult.success("Skill " + skill + " completed", fields);
        }
        var warnings = errors(map.get(ERRORS_FIELD));
        if (!warnings.isEmpty()) {
            log.warn("Skill {} reported {} error(s)", skill, warnings.size());
            return WorkerResult.partial("Skill " + skill + " completed with errors", map, warnings);
        }
        return WorkerResult.success("Skill " + skill + " completed", map);
    }

    private String skillFor(Map<String, Object> inputs) {
        if (inputs.get(SKILL_INPUT) instanceof String requested && !requested.isBlank()) {
            return requested;
        }
        return currentCapability()
            .flatMap(descriptor -> descriptor.defaultSkill())
            .orElse(fallbackSkill);
    }

    private static List<String> errors(Object raw) {
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (raw instanceof Map<?, ?> map) {
            return map.entrySet().stream().map(entry -> entry.getKey() + ": " + entry.getValue()).toList();
        }
        if (raw instanceof String str && !str.isBlank()) {
            return List.of(str);
        }
        return List.of();
    }
}
