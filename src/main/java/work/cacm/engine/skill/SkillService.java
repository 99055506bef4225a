package work.cacm.engine.skill;

import java.util.Map;

/**
 * Invocation layer for skills grouped into plugins. One handle is created with the orchestrator and passed to every
 * worker, so tests can substitute a fake.
 */
public interface SkillService {

    /**
     * @return the skill's value, a scalar or a structured payload
     * @throws SkillInvocationException when the function is unknown or fails; workers are expected to catch it
     */
    Object invoke(String pluginName, String functionName, Map<String, Object> arguments);

    boolean hasFunction(String pluginName, String functionName);

    /**
     * Convenience form taking a qualified {@code plugin.function} name.
     */
    default Object invoke(String qualifiedName, Map<String, Object> arguments) {
        var dot = qualifiedName == null ? -1 : qualifiedName.indexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new SkillInvocationException("Skill name must be 'plugin.function': " + qualifiedName);
        }
        return invoke(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1), arguments);
    }

    static SkillService none() {
        return new InMemorySkillService();
    }
}
