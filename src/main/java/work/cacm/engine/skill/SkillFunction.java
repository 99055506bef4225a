package work.cacm.engine.skill;

import java.util.Map;

/**
 * A single callable skill function, native or backed by a language model.
 */
@FunctionalInterface
public interface SkillFunction {
    Object invoke(Map<String, Object> arguments) throws Exception;
}
