package work.cacm.engine.skill;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

public final class SkillInvocationException extends EngineException {
    public SkillInvocationException(String message) {
        super(ErrorKind.SKILL_INVOCATION, message);
    }

    public SkillInvocationException(String message, Throwable cause) {
        super(ErrorKind.SKILL_INVOCATION, message, cause);
    }
}
