package work.cacm.engine.skill;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cacm.engine.shared.ErrorKind;

class InMemorySkillServiceTest {
    private static InMemorySkillService service() {
        return new InMemorySkillService()
            .register("BasicCalculation", "calculate_ratio", args -> {
                double numerator = ((Number) args.get("numerator")).doubleValue();
                double denominator = ((Number) args.get("denominator")).doubleValue();
                if (denominator == 0.0) {
                    throw new ArithmeticException("Denominator cannot be zero");
                }
                return numerator / denominator;
            });
    }

    @Test
    void invokesRegisteredFunction() {
        var skills = service();
        assertTrue(skills.hasFunction("BasicCalculation", "calculate_ratio"));
        assertFalse(skills.hasFunction("BasicCalculation", "simple_scorer"));
        assertEquals(5.0, skills.invoke("BasicCalculation", "calculate_ratio", Map.of("numerator", 10, "denominator", 2)));
        assertEquals(5.0, skills.invoke("BasicCalculation.calculate_ratio", Map.of("numerator", 10, "denominator", 2)));
        assertEquals(List.of("BasicCalculation.calculate_ratio"), skills.qualifiedNames());
    }

    @Test
    void wrapsFailuresInSkillInvocationException() {
        var skills = service();
        var ex = assertThrows(SkillInvocationException.class,
            () -> skills.invoke("BasicCalculation", "calculate_ratio", Map.of("numerator", 10, "denominator", 0)));
        assertEquals(ErrorKind.SKILL_INVOCATION, ex.kind());
        assertTrue(ex.getMessage().contains("Denominator cannot be zero"));
        assertTrue(ex.getCause() instanceof ArithmeticException);
    }

    @Test
    void unknownPluginOrFunctionFails() {
        var skills = service();
        assertThrows(SkillInvocationException.class, () -> skills.invoke("Missing", "fn", Map.of()));
        assertThrows(SkillInvocationException.class, () -> skills.invoke("BasicCalculation", "missing", Map.of()));
        assertThrows(SkillInvocationException.class, () -> skills.invoke("unqualified", Map.of()));
    }
}
