package work.cacm.engine.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BindingResolverTest {
    private static BindingScope scopeWithParams() {
        return new BindingScope(Map.of(
            "params", Map.of("value", Map.of("clientId", "ACME"), "type", "object"),
            "raw", 7
        ));
    }

    @Test
    void walksIntoInputDeclarations() {
        var scope = scopeWithParams();
        assertEquals("ACME", scope.resolve("cacm.inputs.params.value.clientId"));
    }

    @Test
    void bareInputReferenceYieldsDeclaredValue() {
        var scope = scopeWithParams();
        assertEquals(Map.of("clientId", "ACME"), scope.resolve("cacm.inputs.params"));
        assertEquals(7, scope.resolve("cacm.inputs.raw"));
    }

    @Test
    void resolvesListIndicesInIntermediates() {
        var scope = new BindingScope(Map.of());
        scope.write(BindingParser.parseReference("intermediate.series"), List.of(10, 20, 30), "s1");
        assertEquals(20, scope.resolve("intermediate.series.1"));
        var ex = assertThrows(UnresolvedBindingException.class, () -> scope.resolve("intermediate.series.3"));
        assertEquals("3", ex.missingSegment());
    }

    @Test
    void reportsFirstMissingSegment() {
        var scope = scopeWithParams();
        var ex = assertThrows(UnresolvedBindingException.class, () -> scope.resolve("cacm.inputs.params.value.region"));
        assertEquals("cacm.inputs.params.value.region", ex.reference());
        assertEquals("region", ex.missingSegment());

        var missingOutput = assertThrows(UnresolvedBindingException.class, () -> scope.resolve("cacm.outputs.missingKey"));
        assertEquals("missingKey", missingOutput.missingSegment());
    }

    @Test
    void literalsPassThrough() {
        var scope = scopeWithParams();
        assertEquals("hello", scope.resolve("hello"));
        assertEquals(3.5, scope.resolve(3.5));
    }

    @Test
    void resolutionIsIdempotentAndIsolated() {
        var scope = scopeWithParams();
        var first = scope.resolve("cacm.inputs.params");
        var second = scope.resolve("cacm.inputs.params");
        assertEquals(first, second);

        @SuppressWarnings("unchecked")
        var mutable = (Map<String, Object>) first;
        mutable.put("clientId", "OTHER");
        assertEquals("ACME", scope.resolve("cacm.inputs.params.value.clientId"));
    }

    @Test
    void resolveAllBindsMissingSentinel() {
        var scope = scopeWithParams();
        var bindings = new LinkedHashMap<String, Object>();
        bindings.put("client", "cacm.inputs.params.value.clientId");
        bindings.put("prior", "intermediate.previous");
        bindings.put("broken", "cacm.outputs.");
        bindings.put("threshold", 0.5);

        var resolution = BindingResolver.resolveAll(bindings, scope);
        assertFalse(resolution.complete());
        assertEquals("ACME", resolution.values().get("client"));
        assertSame(MissingValue.INSTANCE, resolution.values().get("prior"));
        assertSame(MissingValue.INSTANCE, resolution.values().get("broken"));
        assertEquals(0.5, resolution.values().get("threshold"));
        assertEquals(List.of("prior", "broken"), List.copyOf(resolution.unresolved().keySet()));
    }

    @Test
    void emptyBindingsResolveCompletely() {
        var resolution = BindingResolver.resolveAll(null, scopeWithParams());
        assertTrue(resolution.complete());
        assertTrue(resolution.values().isEmpty());
    }
}
