package work.cacm.engine.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BindingParserTest {
    @Test
    void parsesReferencesPerNamespace() {
        var input = assertInstanceOf(Binding.Reference.class, BindingParser.parse("cacm.inputs.params.value.clientId"));
        assertEquals(Namespace.INPUTS, input.namespace());
        assertEquals(List.of("params", "value", "clientId"), input.segments());

        var output = assertInstanceOf(Binding.Reference.class, BindingParser.parse("cacm.outputs.rating"));
        assertEquals(Namespace.OUTPUTS, output.namespace());
        assertEquals("rating", output.head());

        var intermediate = assertInstanceOf(Binding.Reference.class, BindingParser.parse("intermediate.ratios.current"));
        assertEquals(Namespace.INTERMEDIATE, intermediate.namespace());
        assertEquals(List.of("current"), intermediate.tail());
        assertEquals("intermediate.ratios.current", intermediate.text());
    }

    @Test
    void treatsEverythingElseAsLiteral() {
        assertEquals(new Binding.Literal("hello"), BindingParser.parse("hello"));
        assertEquals(new Binding.Literal("cacm.other.x"), BindingParser.parse("cacm.other.x"));
        assertEquals(new Binding.Literal(42), BindingParser.parse(42));
        assertEquals(new Binding.Literal(Map.of("a", 1)), BindingParser.parse(Map.of("a", 1)));
        assertEquals(new Binding.Literal(null), BindingParser.parse(null));
    }

    @Test
    void rejectsEmptySegments() {
        assertThrows(IllegalArgumentException.class, () -> BindingParser.parse("cacm.outputs."));
        assertThrows(IllegalArgumentException.class, () -> BindingParser.parse("intermediate.a..b"));
    }

    @Test
    void parseReferenceRequiresNamespace() {
        assertThrows(IllegalArgumentException.class, () -> BindingParser.parseReference("plain"));
        assertEquals(Namespace.OUTPUTS, BindingParser.parseReference("cacm.outputs.x").namespace());
    }
}
