package me.christianrobert.arclabel.transformer.context;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableScopeTest {

    @Test
    void externalReference_rendersBoundVariable() {
        VariableScope scope = VariableScope.of(List.of("d1", "t"));

        assertEquals("@d1", scope.resolve("d1"));
        assertEquals("@t", scope.resolve("t"));
        assertNull(scope.resolve("unknown"));
    }

    @Test
    void lookupIsCaseInsensitive_returnsCanonicalSpelling() {
        VariableScope scope = VariableScope.of(List.of("Label"));

        assertEquals("@Label", scope.resolve("LABEL"));
        assertEquals("@Label", scope.resolve("label"));
    }

    @Test
    void selfReference_parenthesizesAccumulator() {
        VariableScope scope = VariableScope.of(List.of("d1", "t")).withSelfReference("t", "@t || 'a'");

        assertEquals("(@t || 'a')", scope.resolve("t"));
        assertEquals("@d1", scope.resolve("d1"), "Other variables keep their bound reference");
    }

    @Test
    void selfReference_bareVariableNeedsNoParentheses() {
        VariableScope scope = VariableScope.of(List.of("t")).withSelfReference("t", "@t");

        assertEquals("@t", scope.resolve("T"));
    }

    @Test
    void withSelfReference_doesNotMutateOriginal() {
        VariableScope original = VariableScope.of(List.of("t"));
        VariableScope updated = original.withSelfReference("t", "'x'");

        assertEquals("@t", original.resolve("t"));
        assertEquals("('x')", updated.resolve("t"));
    }

    @Test
    void emptyScope_resolvesNothing() {
        assertTrue(VariableScope.empty().isEmpty());
        assertNull(VariableScope.empty().resolve("t"));
        assertFalse(VariableScope.of(List.of("t")).isEmpty());
    }
}
