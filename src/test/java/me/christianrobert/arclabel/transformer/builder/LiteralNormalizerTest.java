package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.context.VariableScope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for LiteralNormalizer: literal, field and operator rewriting plus scope substitution.
 */
class LiteralNormalizerTest {

    private static final VariableScope NONE = VariableScope.empty();

    // ========== Literals and Fields ==========

    @Test
    void oneLineExpression_plusConcatenates() {
        assertEquals("\"Feet\" || ' ft (' || \"Meters\" || ' m)'",
                LiteralNormalizer.normalizeExpression("[Feet]+ \" ft (\" + [Meters] + \" m)\""));
    }

    @Test
    void programFragment_plusStaysArithmetic() {
        assertEquals("\"A\" + 1", LiteralNormalizer.normalize("[A] + 1", NONE));
    }

    @Test
    void ampersandConcatenates() {
        assertEquals("\"A\" || ' - ' || \"B\"", LiteralNormalizer.normalize("[A] & \" - \" & [B]", NONE));
    }

    @Test
    void embeddedSingleQuoteIsDoubled() {
        assertEquals("'It''s'", LiteralNormalizer.normalize("\"It's\"", NONE));
    }

    @Test
    void doubledDoubleQuoteInsideLiteral() {
        assertEquals("'say \"hi\"'", LiteralNormalizer.normalize("\"say \"\"hi\"\"\"", NONE));
    }

    @Test
    void oneLineExpression_escapedQuotesAroundLoneApostrophe() {
        assertEquals("\"A\" || ''''", LiteralNormalizer.normalizeExpression("[A] & \\\"'\\\""));
    }

    @Test
    void programFragment_backslashIsOrdinaryCharacter() {
        assertEquals("'C:\\' || \"B\"", LiteralNormalizer.normalize("\"C:\\\" & [B]", NONE));
    }

    @Test
    void fieldWithSpaces() {
        assertEquals("\"Well Name\"", LiteralNormalizer.normalize("[Well Name]", NONE));
    }

    @Test
    void htmlEntitiesAreDecoded() {
        assertEquals("\"A\" != 'x' || \"B\"", LiteralNormalizer.normalize("[A] &lt;&gt; \"x\" &amp; [B]", NONE));
    }

    // ========== Operators ==========

    @Test
    void inequalityOperator() {
        assertEquals("\"A\" != 'x'", LiteralNormalizer.normalize("[A] <> \"x\"", NONE));
    }

    @Test
    void wordOperatorsAreUppercasedAndSpaced() {
        assertEquals("\"A\" = 1 AND NOT \"B\" = 2 OR \"C\" > 3",
                LiteralNormalizer.normalize("[A] = 1 and   not [B] = 2 Or [C] > 3", NONE));
    }

    @Test
    void operatorWordsInsideLiteralsAndFieldsAreUntouched() {
        assertEquals("\"Sand and Gravel\" = 'and or not'",
                LiteralNormalizer.normalize("[Sand and Gravel] = \"and or not\"", NONE));
    }

    @Test
    void operatorAfterOpeningParenthesis() {
        assertEquals("(NOT \"A\" = 1)", LiteralNormalizer.normalize("(Not [A] = 1)", NONE));
    }

    // ========== Scope Substitution ==========

    @Test
    void externalVariablesBecomeBoundReferences() {
        VariableScope scope = VariableScope.of(List.of("d1", "d2"));

        assertEquals("@d1 || ' ' || @d2", LiteralNormalizer.normalize("d1 & \" \" & d2", scope));
    }

    @Test
    void selfReferenceUsesAccumulator() {
        VariableScope scope = VariableScope.of(List.of("d1", "t")).withSelfReference("t", "@t || 'a'");

        assertEquals("(@t || 'a') || @d1", LiteralNormalizer.normalize("t & d1", scope));
    }

    @Test
    void variableNamesInsideLiteralsAreNotReplaced() {
        VariableScope scope = VariableScope.of(List.of("t"));

        assertEquals("@t || ' t '", LiteralNormalizer.normalize("t & \" t \"", scope));
    }

    @Test
    void existingBoundReferenceIsLeftAlone() {
        VariableScope scope = VariableScope.of(List.of("t"));

        assertEquals("@t || @t", LiteralNormalizer.normalize("@t & t", scope));
    }

    @Test
    void variableLookupIsCaseInsensitive() {
        VariableScope scope = VariableScope.of(List.of("Total"));

        assertEquals("@Total || unknown", LiteralNormalizer.normalize("TOTAL & unknown", scope));
    }

    @Test
    void partialIdentifierIsNotReplaced() {
        VariableScope scope = VariableScope.of(List.of("t"));

        assertEquals("tt || @t", LiteralNormalizer.normalize("tt & t", scope));
    }
}
