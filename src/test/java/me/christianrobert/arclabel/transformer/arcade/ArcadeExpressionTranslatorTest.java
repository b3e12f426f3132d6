package me.christianrobert.arclabel.transformer.arcade;

import me.christianrobert.arclabel.transformer.context.TransformationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArcadeExpressionTranslatorTest {

    private static String translate(String arcade) {
        return ArcadeExpressionTranslator.translate(arcade, false);
    }

    // ========== Simple Expressions ==========

    @Test
    void featureField() {
        assertEquals("\"NAME\"", translate("$feature.NAME"));
    }

    @Test
    void bracketFeatureAccess() {
        assertEquals("\"Well Name\" + ' (' + \"CODE\" + ')'",
                translate("$feature[\"Well Name\"] + \" (\" + $feature['CODE'] + \")\""));
    }

    @Test
    void stringLiteralEscapes() {
        assertEquals("'it''s \"x\"'", translate("return \"it's \\\"x\\\"\";"));
    }

    @Test
    void variablesAreInlined() {
        String arcade = """
                var lon = $feature.Longitude * 0.017;
                var s = Sin(lon);
                return Round(s, 2);
                """;

        assertEquals("Round((sin((\"Longitude\" * 0.017))), 2)", translate(arcade));
    }

    @Test
    void reassignedVariableReadsPreviousValue() {
        String arcade = """
                var t = $feature.NAME;
                t = t + "!";
                return t;
                """;

        assertEquals("((\"NAME\") + '!')", translate(arcade));
    }

    @Test
    void commentsAreDropped() {
        String arcade = """
                // label for wells
                /* block
                   comment */
                return $feature.A; // trailing
                """;

        assertEquals("\"A\"", translate(arcade));
    }

    @Test
    void commentMarkerInsideStringIsKept() {
        assertEquals("'http://x'", translate("return \"http://x\""));
    }

    // ========== Multi-line Statements ==========

    @Test
    void declarationContinuedAfterTrailingOperator() {
        String arcade = """
                var x = $feature.A +
                  1;
                return x;
                """;

        assertEquals("(\"A\" + 1)", translate(arcade));
    }

    @Test
    void returnContinuedAfterTrailingOperator() {
        String arcade = """
                return $feature.A +
                  " ft";
                """;

        assertEquals("\"A\" + ' ft'", translate(arcade));
    }

    @Test
    void returnContinuedOnLineStartingWithOperator() {
        String arcade = """
                return $feature.A
                  + " ft"
                """;

        assertEquals("\"A\" + ' ft'", translate(arcade));
    }

    @Test
    void lineBreakEndsCompleteStatement() {
        String arcade = """
                var x = $feature.A
                return x + "!"
                """;

        assertEquals("(\"A\") + '!'", translate(arcade));
    }

    @Test
    void expressionStatementFollowedByStatementFails() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> translate("$feature.A\n$feature.B"));
        assertEquals(TransformationException.Kind.STRUCTURAL, e.getKind());
        assertTrue(e.getMessage().contains("$feature.A"));
    }

    // ========== If/Else Cascades ==========

    @Test
    void ifElseCascade() {
        String arcade = """
                if ($feature.POP > 1000000) {
                  return "Large";
                } else if ($feature.POP > 100000 && $feature.CAPITAL == 1) {
                  return "Medium";
                } else {
                  return "Small";
                }
                """;

        assertEquals("CASE WHEN \"POP\" > 1000000 THEN 'Large' "
                + "WHEN \"POP\" > 100000 AND \"CAPITAL\" = 1 THEN 'Medium' ELSE 'Small' END", translate(arcade));
    }

    @Test
    void trailingReturnIsFallback() {
        String arcade = """
                if ($feature.A == 1) { return 'one' }
                return 'many'
                """;

        assertEquals("CASE WHEN \"A\" = 1 THEN 'one' ELSE 'many' END", translate(arcade));
    }

    @Test
    void negationAndOr() {
        String arcade = "if (!IsEmpty($feature.A) || $feature.B == 'x') { return $feature.A } else { return 'n/a' }";

        assertEquals("CASE WHEN NOT IsEmpty(\"A\") OR \"B\" = 'x' THEN \"A\" ELSE 'n/a' END", translate(arcade));
    }

    @Test
    void prettyPrintCascade() {
        assertEquals("CASE\n  WHEN \"A\" = 1 THEN 'one'\n  ELSE 'many'\nEND",
                ArcadeExpressionTranslator.translate("if ($feature.A == 1) { return 'one' } else { return 'many' }", true));
    }

    // ========== Failures ==========

    @Test
    void noReturnValue() {
        TransformationException e = assertThrows(TransformationException.class, () -> translate("// nothing"));
        assertEquals(TransformationException.Kind.STRUCTURAL, e.getKind());
    }

    @Test
    void loopIsUnsupported() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> translate("var t = ''; for (var k in $feature) { t = t + k } return t"));
        assertEquals(TransformationException.Kind.UNSUPPORTED_CONSTRUCT, e.getKind());
    }

    @Test
    void templateLiteralIsUnsupported() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> translate("return `${$feature.A} m`"));
        assertEquals(TransformationException.Kind.UNSUPPORTED_CONSTRUCT, e.getKind());
    }

    @Test
    void multiStatementBranchIsUnsupported() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> translate("if ($feature.A == 1) { var x = 'a'; return x; }"));
        assertEquals(TransformationException.Kind.UNSUPPORTED_CONSTRUCT, e.getKind());
    }

    @Test
    void unbalancedBraces() {
        TransformationException e = assertThrows(TransformationException.class,
                () -> translate("if ($feature.A == 1) { return 'a'"));
        assertEquals(TransformationException.Kind.STRUCTURAL, e.getKind());
    }
}
