package me.christianrobert.arclabel.transformer.service;

import me.christianrobert.arclabel.config.service.ConfigService;
import me.christianrobert.arclabel.transformer.context.TransformationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for LabelExpressionService: input sniffing, full pipeline, failure reporting.
 *
 * Note: Currently creates service manually. Can be converted to @QuarkusTest
 * when CDI integration testing is needed.
 */
class LabelExpressionServiceTest {

    private LabelExpressionService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new LabelExpressionService();
        service.configService = configService;
    }

    // ========== Input Shapes ==========

    @Test
    void oneLineExpression() {
        TransformationResult result = service.transform("[Feet]+ \" ft (\" + [Meters] + \" m)\"");

        assertTrue(result.isSuccess(), "Transformation should succeed");
        assertEquals("\"Feet\" || ' ft (' || \"Meters\" || ' m)'", result.getQgisExpression());
        assertTrue(result.isExpression());
        assertEquals(TransformationResult.InputKind.EXPRESSION, result.getInputKind());
        assertNull(result.getErrorMessage());
    }

    @Test
    void bracketedFieldName() {
        TransformationResult result = service.transform("[Name]");

        assertTrue(result.isSuccess());
        assertEquals("Name", result.getQgisExpression());
        assertFalse(result.isExpression(), "A bare field is not an expression");
        assertEquals(TransformationResult.InputKind.FIELD_NAME, result.getInputKind());
    }

    @Test
    void qualifiedFieldName() {
        TransformationResult result = service.transform("Parcels.OWNER");

        assertEquals("OWNER", result.getQgisExpression());
        assertFalse(result.isExpression());
    }

    @Test
    void quotedLiteralWithoutSpaceIsAnExpression() {
        TransformationResult result = service.transform("\"n/a\"");

        assertEquals("'n/a'", result.getQgisExpression());
        assertTrue(result.isExpression());
    }

    @Test
    void expressionWithLoneApostrophe() {
        TransformationResult result = service.transform("[A] & \"'\"");

        assertEquals("\"A\" || ''''", result.getQgisExpression());
    }

    @Test
    void structuredProgram() {
        String program = """
                Function FindLabel ( [NAME] )
                  x = [NAME]
                  If x = "Salt Dome" Then x = ""
                  FindLabel = x
                End Function
                """;

        TransformationResult result = service.transform(program);

        assertTrue(result.isSuccess(), () -> result.getErrorMessage());
        assertEquals(TransformationResult.InputKind.STRUCTURED_PROGRAM, result.getInputKind());
        assertTrue(result.isExpression());
        assertEquals("with_variable('x', \"NAME\", "
                + "with_variable('x', CASE WHEN @x = 'Salt Dome' THEN '' ELSE @x END, @x))", result.getQgisExpression());
        assertEquals(program, result.getSourceText());
    }

    @Test
    void headerlessProgramIsRecognizedByBlockKeywords() {
        String program = """
                t = [A]
                Select Case [B]
                  Case 1
                    t = "one"
                End Select
                """;

        TransformationResult result = service.transform(program);

        assertEquals(TransformationResult.InputKind.STRUCTURED_PROGRAM, result.getInputKind());
        assertEquals("with_variable('t', \"A\", with_variable('t', CASE WHEN \"B\" = 1 THEN 'one' ELSE @t END, @t))",
                result.getQgisExpression());
    }

    @Test
    void htmlEncodedProgram() {
        String program = "Function FindLabel ( [A], [B] )\n"
                + "  t = [A]\n"
                + "  If [B] &lt;&gt; 1 Then t = t &amp; &quot;x&quot;\n"
                + "  FindLabel = t\n"
                + "End Function";

        TransformationResult result = service.transform(program);

        assertTrue(result.isSuccess(), () -> result.getErrorMessage());
        assertEquals("with_variable('t', \"A\", with_variable('t', CASE WHEN \"B\" != 1 THEN @t || 'x' ELSE @t END, @t))",
                result.getQgisExpression());
    }

    @Test
    void configuredFunctionName() {
        configService.setConfigValue(ConfigService.FUNCTION_NAME, "MakeLabel");

        TransformationResult result = service.transform("Function MakeLabel ( [A] )\n  t = [A]\n  MakeLabel = t\nEnd Function");

        assertEquals(TransformationResult.InputKind.STRUCTURED_PROGRAM, result.getInputKind());
        assertEquals("with_variable('t', \"A\", @t)", result.getQgisExpression());
    }

    @Test
    void prettyPrintFromConfiguration() {
        configService.setConfigValue(ConfigService.PRETTY_PRINT, true);

        TransformationResult result = service.transformProgram("t = [A]\nIf [B] = 1 Then t = \"x\"");

        assertEquals("with_variable('t', \"A\", with_variable('t', CASE\n  WHEN \"B\" = 1 THEN 'x'\n  ELSE @t\nEND, @t))",
                result.getQgisExpression());
    }

    @Test
    void transformationIsRepeatable() {
        String program = "t = [A]\nIf [B] = 1 Then\n  t = t & \"!\"\nEnd If";

        TransformationResult first = service.transform(program);
        TransformationResult second = service.transform(program);

        assertEquals(first.getQgisExpression(), second.getQgisExpression());
        assertEquals(first.isExpression(), second.isExpression());
    }

    // ========== Failures ==========

    @Test
    void nullOrBlankInput() {
        assertTrue(service.transform(null).isFailure());
        assertTrue(service.transform("   ").isFailure());
        assertTrue(service.transformProgram("").isFailure());
    }

    @Test
    void structuralErrorIsReportedWithLine() {
        TransformationResult result = service.transform("""
                Function FindLabel ( [A] )
                  t = [A]
                  If [A] = 1 Then
                    other = "x"
                  End If
                  FindLabel = t
                End Function
                """);

        assertTrue(result.isFailure());
        assertNull(result.getQgisExpression());
        assertTrue(result.getErrorMessage().contains("Line 4: other = \"x\""), result.getErrorMessage());
    }

    @Test
    void unsupportedConstructIsReported() {
        TransformationResult result = service.transform("""
                Function FindLabel ( [A] )
                  t = ""
                  For i = 1 To 3
                    t = t & i
                  Next
                  FindLabel = t
                End Function
                """);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("For"), result.getErrorMessage());
    }

    // ========== Shape Detection ==========

    @Test
    void isBareFieldName() {
        assertTrue(service.isBareFieldName("NAME"));
        assertTrue(service.isBareFieldName("[NAME]"));
        assertTrue(service.isBareFieldName("table.NAME"));
        assertFalse(service.isBareFieldName("[A] & [B]"));
        assertFalse(service.isBareFieldName("[A]&[B]"));
        assertFalse(service.isBareFieldName("\"x\""));
        assertFalse(service.isBareFieldName(null));
    }
}
