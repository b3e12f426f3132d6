package me.christianrobert.arclabel.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for CodeCleaner.removeComments() on VBScript label code.
 */
class CodeCleanerTest {

    // ========== Apostrophe Comments ==========

    @Test
    void removeComments_trailingComment() {
        String input = "x = [NAME] ' the label text\nFindLabel = x";
        String expected = "x = [NAME] \nFindLabel = x";
        assertEquals(expected, CodeCleaner.removeComments(input), "Trailing comment should be removed");
    }

    @Test
    void removeComments_fullLineComment() {
        String input = "' header comment\nx = 1";
        assertEquals("\nx = 1", CodeCleaner.removeComments(input), "Newline must be preserved");
    }

    @Test
    void removeComments_apostropheInsideStringLiteral() {
        String input = "x = \"it's\" ' comment";
        assertEquals("x = \"it's\" ", CodeCleaner.removeComments(input),
                "Apostrophe inside double quotes is not a comment");
    }

    @Test
    void removeComments_escapedQuotesInsideLiteral() {
        String input = "x = \"say \"\"hi'\"\"\" & y";
        assertEquals(input, CodeCleaner.removeComments(input), "Doubled quotes keep the literal open");
    }

    // ========== Rem Comments ==========

    @Test
    void removeComments_remLine() {
        String input = "Rem old code\nx = 1";
        assertEquals("\nx = 1", CodeCleaner.removeComments(input));
    }

    @Test
    void removeComments_indentedRemIsCaseInsensitive() {
        String input = "  REM note\nx = 1";
        assertEquals("  \nx = 1", CodeCleaner.removeComments(input));
    }

    @Test
    void removeComments_identifierStartingWithRemIsKept() {
        String input = "Remark = [NOTE]";
        assertEquals(input, CodeCleaner.removeComments(input), "Rem must be a whole word");
    }

    @Test
    void removeComments_noComments() {
        String input = "If [A] = 1 Then\n  x = \"one\"\nEnd If";
        assertEquals(input, CodeCleaner.removeComments(input));
    }
}
