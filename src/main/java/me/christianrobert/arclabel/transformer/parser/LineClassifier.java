package me.christianrobert.arclabel.transformer.parser;

import me.christianrobert.arclabel.transformer.context.TransformationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits comment-free VBScript label code into classified statements.
 *
 * <p>Physical lines are first joined on the {@code _} continuation marker, then split on the
 * {@code :} statement separator (outside string literals). Each statement is tagged with a
 * {@link LineType}. Single-line {@code If c Then s [Else s]} is expanded into the block form so the
 * parser only ever sees block structure.</p>
 *
 * <p>Blank lines produce no statement. Anything outside the supported grammar (loops, subroutine
 * calls, array element writes, unknown statements) fails immediately with an
 * {@link TransformationException.Kind#UNSUPPORTED_CONSTRUCT}
 * error instead of being skipped.</p>
 *
 * <p><strong>IMPORTANT:</strong> Input MUST be comment-free (use CodeCleaner.removeComments first).</p>
 */
public class LineClassifier {

    private static final Logger log = LoggerFactory.getLogger(LineClassifier.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern FUNCTION_HEADER = Pattern.compile("^Function\\s+(\\w+)\\s*(?:\\((.*)\\))?$", FLAGS);
    private static final Pattern FUNCTION_END = Pattern.compile("^End\\s+Function$", FLAGS);
    private static final Pattern IF_BLOCK = Pattern.compile("^If\\s+(.+?)\\s+Then$", FLAGS);
    private static final Pattern IF_PREFIX = Pattern.compile("^If\\s", FLAGS);
    private static final Pattern ELSE_IF = Pattern.compile("^ElseIf\\s+(.+?)\\s+Then$", FLAGS);
    private static final Pattern ELSE = Pattern.compile("^Else$", FLAGS);
    private static final Pattern END_IF = Pattern.compile("^End\\s+If$", FLAGS);
    private static final Pattern SELECT_CASE = Pattern.compile("^Select\\s+Case\\s+(.+)$", FLAGS);
    private static final Pattern CASE_ELSE = Pattern.compile("^Case\\s+Else$", FLAGS);
    private static final Pattern CASE = Pattern.compile("^Case\\s+(.+)$", FLAGS);
    private static final Pattern END_SELECT = Pattern.compile("^End\\s+Select$", FLAGS);
    private static final Pattern DIM = Pattern.compile("^Dim\\s+\\w+.*$", FLAGS);
    private static final Pattern ASSIGNMENT = Pattern.compile("^(\\w+)\\s*=\\s*(.+)$", FLAGS);

    private static final Pattern UNSUPPORTED_KEYWORD = Pattern.compile(
            "^(For|Next|Do|Loop|While|Wend|Call|Sub|Exit|ReDim|Set|With|GoTo|On\\s+Error|Const|Class|Property"
                    + "|Execute|Erase|Randomize|Option|Private|Public|End\\s+Sub|End\\s+With|End\\s+Class"
                    + "|End\\s+Property)\\b", FLAGS);

    /**
     * Classifies all statements of a comment-free label program.
     *
     * @param source Program text (comments removed)
     * @return Statements in source order
     */
    public List<SourceLine> classify(String source) {
        String[] physicalLines = source.split("\r?\n", -1);
        List<SourceLine> result = new ArrayList<>();

        StringBuilder pending = null;
        int pendingStart = 0;

        for (int i = 0; i < physicalLines.length; i++) {
            String line = physicalLines[i].trim();
            if (pending == null) {
                pending = new StringBuilder(line);
                pendingStart = i + 1;
            } else {
                pending.append(' ').append(line);
            }

            if (endsWithContinuation(pending)) {
                pending.setLength(pending.length() - 1);
                continue;
            }

            addLogicalLine(pending.toString().trim(), pendingStart, result);
            pending = null;
        }

        if (pending != null) {
            // Continuation marker on the last line: nothing to join with
            addLogicalLine(pending.toString().trim(), pendingStart, result);
        }

        log.debug("Classified {} statements from {} physical lines", result.size(), physicalLines.length);
        return result;
    }

    private void addLogicalLine(String logicalLine, int lineNumber, List<SourceLine> out) {
        if (logicalLine.isEmpty()) {
            return;
        }
        addStatements(splitOutsideQuotes(logicalLine, ':'), lineNumber, out);
    }

    private void addStatements(List<String> statements, int lineNumber, List<SourceLine> out) {
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i).trim();
            if (statement.isEmpty()) {
                continue;
            }

            int thenIndex = inlineThenIndex(statement);
            if (thenIndex >= 0) {
                // Everything after Then on the same line belongs to the If, colon-separated parts included
                StringBuilder thenText = new StringBuilder(statement.substring(thenIndex + "Then".length()).trim());
                for (int j = i + 1; j < statements.size(); j++) {
                    thenText.append(':').append(statements.get(j));
                }
                String condition = statement.substring("If".length(), thenIndex).trim();
                expandInlineIf(statement, condition, thenText.toString(), lineNumber, out);
                return;
            }

            out.add(classifyStatement(statement, lineNumber));
        }
    }

    /**
     * Locates the Then of a single-line If, skipping any Then inside string literals.
     *
     * @return Index of Then, or -1 if the statement is not a single-line If
     */
    private static int inlineThenIndex(String statement) {
        if (!IF_PREFIX.matcher(statement).find()) {
            return -1;
        }
        int thenIndex = indexOfKeywordOutsideQuotes(statement, "Then");
        if (thenIndex < 0 || statement.substring(thenIndex + "Then".length()).isBlank()
                || statement.substring("If".length(), thenIndex).isBlank()) {
            return -1;
        }
        return thenIndex;
    }

    private void expandInlineIf(String statement, String condition, String thenText, int lineNumber,
                                List<SourceLine> out) {
        log.trace("Expanding single-line If at line {}: {}", lineNumber, statement);

        String thenPart = thenText;
        String elsePart = null;
        int elseIndex = indexOfKeywordOutsideQuotes(thenText, "Else");
        if (elseIndex >= 0) {
            thenPart = thenText.substring(0, elseIndex);
            elsePart = thenText.substring(elseIndex + "Else".length());
        }

        out.add(new SourceLine(LineType.IF_HEADER, lineNumber, statement, null, condition));
        addStatements(splitOutsideQuotes(thenPart, ':'), lineNumber, out);
        if (elsePart != null) {
            out.add(new SourceLine(LineType.ELSE_HEADER, lineNumber, statement, null, null));
            addStatements(splitOutsideQuotes(elsePart, ':'), lineNumber, out);
        }
        out.add(new SourceLine(LineType.END_IF, lineNumber, statement, null, null));
    }

    /**
     * Classifies one statement.
     *
     * @throws TransformationException for statements outside the supported grammar
     */
    SourceLine classifyStatement(String statement, int lineNumber) {
        Matcher m;

        if (FUNCTION_END.matcher(statement).matches()) {
            return new SourceLine(LineType.FUNCTION_END, lineNumber, statement, null, null);
        }
        if (END_IF.matcher(statement).matches()) {
            return new SourceLine(LineType.END_IF, lineNumber, statement, null, null);
        }
        if (END_SELECT.matcher(statement).matches()) {
            return new SourceLine(LineType.END_SELECT, lineNumber, statement, null, null);
        }
        if ((m = FUNCTION_HEADER.matcher(statement)).matches()) {
            String parameters = m.group(2) != null ? m.group(2).trim() : "";
            return new SourceLine(LineType.FUNCTION_HEADER, lineNumber, statement, m.group(1), parameters);
        }
        if ((m = ELSE_IF.matcher(statement)).matches()) {
            return new SourceLine(LineType.ELSE_IF_HEADER, lineNumber, statement, null, m.group(1).trim());
        }
        if ((m = IF_BLOCK.matcher(statement)).matches()) {
            return new SourceLine(LineType.IF_HEADER, lineNumber, statement, null, m.group(1).trim());
        }
        if (ELSE.matcher(statement).matches()) {
            return new SourceLine(LineType.ELSE_HEADER, lineNumber, statement, null, null);
        }
        if ((m = SELECT_CASE.matcher(statement)).matches()) {
            return new SourceLine(LineType.SELECT_CASE_HEADER, lineNumber, statement, null, m.group(1).trim());
        }
        if (CASE_ELSE.matcher(statement).matches()) {
            return new SourceLine(LineType.CASE_ELSE_HEADER, lineNumber, statement, null, null);
        }
        if ((m = CASE.matcher(statement)).matches()) {
            return new SourceLine(LineType.CASE_HEADER, lineNumber, statement, null, m.group(1).trim());
        }
        if (DIM.matcher(statement).matches()) {
            return new SourceLine(LineType.DECLARATION, lineNumber, statement, null, null);
        }
        if ((m = UNSUPPORTED_KEYWORD.matcher(statement)).find()) {
            String keyword = m.group(1).replaceAll("\\s+", " ");
            throw unsupported("Unsupported statement '" + keyword + "' in label expression", lineNumber, statement);
        }
        if ((m = ASSIGNMENT.matcher(statement)).matches()) {
            return new SourceLine(LineType.ASSIGNMENT, lineNumber, statement, m.group(1), m.group(2).trim());
        }

        throw unsupported("Unrecognized statement in label expression", lineNumber, statement);
    }

    private static TransformationException unsupported(String message, int lineNumber, String statement) {
        return new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT, message, lineNumber,
                statement);
    }

    private static boolean endsWithContinuation(CharSequence line) {
        int length = line.length();
        if (length == 0 || line.charAt(length - 1) != '_') {
            return false;
        }
        return length == 1 || Character.isWhitespace(line.charAt(length - 2));
    }

    /**
     * Splits on a separator character that is not inside a double-quoted literal.
     */
    public static List<String> splitOutsideQuotes(String text, char separator) {
        List<String> parts = new ArrayList<>();
        boolean inQuote = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (c == separator && !inQuote) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Finds a whole-word, case-insensitive keyword outside double-quoted literals.
     *
     * @return Index of the keyword, or -1
     */
    public static int indexOfKeywordOutsideQuotes(String text, String keyword) {
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
                continue;
            }
            if (inQuote || !text.regionMatches(true, i, keyword, 0, keyword.length())) {
                continue;
            }
            boolean startsWord = i == 0 || !isIdentifierChar(text.charAt(i - 1));
            int end = i + keyword.length();
            boolean endsWord = end >= text.length() || !isIdentifierChar(text.charAt(end));
            if (startsWord && endsWord) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
