package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.parser.LineClassifier;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the value list of a {@code Case} line into QGIS literals.
 *
 * <pre>
 * Case 1222,3144        → [1222, 3144]
 * Case "A", "B"         → ['A', 'B']
 * Case -1.5, gt         → [-1.5, 'gt']
 * Case "O'Neil"         → ['O''Neil']
 * </pre>
 *
 * <p>Numbers are kept verbatim, everything else is a string: one layer of double quotes is removed
 * if present and the value is re-quoted for QGIS. Range forms ({@code Case Is > 5},
 * {@code Case 1 To 5}) are rejected.</p>
 */
public class CaseValueParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern IS_COMPARISON = Pattern.compile("(?i)^Is\\b.*");

    /**
     * Parses the text after the {@code Case} keyword.
     *
     * @param caseLine Classified CASE_HEADER line (value = text after Case)
     * @return Target literals in source order (never empty)
     */
    public static List<String> parse(SourceLine caseLine) {
        List<String> values = new ArrayList<>();
        for (String token : LineClassifier.splitOutsideQuotes(caseLine.getValue(), ',')) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                throw caseLine.structuralError("Empty value in Case list");
            }
            values.add(toLiteral(trimmed, caseLine));
        }
        return values;
    }

    private static String toLiteral(String token, SourceLine caseLine) {
        if (NUMBER.matcher(token).matches()) {
            return token;
        }

        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            String inner = token.substring(1, token.length() - 1).replace("\"\"", "\"");
            return QgisExpressionUtils.stringLiteral(inner);
        }

        if (IS_COMPARISON.matcher(token).matches()) {
            throw caseLine.unsupportedError("'Case Is' comparisons are not supported");
        }
        if (LineClassifier.indexOfKeywordOutsideQuotes(token, "To") >= 0) {
            throw caseLine.unsupportedError("'Case ... To ...' ranges are not supported");
        }

        return QgisExpressionUtils.stringLiteral(token);
    }
}
