package me.christianrobert.arclabel.transformer.arcade;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.builder.ConditionalBlock;
import me.christianrobert.arclabel.transformer.context.TransformationException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates Arcade label expressions into QGIS expressions.
 *
 * <p>Supported subset:</p>
 * <ul>
 *   <li>{@code $feature.NAME} and {@code $feature["NAME"]} → {@code "NAME"}</li>
 *   <li>{@code var x = ...;} declarations, inlined (parenthesized) wherever x is read later</li>
 *   <li>{@code return expr;}, or the last expression statement when there is no return</li>
 *   <li>one {@code if (c) { return v; } else if (...) { ... } else { ... }} cascade, rendered as
 *       CASE; a {@code return} after a cascade without else becomes the ELSE arm</li>
 *   <li>operators {@code && || == !} → {@code AND OR = NOT}; {@code Sin/Cos/Tan} lower-cased</li>
 * </ul>
 *
 * <p>Anything else (loops, functions, template literals, multi-statement branches) fails with
 * an unsupported-construct error.</p>
 */
public class ArcadeExpressionTranslator {

    private static final Pattern DECLARATION = Pattern.compile("^([A-Za-z_]\\w*)\\s*=\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern REASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern UNSUPPORTED_KEYWORD = Pattern.compile(
            "^(for|while|function|do|switch|when|decode)\\b", Pattern.CASE_INSENSITIVE);
    private static final String TRAILING_OPERATORS = "+-*/%=<>!&|,?:.";
    private static final String LEADING_OPERATORS = "+*/%=<>&|,?:.";

    private final String source;
    private final Map<String, String> variables = new HashMap<>();  // lower-case name → translated value
    private int position;

    private ArcadeExpressionTranslator(String source) {
        this.source = source;
    }

    /**
     * @param arcade Arcade expression text
     * @param prettyPrint One WHEN/ELSE per line for if/else cascades
     * @return QGIS expression
     * @throws TransformationException if the expression uses unsupported syntax or yields no value
     */
    public static String translate(String arcade, boolean prettyPrint) {
        return new ArcadeExpressionTranslator(removeComments(arcade)).run(prettyPrint);
    }

    private String run(boolean prettyPrint) {
        ConditionalBlock cascade = new ConditionalBlock();
        String fallback = null;
        String returnValue = null;
        String lastExpression = null;
        String lastStatement = null;

        while (true) {
            skipSeparators();
            if (position >= source.length()) {
                break;
            }
            if (returnValue != null || fallback != null) {
                throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                        "Unreachable statement after return: " + readStatement());
            }
            if (lastStatement != null) {
                throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                        "Expression statement has no effect: " + lastStatement);
            }

            if (matchKeyword("var")) {
                declare(readStatement());
            } else if (matchKeyword("if")) {
                if (!cascade.isEmpty()) {
                    throw new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                            "Only one if/else cascade per Arcade expression is supported");
                }
                fallback = readIfCascade(cascade);
            } else if (matchKeyword("return")) {
                returnValue = translateFragment(readStatement());
            } else {
                String statement = readStatement();
                Matcher reassignment = REASSIGNMENT.matcher(statement);
                if (UNSUPPORTED_KEYWORD.matcher(statement).find()) {
                    throw new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                            "Unsupported Arcade statement: " + statement);
                } else if (reassignment.matches() && variables.containsKey(reassignment.group(1).toLowerCase())) {
                    declare(statement);
                } else {
                    lastExpression = translateFragment(statement);
                    lastStatement = statement;
                }
            }
        }

        if (!cascade.isEmpty()) {
            cascade.setFallback(fallback != null ? fallback : returnValue);
            return cascade.render(prettyPrint);
        }
        if (returnValue != null) {
            return returnValue;
        }
        if (lastExpression != null) {
            return lastExpression;
        }
        throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                "Arcade expression has no return value");
    }

    private void declare(String statement) {
        Matcher m = DECLARATION.matcher(statement);
        if (!m.matches()) {
            throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                    "Malformed variable declaration: var " + statement);
        }
        // Translated before the put so a redeclaration can read the previous value
        String value = translateFragment(m.group(2));
        variables.put(m.group(1).toLowerCase(), value);
    }

    // ========== If/else cascade ==========

    /**
     * Reads {@code (c) {...} [else if (c) {...}]* [else {...}]} after the {@code if} keyword.
     *
     * @return The else value, or null without an else arm
     */
    private String readIfCascade(ConditionalBlock cascade) {
        while (true) {
            skipWhitespace();
            String condition = translateFragment(readEnclosed('(', ')'));
            skipWhitespace();
            cascade.addBranch(condition, readReturnBody());

            int mark = position;
            skipWhitespace();
            if (!matchKeyword("else")) {
                position = mark;
                return null;
            }
            skipWhitespace();
            if (!matchKeyword("if")) {
                return readReturnBody();
            }
        }
    }

    private String readReturnBody() {
        String body = readEnclosed('{', '}').trim();
        while (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).trim();
        }
        if (!body.regionMatches(true, 0, "return", 0, 6) || body.length() == 6
                || Character.isLetterOrDigit(body.charAt(6)) || indexOutsideQuotes(body, ';') >= 0) {
            throw new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                    "If branches must consist of a single return statement: {" + body + "}");
        }
        return translateFragment(body.substring(6));
    }

    /**
     * Reads a bracketed section at the current position and returns its content.
     */
    private String readEnclosed(char open, char close) {
        if (position >= source.length() || source.charAt(position) != open) {
            throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                    "Expected '" + open + "' at offset " + position);
        }
        int depth = 0;
        int start = position + 1;
        char quote = 0;
        for (; position < source.length(); position++) {
            char c = source.charAt(position);
            if (quote != 0) {
                if (c == '\\') {
                    position++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                position++;
                return source.substring(start, position - 1);
            }
        }
        throw new TransformationException(TransformationException.Kind.STRUCTURAL,
                "Missing '" + close + "' in Arcade expression");
    }

    // ========== Statement scanning ==========

    /**
     * Reads up to the next ';', or line break ending a complete statement, outside literals and brackets.
     */
    private String readStatement() {
        int start = position;
        int depth = 0;
        char quote = 0;
        for (; position < source.length(); position++) {
            char c = source.charAt(position);
            if (quote != 0) {
                if (c == '\\') {
                    position++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth <= 0 && (c == ';' || c == '\n' && endsStatement(start))) {
                break;
            }
        }
        return source.substring(start, Math.min(position, source.length())).trim();
    }

    /**
     * A line break ends the statement only when the text so far is a complete expression:
     * neither the current line ends with a binary operator nor the next line starts with one.
     */
    private boolean endsStatement(int start) {
        int before = position - 1;
        while (before >= start && Character.isWhitespace(source.charAt(before))) {
            before--;
        }
        if (before < start || TRAILING_OPERATORS.indexOf(source.charAt(before)) >= 0) {
            return false;
        }
        int after = position + 1;
        while (after < source.length() && Character.isWhitespace(source.charAt(after))) {
            after++;
        }
        return after >= source.length() || LEADING_OPERATORS.indexOf(source.charAt(after)) < 0;
    }

    private boolean matchKeyword(String keyword) {
        int end = position + keyword.length();
        if (!source.regionMatches(true, position, keyword, 0, keyword.length())) {
            return false;
        }
        if (end < source.length() && isIdentifierPart(source.charAt(end))) {
            return false;
        }
        position = end;
        return true;
    }

    private void skipSeparators() {
        while (position < source.length()
                && (Character.isWhitespace(source.charAt(position)) || source.charAt(position) == ';')) {
            position++;
        }
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    // ========== Fragment translation ==========

    private String translateFragment(String fragment) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < fragment.length()) {
            char c = fragment.charAt(i);

            if (c == '"' || c == '\'') {
                StringBuilder value = new StringBuilder();
                i++;
                while (i < fragment.length() && fragment.charAt(i) != c) {
                    if (fragment.charAt(i) == '\\' && i + 1 < fragment.length()) {
                        i++;
                    }
                    value.append(fragment.charAt(i));
                    i++;
                }
                i++;  // closing quote
                out.append(QgisExpressionUtils.stringLiteral(value.toString()));
            } else if (c == '`') {
                throw new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                        "Arcade template literals are not supported: " + fragment.trim());
            } else if (fragment.startsWith("$feature", i)) {
                i = readFeatureField(fragment, i + "$feature".length(), out);
            } else if (fragment.startsWith("&&", i)) {
                appendOperator(out, "AND");
                i = skipSpaces(fragment, i + 2);
            } else if (fragment.startsWith("||", i)) {
                appendOperator(out, "OR");
                i = skipSpaces(fragment, i + 2);
            } else if (fragment.startsWith("==", i)) {
                out.append('=');
                i += 2;
            } else if (fragment.startsWith("!=", i)) {
                out.append("!=");
                i += 2;
            } else if (c == '!') {
                appendOperator(out, "NOT");
                i = skipSpaces(fragment, i + 1);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < fragment.length() && isIdentifierPart(fragment.charAt(i))) {
                    i++;
                }
                out.append(translateIdentifier(fragment.substring(start, i), fragment, i));
            } else if (Character.isDigit(c)) {
                while (i < fragment.length() && (isIdentifierPart(fragment.charAt(i)) || fragment.charAt(i) == '.')) {
                    out.append(fragment.charAt(i));
                    i++;
                }
            } else if (Character.isWhitespace(c)) {
                // Line breaks inside a continued expression collapse with the indentation
                out.append(' ');
                i = skipSpaces(fragment, i);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString().trim();
    }

    private int readFeatureField(String fragment, int i, StringBuilder out) {
        if (i < fragment.length() && fragment.charAt(i) == '.') {
            int start = ++i;
            while (i < fragment.length() && isIdentifierPart(fragment.charAt(i))) {
                i++;
            }
            if (i > start) {
                out.append(QgisExpressionUtils.fieldReference(fragment.substring(start, i)));
                return i;
            }
        } else if (i + 1 < fragment.length() && fragment.charAt(i) == '['
                && (fragment.charAt(i + 1) == '"' || fragment.charAt(i + 1) == '\'')) {
            char quote = fragment.charAt(i + 1);
            int end = fragment.indexOf(quote, i + 2);
            if (end > 0 && end + 1 < fragment.length() && fragment.charAt(end + 1) == ']') {
                out.append(QgisExpressionUtils.fieldReference(fragment.substring(i + 2, end)));
                return end + 2;
            }
        }
        throw new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT,
                "Unsupported $feature access: " + fragment.trim());
    }

    private String translateIdentifier(String identifier, String fragment, int end) {
        String lower = identifier.toLowerCase();
        String variable = variables.get(lower);
        if (variable != null) {
            return "(" + variable + ")";
        }
        switch (lower) {
            case "true", "false", "null":
                return identifier.toUpperCase();
            case "sin", "cos", "tan":
                if (fragment.substring(end).trim().startsWith("(")) {
                    return lower;
                }
                return identifier;
            default:
                return identifier;
        }
    }

    private static void appendOperator(StringBuilder out, String operator) {
        int length = out.length();
        while (length > 0 && Character.isWhitespace(out.charAt(length - 1))) {
            length--;
        }
        out.setLength(length);
        if (length > 0 && out.charAt(length - 1) != '(') {
            out.append(' ');
        }
        out.append(operator).append(' ');
    }

    // ========== Comments ==========

    /**
     * Drops // line comments and block comments outside string literals.
     */
    static String removeComments(String arcade) {
        StringBuilder result = new StringBuilder(arcade.length());
        char quote = 0;
        int i = 0;
        while (i < arcade.length()) {
            char c = arcade.charAt(i);
            if (quote != 0) {
                result.append(c);
                if (c == '\\' && i + 1 < arcade.length()) {
                    result.append(arcade.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
            } else if (c == '"' || c == '\'') {
                quote = c;
                result.append(c);
                i++;
            } else if (arcade.startsWith("//", i)) {
                while (i < arcade.length() && arcade.charAt(i) != '\n') {
                    i++;
                }
            } else if (arcade.startsWith("/*", i)) {
                int end = arcade.indexOf("*/", i + 2);
                i = end < 0 ? arcade.length() : end + 2;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    private static int indexOutsideQuotes(String text, char target) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }

    private static int skipSpaces(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
