package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.core.tools.HtmlEntityDecoder;
import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.context.VariableScope;

/**
 * Rewrites one VBScript expression fragment into QGIS expression syntax.
 *
 * <h3>Transformations (in one left-to-right pass):</h3>
 * <ol>
 *   <li>HTML character references are decoded first ({@code &lt;&gt;} → {@code <>}).</li>
 *   <li>{@code "text"} literals become {@code 'text'}: {@code ""} inside the literal is a double quote,
 *       embedded single quotes are doubled. In a one-line expression {@code \"} counts as a plain
 *       double quote; program fragments keep backslashes as ordinary characters.</li>
 *   <li>{@code [Field]} becomes {@code "Field"}.</li>
 *   <li>Operators outside literals: {@code &} (and {@code +} when requested) → {@code ||},
 *       {@code <>} → {@code !=}, {@code And/Or/Not} (any case, whole word) → {@code AND/OR/NOT}.
 *       Whitespace around {@code ||} and the word operators collapses to one space.</li>
 *   <li>Identifiers known to the {@link VariableScope} are replaced by their bound or accumulated
 *       value. Identifiers already written as {@code @name} are left alone.</li>
 * </ol>
 *
 * <p>Literal and field-reference content is copied verbatim and never seen by steps 4-5, which is
 * why the pass is a scanner rather than a chain of regex replacements.</p>
 *
 * <p>No validation happens here: an unterminated literal simply runs to the end of the fragment.</p>
 */
public class LiteralNormalizer {

    private final VariableScope scope;
    private final boolean standalone;

    private String source;
    private int position;
    private StringBuilder out;

    private LiteralNormalizer(VariableScope scope, boolean standalone) {
        this.scope = scope;
        this.standalone = standalone;
    }

    /**
     * Normalizes a fragment from a label program ({@code +} stays arithmetic).
     *
     * @param fragment VBScript fragment (no control-flow keywords)
     * @param scope Variables visible to the fragment
     * @return QGIS fragment, trimmed
     */
    public static String normalize(String fragment, VariableScope scope) {
        return new LiteralNormalizer(scope, false).run(fragment);
    }

    /**
     * Normalizes a standalone one-line label expression, where {@code +} joins strings and
     * {@code \"} is an escaped double quote.
     *
     * @param fragment e.g. {@code [Feet] + " ft"}
     * @return e.g. {@code "Feet" || ' ft'}
     */
    public static String normalizeExpression(String fragment) {
        return new LiteralNormalizer(VariableScope.empty(), true).run(fragment);
    }

    private String run(String fragment) {
        source = HtmlEntityDecoder.decode(fragment);
        if (standalone) {
            source = source.replace("\\\"", "\"");
        }
        position = 0;
        out = new StringBuilder(source.length() + 16);

        while (position < source.length()) {
            char c = source.charAt(position);

            if (c == '"') {
                readDoubleQuotedLiteral();
            } else if (c == '\'') {
                copySingleQuotedLiteral();
            } else if (c == '[' && readFieldReference()) {
                continue;
            } else if (c == '&' || (c == '+' && standalone)) {
                position++;
                emitOperator("||");
            } else if (c == '<' && peek(1) == '>') {
                position += 2;
                out.append("!=");
            } else if (Character.isDigit(c)) {
                copyNumber();
            } else if (isIdentifierStart(c)) {
                readIdentifier();
            } else {
                out.append(c);
                position++;
            }
        }

        return out.toString().trim();
    }

    // ========== Literals ==========

    private void readDoubleQuotedLiteral() {
        StringBuilder value = new StringBuilder();
        position++;  // opening quote
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '"') {
                if (peek(1) == '"') {
                    value.append('"');
                    position += 2;
                    continue;
                }
                position++;  // closing quote
                break;
            }
            value.append(c);
            position++;
        }
        out.append(QgisExpressionUtils.stringLiteral(value.toString()));
    }

    /**
     * Copies a literal that is already in target syntax ('...', with '' escapes).
     */
    private void copySingleQuotedLiteral() {
        out.append('\'');
        position++;
        while (position < source.length()) {
            char c = source.charAt(position);
            out.append(c);
            position++;
            if (c == '\'') {
                if (peek(0) == '\'') {
                    out.append('\'');
                    position++;
                    continue;
                }
                return;
            }
        }
    }

    /**
     * Reads [Field] at the current position.
     *
     * @return false if the bracket does not open a well-formed field reference (nothing consumed)
     */
    private boolean readFieldReference() {
        int close = source.indexOf(']', position + 1);
        if (close < 0) {
            return false;
        }
        String name = source.substring(position + 1, close);
        if (name.isEmpty() || name.indexOf('[') >= 0) {
            return false;
        }
        out.append(QgisExpressionUtils.fieldReference(name));
        position = close + 1;
        return true;
    }

    // ========== Operators and identifiers ==========

    /**
     * Appends a binary/unary operator with exactly one space on either side.
     */
    private void emitOperator(String operator) {
        trimTrailingWhitespace();
        if (out.length() > 0 && out.charAt(out.length() - 1) != '(') {
            out.append(' ');
        }
        out.append(operator).append(' ');
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private void copyNumber() {
        // Digits run together with letters (1e5, &H1F remnants) are copied as one token
        while (position < source.length() && isIdentifierPart(source.charAt(position))
                || position < source.length() && source.charAt(position) == '.') {
            out.append(source.charAt(position));
            position++;
        }
    }

    private void readIdentifier() {
        int start = position;
        while (position < source.length() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
        String identifier = source.substring(start, position);

        if (start > 0 && source.charAt(start - 1) == '@') {
            // Already a bound-variable reference
            out.append(identifier);
            return;
        }

        String lower = identifier.toLowerCase();
        if (lower.equals("and") || lower.equals("or") || lower.equals("not")) {
            emitOperator(identifier.toUpperCase());
            return;
        }

        String replacement = scope.resolve(identifier);
        out.append(replacement != null ? replacement : identifier);
    }

    private void trimTrailingWhitespace() {
        int length = out.length();
        while (length > 0 && Character.isWhitespace(out.charAt(length - 1))) {
            length--;
        }
        out.setLength(length);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
