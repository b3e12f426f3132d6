package me.christianrobert.arclabel.transformer.parser;

import me.christianrobert.arclabel.transformer.context.TransformationException;

/**
 * One classified logical statement of a label program.
 *
 * Produced once by {@link LineClassifier} and read-only afterwards. Depending on the type:
 * - ASSIGNMENT: name = variable, value = right-hand side
 * - FUNCTION_HEADER: name = function name, value = parameter list (may be empty)
 * - IF_HEADER / ELSE_IF_HEADER: value = condition
 * - SELECT_CASE_HEADER: value = selector
 * - CASE_HEADER: value = comma-separated case values
 * - all others: name and value are null
 */
public class SourceLine {

    private final LineType type;
    private final int lineNumber;
    private final String text;
    private final String name;
    private final String value;

    public SourceLine(LineType type, int lineNumber, String text, String name, String value) {
        this.type = type;
        this.lineNumber = lineNumber;
        this.text = text;
        this.name = name;
        this.value = value;
    }

    public LineType getType() {
        return type;
    }

    public boolean is(LineType other) {
        return type == other;
    }

    /**
     * 1-based number of the physical line the statement starts on.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Statement text as written (trimmed, continuation lines joined).
     */
    public String getText() {
        return text;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    /**
     * Builds a structural error pointing at this line.
     */
    public TransformationException structuralError(String message) {
        return new TransformationException(TransformationException.Kind.STRUCTURAL, message, lineNumber, text);
    }

    /**
     * Builds an unsupported-construct error pointing at this line.
     */
    public TransformationException unsupportedError(String message) {
        return new TransformationException(TransformationException.Kind.UNSUPPORTED_CONSTRUCT, message, lineNumber,
                text);
    }

    @Override
    public String toString() {
        return "SourceLine{" + type + " @" + lineNumber + ": '" + text + "'}";
    }
}
