package me.christianrobert.arclabel.transformer.context;

/**
 * Exception thrown during label expression transformation.
 * Captures the kind of failure and the offending source line.
 */
public class TransformationException extends RuntimeException {

    /**
     * Failure categories. Both abort the transformation of the current definition only.
     */
    public enum Kind {
        /** Unterminated or mismatched block, missing target variable, write to a foreign variable. */
        STRUCTURAL,
        /** Construct outside the supported grammar (loops, subroutine calls, arrays, Case ranges). */
        UNSUPPORTED_CONSTRUCT
    }

    private final Kind kind;
    private final int lineNumber;
    private final String lineText;

    public TransformationException(String message) {
        this(Kind.STRUCTURAL, message, 0, null);
    }

    public TransformationException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public TransformationException(Kind kind, String message, int lineNumber, String lineText) {
        super(message);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.lineText = lineText;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 1-based line number of the offending line, or 0 when the error is not tied to a line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLineText() {
        return lineText;
    }

    /**
     * Gets a detailed error message including the offending line.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (lineNumber > 0) {
            sb.append("\nLine ").append(lineNumber).append(": ").append(lineText);
        }
        return sb.toString();
    }
}
