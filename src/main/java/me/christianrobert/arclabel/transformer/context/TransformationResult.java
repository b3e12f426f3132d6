package me.christianrobert.arclabel.transformer.context;

/**
 * Result of a label transformation.
 * Contains either the QGIS expression (plus the "is expression" toggle) or an error message.
 */
public class TransformationResult {

    /**
     * Shape of the input that produced the result.
     */
    public enum InputKind {
        /** Function FindLabel(...) ... End Function */
        STRUCTURED_PROGRAM,
        /** Single-line fragment such as [A] & " " & [B] */
        EXPRESSION,
        /** Bare field name such as [Name] or table.Name */
        FIELD_NAME
    }

    private final boolean success;
    private final String qgisExpression;
    private final boolean expression;
    private final InputKind inputKind;
    private final String errorMessage;
    private final String sourceText;
    private final String labelName;  // Optional, set for batch results

    private TransformationResult(boolean success, String qgisExpression, boolean expression, InputKind inputKind,
                                 String errorMessage, String sourceText, String labelName) {
        this.success = success;
        this.qgisExpression = qgisExpression;
        this.expression = expression;
        this.inputKind = inputKind;
        this.errorMessage = errorMessage;
        this.sourceText = sourceText;
        this.labelName = labelName;
    }

    /**
     * Creates a successful transformation result.
     * The "is expression" toggle is false only for bare field names.
     */
    public static TransformationResult success(String sourceText, String qgisExpression, InputKind inputKind) {
        return new TransformationResult(true, qgisExpression, inputKind != InputKind.FIELD_NAME, inputKind,
                null, sourceText, null);
    }

    /**
     * Creates a failed transformation result.
     */
    public static TransformationResult failure(String sourceText, String errorMessage) {
        return new TransformationResult(false, null, false, null, errorMessage, sourceText, null);
    }

    /**
     * Creates a failed transformation result from an exception.
     */
    public static TransformationResult failure(String sourceText, TransformationException exception) {
        return new TransformationResult(false, null, false, null, exception.getDetailedMessage(), sourceText, null);
    }

    /**
     * Returns a copy of this result tagged with the label class it belongs to.
     */
    public TransformationResult withLabelName(String labelName) {
        return new TransformationResult(success, qgisExpression, expression, inputKind, errorMessage, sourceText,
                labelName);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getQgisExpression() {
        return qgisExpression;
    }

    /**
     * Whether the caller must treat {@link #getQgisExpression()} as an expression (true)
     * or as a plain field name (false).
     */
    public boolean isExpression() {
        return expression;
    }

    public InputKind getInputKind() {
        return inputKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getLabelName() {
        return labelName;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, qgisExpression='" + qgisExpression + "', expression=" +
                   expression + (labelName != null ? ", labelName='" + labelName + "'" : "") + "}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'" +
                   (labelName != null ? ", labelName='" + labelName + "'" : "") + "}";
        }
    }
}
