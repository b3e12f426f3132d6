package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.context.TransformationContext;
import me.christianrobert.arclabel.transformer.context.TransformationException;
import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.List;

/**
 * Recursive-descent driver that turns classified label statements into one QGIS expression.
 *
 * <p>The builder owns the statement cursor; the grammar rules live in the static
 * {@code Visit*} helpers, which receive the builder and the accumulated expression they
 * start from and return the expression they produce. Nothing is mutated between rules
 * except the cursor position.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * List&lt;SourceLine&gt; lines = new LineClassifier().classify(cleanedCode);
 * String expression = new QgisExpressionBuilder(context, lines).build();
 * </pre>
 *
 * <p>A builder is single-use: create one per program.</p>
 */
public class QgisExpressionBuilder {

    // no logging is desired, the service logs the outcome per program

    private final TransformationContext context;
    private final List<SourceLine> lines;
    private int position;

    public QgisExpressionBuilder(TransformationContext context, List<SourceLine> lines) {
        this.context = context;
        this.lines = lines;
    }

    /**
     * Builds the complete expression for the program.
     *
     * @throws TransformationException on structural
     *         or unsupported-construct errors
     */
    public String build() {
        position = 0;
        return VisitFunctionBody.v(this);
    }

    public TransformationContext getContext() {
        return context;
    }

    // ========== Cursor ==========

    /**
     * The next statement without consuming it, or null at end of input.
     */
    SourceLine peek() {
        return position < lines.size() ? lines.get(position) : null;
    }

    SourceLine next() {
        return position < lines.size() ? lines.get(position++) : null;
    }

    boolean hasNext() {
        return position < lines.size();
    }

    // ========== Shared helpers ==========

    /**
     * Normalizes a fragment evaluated while the target variable holds {@code currentValue}.
     */
    String normalize(String fragment, String currentValue) {
        return LiteralNormalizer.normalize(fragment, context.scopeAt(currentValue));
    }

    String render(ConditionalBlock block) {
        return block.render(context.isPrettyPrint());
    }

    /**
     * Bound reference to the target variable, the base of every top-level block.
     */
    String targetReference() {
        return QgisExpressionUtils.variableReference(context.getTargetVariable());
    }

    /**
     * Error for a block that reaches end of input (or End Function) before its terminator.
     */
    static TransformationException unterminated(SourceLine header) {
        String terminator = header.is(LineType.SELECT_CASE_HEADER) ? "End Select" : "End If";
        return header.structuralError("Unterminated block: missing '" + terminator + "'");
    }
}
