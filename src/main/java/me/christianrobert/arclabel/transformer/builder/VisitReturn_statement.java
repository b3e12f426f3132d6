package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.context.TransformationContext;
import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

/**
 * Return assignment {@code FindLabel = value}.
 *
 * <p>Returning the target variable yields its bound reference. Any other value is normalized with
 * every variable read from its binding and becomes the terminal of the binding chain. Only
 * {@code End Function} may follow.</p>
 */
public class VisitReturn_statement {

    public static String v(QgisExpressionBuilder b) {
        TransformationContext context = b.getContext();
        SourceLine line = b.next();

        String terminal;
        if (context.isTargetVariable(line.getValue().trim())) {
            terminal = b.targetReference();
        } else {
            terminal = LiteralNormalizer.normalize(line.getValue(), context.externalScope());
        }

        SourceLine following = b.peek();
        if (following != null && !following.is(LineType.FUNCTION_END)) {
            throw following.structuralError("Statement after return assignment to '" + line.getName()
                    + "'; the return must be the last statement");
        }
        return terminal;
    }
}
