package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.context.TransformationContext;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

/**
 * Assignment inside a block body or between top-level blocks.
 *
 * <p>Only the target variable may be reassigned. The right-hand side sees the target as the
 * accumulator in force, so {@code t = t & "a"} followed by {@code t = t & "b"} composes to
 * {@code (@t || 'a') || 'b'}.</p>
 */
public class VisitAssignment_statement {

    /**
     * @param line Already consumed ASSIGNMENT line
     * @param accumulator Target value before this assignment
     * @return Target value after this assignment
     */
    public static String v(QgisExpressionBuilder b, SourceLine line, String accumulator) {
        TransformationContext context = b.getContext();

        if (context.isTargetVariable(line.getName())) {
            return b.normalize(line.getValue(), accumulator);
        }
        if (context.isFunctionName(line.getName())) {
            throw line.unsupportedError("Return assignment inside a block; multiple return points are not supported");
        }
        throw line.structuralError("Assignment to '" + line.getName() + "' inside a block; only the target variable '"
                + context.getTargetVariable() + "' may be reassigned");
    }
}
