package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;
import me.christianrobert.arclabel.transformer.context.TransformationContext;
import me.christianrobert.arclabel.transformer.context.TransformationException;
import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level rule: function wrapper, initial-assignment chain, update blocks, return.
 *
 * <pre>
 * Function FindLabel([NAME])          ← optional, name replaces the configured one
 *   t = [NAME]                        ← initial assignments (last one is the target)
 *   If t = "Salt Dome" Then           ← update block 1, base @t
 *     t = ""
 *   End If
 *   t = t &amp; "!"                       ← update block 2, base @t
 *   FindLabel = t                     ← return, must be last
 * End Function
 * </pre>
 *
 * <p>Output, built inside out:</p>
 * <pre>
 * with_variable('t', "NAME",
 *   with_variable('t', CASE WHEN @t = 'Salt Dome' THEN '' ELSE @t END,
 *     with_variable('t', @t || '!',
 *       @t)))
 * </pre>
 */
public class VisitFunctionBody {

    public static String v(QgisExpressionBuilder b) {
        TransformationContext context = b.getContext();

        // STEP 1: Optional function wrapper
        SourceLine header = null;
        if (b.peek() != null && b.peek().is(LineType.FUNCTION_HEADER)) {
            header = b.next();
            context.setFunctionName(header.getName());
        }

        // STEP 2: Initial-assignment chain, up to the first control-flow header
        SourceLine line;
        while ((line = b.peek()) != null && (line.is(LineType.ASSIGNMENT) || line.is(LineType.DECLARATION))) {
            if (line.is(LineType.ASSIGNMENT) && isReturnOfVariable(line, context)) {
                break;
            }
            b.next();
            if (line.is(LineType.ASSIGNMENT)) {
                // Only variables assigned so far are in scope
                String initializer = LiteralNormalizer.normalize(line.getValue(), context.externalScope());
                context.addInitialAssignment(line.getName(), initializer, line.getLineNumber());
            }
        }

        if (!context.hasInitialAssignments()) {
            String message = "No initial assignment found; cannot determine the target variable";
            SourceLine offending = b.peek();
            if (offending != null) {
                throw offending.structuralError(message);
            }
            throw new TransformationException(TransformationException.Kind.STRUCTURAL, message);
        }

        // STEP 3: Update blocks in source order, each based on the bound target value
        List<String> updates = new ArrayList<>();
        String terminal = null;
        while (terminal == null && (line = b.peek()) != null && !line.is(LineType.FUNCTION_END)) {
            switch (line.getType()) {
                case IF_HEADER -> updates.add(VisitIf_statement.v(b, b.targetReference()));
                case SELECT_CASE_HEADER -> updates.add(VisitSelect_case_statement.v(b, b.targetReference()));
                case DECLARATION -> b.next();
                case ASSIGNMENT -> {
                    if (context.isTargetVariable(line.getName())) {
                        b.next();
                        updates.add(VisitAssignment_statement.v(b, line, b.targetReference()));
                    } else if (context.isFunctionName(line.getName())) {
                        terminal = VisitReturn_statement.v(b);
                    } else {
                        throw line.structuralError("Assignment to '" + line.getName()
                                + "' after the first block; only the target variable '"
                                + context.getTargetVariable() + "' may be reassigned");
                    }
                }
                case FUNCTION_HEADER -> throw line.structuralError("Nested Function is not allowed");
                default -> throw line.structuralError("'" + line.getType().getKeyword()
                        + "' without matching block header");
            }
        }

        // STEP 4: Function terminator
        SourceLine end = b.next();
        if (header != null) {
            if (end == null) {
                throw header.structuralError("Function without 'End Function'");
            }
        } else if (end != null) {
            throw end.structuralError("'End Function' without 'Function' header");
        }
        if (b.hasNext()) {
            throw b.peek().structuralError("Statement after 'End Function'");
        }

        // STEP 5: Assemble inside out
        String target = context.getTargetVariable();
        String result = terminal != null ? terminal : b.targetReference();
        for (int i = updates.size() - 1; i >= 0; i--) {
            result = QgisExpressionUtils.withVariable(target, updates.get(i), result);
        }
        List<TransformationContext.VariableDefinition> initial = context.getInitialAssignments();
        for (int i = initial.size() - 1; i >= 0; i--) {
            TransformationContext.VariableDefinition definition = initial.get(i);
            result = QgisExpressionUtils.withVariable(definition.getVariableName(),
                    definition.getQgisInitializer(), result);
        }
        return result;
    }

    /**
     * {@code FindLabel = x} where x is an already assigned variable ends the assignment chain.
     * {@code FindLabel = <anything else>} is an ordinary assignment to a variable named FindLabel.
     */
    private static boolean isReturnOfVariable(SourceLine line, TransformationContext context) {
        return context.isFunctionName(line.getName())
                && context.resolveVariable(line.getValue().trim()) != null;
    }
}
