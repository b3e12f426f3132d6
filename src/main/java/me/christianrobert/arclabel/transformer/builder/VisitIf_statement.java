package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.EnumSet;
import java.util.Set;

/**
 * If / ElseIf / Else chain.
 *
 * <pre>
 * VBScript:
 * If [A] = 1 Then
 *   t = t &amp; "x"
 * ElseIf [A] = 2 Then
 *   t = "two"
 * End If
 *
 * QGIS (base @t):
 * CASE WHEN "A" = 1 THEN @t || 'x' WHEN "A" = 2 THEN 'two' ELSE @t END
 * </pre>
 *
 * <p>Without an Else arm the fallback is the incoming base, so a non-matching feature keeps its
 * value. Every arm, and every condition, starts from the same base.</p>
 */
public class VisitIf_statement {

    private static final Set<LineType> BRANCH_END =
            EnumSet.of(LineType.ELSE_IF_HEADER, LineType.ELSE_HEADER, LineType.END_IF);
    private static final Set<LineType> ELSE_END = EnumSet.of(LineType.END_IF);

    public static String v(QgisExpressionBuilder b, String base) {
        SourceLine header = b.next();
        ConditionalBlock block = new ConditionalBlock();

        // STEP 1: If arm
        String condition = b.normalize(header.getValue(), base);
        block.addBranch(condition, VisitSeq_of_statements.v(b, header, base, BRANCH_END));

        // STEP 2: ElseIf arms, optional Else arm, End If
        String fallback = base;
        while (true) {
            SourceLine line = b.next();
            if (line.is(LineType.ELSE_IF_HEADER)) {
                String elseIfCondition = b.normalize(line.getValue(), base);
                block.addBranch(elseIfCondition, VisitSeq_of_statements.v(b, header, base, BRANCH_END));
            } else if (line.is(LineType.ELSE_HEADER)) {
                fallback = VisitSeq_of_statements.v(b, header, base, ELSE_END);
                b.next();  // End If
                break;
            } else {
                break;  // End If
            }
        }

        block.setFallback(fallback);
        return b.render(block);
    }
}
