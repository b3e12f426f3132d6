package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.Set;

/**
 * Body of one branch (If/ElseIf/Else arm or Case arm).
 *
 * <p>Threads the accumulator through the statements: each target assignment and each nested block
 * produces the value the next statement starts from. A body without assignments returns its base
 * unchanged. Stops, without consuming, at the first line whose type is one of the terminators.</p>
 */
public class VisitSeq_of_statements {

    public static String v(QgisExpressionBuilder b, SourceLine header, String base, Set<LineType> terminators) {
        String accumulator = base;

        while (true) {
            SourceLine line = b.peek();
            if (line == null || line.is(LineType.FUNCTION_END)) {
                throw QgisExpressionBuilder.unterminated(header);
            }
            if (terminators.contains(line.getType())) {
                return accumulator;
            }

            switch (line.getType()) {
                case ASSIGNMENT -> {
                    b.next();
                    accumulator = VisitAssignment_statement.v(b, line, accumulator);
                }
                case IF_HEADER -> accumulator = VisitIf_statement.v(b, accumulator);
                case SELECT_CASE_HEADER -> accumulator = VisitSelect_case_statement.v(b, accumulator);
                case DECLARATION -> b.next();
                case FUNCTION_HEADER -> throw line.structuralError("Nested Function is not allowed");
                default -> throw line.structuralError("'" + line.getType().getKeyword()
                        + "' does not match the open '" + header.getType().getKeyword() + "' block at line "
                        + header.getLineNumber());
            }
        }
    }
}
