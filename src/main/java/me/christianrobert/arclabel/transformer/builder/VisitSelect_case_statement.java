package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.transformer.parser.LineType;
import me.christianrobert.arclabel.transformer.parser.SourceLine;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Select Case block.
 *
 * <pre>
 * VBScript:
 * Select Case [WellData_Penetration]
 *   Case 1599
 *     t = "&gt;1"
 *   Case 1, 2
 *     t = t &amp; " ft"
 * End Select
 *
 * QGIS (base @t):
 * CASE WHEN "WellData_Penetration" = 1599 THEN '&gt;1'
 *      WHEN "WellData_Penetration" IN (1, 2) THEN @t || ' ft'
 *      ELSE @t END
 * </pre>
 *
 * <p>Case arms do not chain: each one starts from the block's incoming base. Without Case Else the
 * fallback is the base. A compound selector is parenthesized before comparison.</p>
 */
public class VisitSelect_case_statement {

    private static final Set<LineType> BRANCH_END =
            EnumSet.of(LineType.CASE_HEADER, LineType.CASE_ELSE_HEADER, LineType.END_SELECT);

    public static String v(QgisExpressionBuilder b, String base) {
        SourceLine header = b.next();
        String selector = b.normalize(header.getValue(), base);
        if (selector.isEmpty()) {
            throw header.structuralError("Select Case without selector");
        }
        if (selector.chars().anyMatch(Character::isWhitespace)) {
            selector = "(" + selector + ")";
        }

        ConditionalBlock block = new ConditionalBlock();
        String fallback = base;
        boolean hasCaseElse = false;

        while (true) {
            SourceLine line = b.next();
            if (line == null || line.is(LineType.FUNCTION_END)) {
                throw QgisExpressionBuilder.unterminated(header);
            }

            switch (line.getType()) {
                case CASE_HEADER -> {
                    if (hasCaseElse) {
                        throw line.structuralError("'Case' after 'Case Else'");
                    }
                    String condition = caseCondition(selector, CaseValueParser.parse(line));
                    block.addBranch(condition, VisitSeq_of_statements.v(b, header, base, BRANCH_END));
                }
                case CASE_ELSE_HEADER -> {
                    if (hasCaseElse) {
                        throw line.structuralError("Duplicate 'Case Else'");
                    }
                    hasCaseElse = true;
                    fallback = VisitSeq_of_statements.v(b, header, base, BRANCH_END);
                }
                case END_SELECT -> {
                    if (block.isEmpty()) {
                        // Only Case Else, or no arm at all
                        return fallback;
                    }
                    block.setFallback(fallback);
                    return b.render(block);
                }
                default -> throw line.structuralError("Statement outside a 'Case' arm in Select Case");
            }
        }
    }

    private static String caseCondition(String selector, List<String> values) {
        if (values.size() == 1) {
            return selector + " = " + values.get(0);
        }
        return selector + " IN (" + String.join(", ", values) + ")";
    }
}
