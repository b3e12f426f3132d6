package me.christianrobert.arclabel.transformer.builder;

import me.christianrobert.arclabel.core.tools.QgisExpressionUtils;

import java.util.Map;

/**
 * Label expression for a field with a coded-value domain.
 *
 * <pre>
 * CASE WHEN "TYPE" = 'A' THEN 'Apple' WHEN "TYPE" = 'B' THEN 'Banana' END
 * </pre>
 *
 * <p>Codes are always compared as strings. There is no ELSE: a code missing from the domain
 * labels as NULL.</p>
 */
public class DomainCaseExpressionBuilder {

    /**
     * @param fieldName Field carrying the codes
     * @param codedValues Code → description, iteration order is kept
     * @param prettyPrint One WHEN per line
     * @return The CASE expression, or null if there are no coded values
     */
    public static String build(String fieldName, Map<String, String> codedValues, boolean prettyPrint) {
        if (codedValues == null || codedValues.isEmpty()) {
            return null;
        }

        String field = QgisExpressionUtils.fieldReference(fieldName);
        ConditionalBlock block = new ConditionalBlock();
        codedValues.forEach((code, description) -> block.addBranch(
                field + " = " + QgisExpressionUtils.stringLiteral(code),
                QgisExpressionUtils.stringLiteral(description != null ? description : code)));
        return block.render(prettyPrint);
    }
}
