package me.christianrobert.arclabel.core.tools;

import java.util.regex.Pattern;

/**
 * Unified utility class for rendering QGIS expression syntax.
 *
 * Every piece of target syntax the transformer emits goes through here:
 * - Field references: "Name"
 * - String literals: 'text' (embedded single quotes doubled)
 * - Expression variables: @name
 * - Scoped bindings: with_variable('name', value, body)
 */
public class QgisExpressionUtils {

  private static final Pattern VARIABLE_REFERENCE = Pattern.compile("@[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Quotes a field name as a QGIS field reference.
   *
   * @param fieldName Bare field name (no brackets)
   * @return "fieldName", with embedded double quotes doubled
   */
  public static String fieldReference(String fieldName) {
    return "\"" + fieldName.replace("\"", "\"\"") + "\"";
  }

  /**
   * Quotes a value as a QGIS string literal.
   *
   * A value consisting of a single apostrophe renders as {@code ''''}, which QGIS reads as a
   * one-character string.
   *
   * @param value Raw string value
   * @return 'value', with embedded single quotes doubled
   */
  public static String stringLiteral(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  /**
   * Reads a variable bound by an enclosing with_variable().
   */
  public static String variableReference(String variableName) {
    return "@" + variableName;
  }

  /**
   * Binds a variable for the evaluation of body.
   *
   * @param variableName Variable name (without @)
   * @param value Expression evaluated once and bound to the name
   * @param body Expression evaluated with the binding in scope
   * @return with_variable('variableName', value, body)
   */
  public static String withVariable(String variableName, String value, String body) {
    return "with_variable(" + stringLiteral(variableName) + ", " + value + ", " + body + ")";
  }

  /**
   * Checks whether an expression is nothing but a single variable reference (e.g. @t).
   * Such expressions never need parentheses when substituted into a larger expression.
   */
  public static boolean isVariableReference(String expression) {
    return expression != null && VARIABLE_REFERENCE.matcher(expression).matches();
  }
}
