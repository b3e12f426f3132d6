package me.christianrobert.arclabel.core.tools;

public class CodeCleaner {

  /**
   * Removes VBScript comments from label code.
   *
   * <p>An apostrophe outside a double-quoted literal starts a comment that runs to the end of
   * the line. A line whose first word is {@code Rem} is a comment as well. Newlines are always
   * preserved so line numbers stay stable for error reporting.</p>
   */
  public static String removeComments(String vbCode) {
    StringBuilder result = new StringBuilder();
    boolean inDoubleQuote = false;  // Tracks if we're inside a "..." literal
    boolean inComment = false;      // Tracks ' or Rem comment up to end of line
    boolean atLineStart = true;     // Only whitespace seen since the last newline

    for (int i = 0; i < vbCode.length(); i++) {
      char currentChar = vbCode.charAt(i);

      if (currentChar == '\n') {
        // Literals never span lines in VBScript
        inComment = false;
        inDoubleQuote = false;
        atLineStart = true;
        result.append(currentChar);
        continue;
      }

      if (inComment) {
        continue;
      }

      if (inDoubleQuote) {
        // "" inside a literal toggles out and straight back in, so no special case needed
        result.append(currentChar);
        if (currentChar == '"') {
          inDoubleQuote = false;
        }
        continue;
      }

      if (atLineStart && !Character.isWhitespace(currentChar)) {
        atLineStart = false;
        if (isRemKeywordAt(vbCode, i)) {
          inComment = true;
          continue;
        }
      }

      if (currentChar == '\'') {
        inComment = true;
        continue;
      }

      if (currentChar == '"') {
        inDoubleQuote = true;
      }

      result.append(currentChar);
    }

    return result.toString();
  }

  private static boolean isRemKeywordAt(String code, int pos) {
    if (!code.regionMatches(true, pos, "REM", 0, 3)) {
      return false;
    }
    int after = pos + 3;
    return after >= code.length() || Character.isWhitespace(code.charAt(after));
  }
}
