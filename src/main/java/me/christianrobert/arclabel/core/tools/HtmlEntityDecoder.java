package me.christianrobert.arclabel.core.tools;

import java.util.Map;

/**
 * Decodes HTML character references in label definitions.
 *
 * Layer files store label expressions inside XML/JSON, and some exporters escape
 * operators a second time (e.g. {@code &lt;&gt;} for {@code <>}, {@code &amp;} for {@code &}).
 *
 * Supports the named references that occur in practice plus decimal and hexadecimal
 * numeric references. Unknown or malformed references are left untouched.
 */
public class HtmlEntityDecoder {

  private static final Map<String, String> NAMED_ENTITIES = Map.of(
          "amp", "&",
          "lt", "<",
          "gt", ">",
          "quot", "\"",
          "apos", "'",
          "nbsp", "\u00A0"
  );

  // Longest supported reference body, e.g. "#x10FFFF"
  private static final int MAX_REFERENCE_LENGTH = 10;

  public static String decode(String text) {
    if (text == null || text.indexOf('&') < 0) {
      return text;
    }

    StringBuilder result = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char currentChar = text.charAt(i);
      if (currentChar != '&') {
        result.append(currentChar);
        i++;
        continue;
      }

      int semicolon = text.indexOf(';', i + 1);
      if (semicolon < 0 || semicolon - i - 1 > MAX_REFERENCE_LENGTH) {
        result.append(currentChar);
        i++;
        continue;
      }

      String decoded = decodeReference(text.substring(i + 1, semicolon));
      if (decoded == null) {
        result.append(currentChar);
        i++;
      } else {
        result.append(decoded);
        i = semicolon + 1;
      }
    }
    return result.toString();
  }

  private static String decodeReference(String body) {
    if (body.isEmpty()) {
      return null;
    }
    if (body.charAt(0) != '#') {
      return NAMED_ENTITIES.get(body.toLowerCase());
    }

    try {
      int codePoint;
      if (body.length() > 2 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')) {
        codePoint = Integer.parseInt(body.substring(2), 16);
      } else {
        codePoint = Integer.parseInt(body.substring(1));
      }
      if (!Character.isValidCodePoint(codePoint)) {
        return null;
      }
      return new String(Character.toChars(codePoint));
    } catch (NumberFormatException e) {
      // Not a numeric reference after all, keep the text as written
      return null;
    }
  }
}
