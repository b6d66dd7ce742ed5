package me.christianrobert.vbs2js.core.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level helpers for VBScript source lines.
 *
 * All methods are aware of double-quoted string literals (with "" as the escaped quote),
 * so keywords, separators and comment markers inside strings are never matched.
 */
public class CodeCleaner {

  /**
   * Removes a trailing ' comment from a line. The code part is returned untrimmed.
   */
  public static String removeComment(String line) {
    if (line == null) {
      return null;
    }

    boolean inString = false;  // Tracks if we're inside a double-quoted string

    for (int i = 0; i < line.length(); i++) {
      char currentChar = line.charAt(i);

      if (currentChar == '"') {
        // "" inside a string is an escaped quote, the toggle twice keeps the state
        inString = !inString;
        continue;
      }

      if (!inString && currentChar == '\'') {
        return line.substring(0, i);
      }
    }

    return line;
  }

  /**
   * Returns the comment text following the ' marker, or null when the line carries none.
   */
  public static String extractComment(String line) {
    if (line == null) {
      return null;
    }
    String code = removeComment(line);
    if (code.length() == line.length()) {
      return null;
    }
    return line.substring(code.length() + 1);
  }

  /**
   * Checks if a line ends with the line-continuation marker ( _).
   */
  public static boolean endsWithContinuation(String line) {
    if (line == null) {
      return false;
    }
    String code = removeComment(line).stripTrailing();
    if (!code.endsWith("_") || code.length() < 2) {
      return false;
    }
    char before = code.charAt(code.length() - 2);
    return before == ' ' || before == '\t';
  }

  /**
   * Strips the continuation marker and any comment from a continued line.
   */
  public static String removeContinuation(String line) {
    String code = removeComment(line).stripTrailing();
    return code.substring(0, code.length() - 1);
  }

  /**
   * Splits a line into statements on ':' separators outside string literals.
   * Empty segments are dropped, segments are trimmed.
   */
  public static List<String> splitStatements(String line) {
    return splitOutsideStrings(line, ':', false);
  }

  /**
   * Splits text on a separator that is outside string literals and outside parentheses.
   * Used for comma lists such as Case values, Dim lists and parameter lists.
   * Segments are trimmed; empty segments are kept so callers can detect them.
   */
  public static List<String> splitTopLevel(String text, char separator) {
    return splitOutsideStrings(text, separator, true);
  }

  private static List<String> splitOutsideStrings(String text, char separator, boolean keepEmpty) {
    List<String> parts = new ArrayList<>();
    if (text == null) {
      return parts;
    }

    boolean inString = false;
    int parenDepth = 0;
    int segmentStart = 0;

    for (int i = 0; i < text.length(); i++) {
      char currentChar = text.charAt(i);

      if (currentChar == '"') {
        inString = !inString;
        continue;
      }
      if (inString) {
        continue;
      }

      if (currentChar == '(') {
        parenDepth++;
      } else if (currentChar == ')') {
        parenDepth = Math.max(0, parenDepth - 1);
      } else if (currentChar == separator && (separator == ':' || parenDepth == 0)) {
        addSegment(parts, text.substring(segmentStart, i), keepEmpty);
        segmentStart = i + 1;
      }
    }

    addSegment(parts, text.substring(segmentStart), keepEmpty);
    return parts;
  }

  private static void addSegment(List<String> parts, String segment, boolean keepEmpty) {
    String trimmed = segment.trim();
    if (!trimmed.isEmpty() || keepEmpty) {
      parts.add(trimmed);
    }
  }

  /**
   * Finds a keyword outside string literals with word boundaries on both sides.
   *
   * @param text Text to search
   * @param keyword Keyword to find (case-insensitive)
   * @param fromIndex Position to start searching from
   * @return Index of the keyword, or -1 if not found
   */
  public static int indexOfKeyword(String text, String keyword, int fromIndex) {
    if (text == null || keyword == null) {
      return -1;
    }

    boolean inString = false;

    for (int i = 0; i < text.length(); i++) {
      char currentChar = text.charAt(i);

      if (currentChar == '"') {
        inString = !inString;
        continue;
      }

      if (!inString && i >= fromIndex && isKeywordAt(text, i, keyword)) {
        return i;
      }
    }

    return -1;
  }

  /**
   * Checks if a keyword appears at the given position with proper word boundaries.
   *
   * @param text Text to inspect
   * @param pos Position to check
   * @param keyword Keyword to match (case-insensitive)
   * @return true if keyword found at position
   */
  public static boolean isKeywordAt(String text, int pos, String keyword) {
    if (pos < 0 || pos + keyword.length() > text.length()) {
      return false;
    }

    if (!text.regionMatches(true, pos, keyword, 0, keyword.length())) {
      return false;
    }

    if (pos > 0 && isIdentifierChar(text.charAt(pos - 1))) {
      return false;
    }

    int after = pos + keyword.length();
    return after >= text.length() || !isIdentifierChar(text.charAt(after));
  }

  public static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /**
   * Reads an unsigned decimal literal.
   *
   * @param text Text to read (surrounding blanks allowed)
   * @return The value, or null if the text is not all digits or exceeds Integer.MAX_VALUE
   */
  public static Integer parseIntLiteral(String text) {
    if (text == null) {
      return null;
    }
    String digits = text.trim();
    if (digits.isEmpty()) {
      return null;
    }
    long value = 0;
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return null;
      }
      value = value * 10 + (c - '0');
      if (value > Integer.MAX_VALUE) {
        return null;
      }
    }
    return (int) value;
  }

  /**
   * Adds an offset to a literal bound, or spells the addition out when the result
   * would not be an int literal.
   *
   * @param bound Literal or expression text
   * @param offset Offset to add (typically 1 or -1)
   * @return The computed literal, or "bound + n" / "bound - n"
   */
  public static String offsetBound(String bound, int offset) {
    String trimmed = bound.trim();
    Integer value = parseIntLiteral(trimmed);
    if (value != null) {
      long shifted = (long) value + offset;
      if (shifted >= Integer.MIN_VALUE && shifted <= Integer.MAX_VALUE) {
        return String.valueOf(shifted);
      }
    }
    return offset < 0 ? trimmed + " - " + Math.abs((long) offset) : trimmed + " + " + offset;
  }
}
