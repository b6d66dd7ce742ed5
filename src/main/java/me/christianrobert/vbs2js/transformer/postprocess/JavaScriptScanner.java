package me.christianrobert.vbs2js.transformer.postprocess;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level helpers for generated JavaScript.
 *
 * Every post-processing step works on code positions only: the contents of string literals
 * ('...', "...", `...`) and comments (// and block comments) are never rewritten.
 */
public class JavaScriptScanner {

  /**
   * Marks each character of the text as code (true) or as part of a string or comment (false).
   * Quote and comment delimiters themselves count as non-code.
   */
  public static boolean[] codeMask(String text) {
    boolean[] code = new boolean[text.length()];
    char quote = 0;          // Active string delimiter, 0 outside strings
    boolean lineComment = false;
    boolean blockComment = false;

    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;

      if (lineComment) {
        if (c == '\n') {
          lineComment = false;
          code[i] = true;
        }
        continue;
      }
      if (blockComment) {
        if (c == '*' && next == '/') {
          blockComment = false;
          i++;
        }
        continue;
      }
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote || (c == '\n' && quote != '`')) {
          quote = 0;
        }
        continue;
      }

      if (c == '/' && next == '/') {
        lineComment = true;
        i++;
      } else if (c == '/' && next == '*') {
        blockComment = true;
        i++;
      } else if (c == '"' || c == '\'' || c == '`') {
        quote = c;
      } else {
        code[i] = true;
      }
    }
    return code;
  }

  /**
   * Counts a character in code positions.
   */
  public static int countInCode(String text, boolean[] mask, char target) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (mask[i] && text.charAt(i) == target) {
        count++;
      }
    }
    return count;
  }

  /**
   * Finds the parenthesis closing the one at openIndex, skipping strings and comments.
   *
   * @return Index of the matching ')', or -1 when the text ends first
   */
  public static int findClosingParenthesis(String text, boolean[] mask, int openIndex) {
    int depth = 0;
    for (int i = openIndex; i < text.length(); i++) {
      if (!mask[i]) {
        continue;
      }
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  /**
   * Splits an argument list on commas that are in code and outside nested brackets.
   * Segments are trimmed.
   */
  public static List<String> splitArguments(String arguments) {
    List<String> parts = new ArrayList<>();
    if (arguments.trim().isEmpty()) {
      return parts;
    }
    boolean[] mask = codeMask(arguments);
    int depth = 0;
    int start = 0;
    for (int i = 0; i < arguments.length(); i++) {
      if (!mask[i]) {
        continue;
      }
      char c = arguments.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(arguments.substring(start, i).trim());
        start = i + 1;
      }
    }
    parts.add(arguments.substring(start).trim());
    return parts;
  }

  public static boolean isIdentifierChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }
}
