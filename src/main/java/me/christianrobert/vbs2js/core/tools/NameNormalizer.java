package me.christianrobert.vbs2js.core.tools;

import java.util.regex.Pattern;

/**
 * Utility class for normalizing VBScript identifier names.
 *
 * VBScript identifiers are case-insensitive: Total, TOTAL and total name the same
 * variable. JavaScript identifiers are not, so every lookup key used by the
 * transpiler goes through this class, while the emitted code keeps the spelling
 * from the declaration.
 *
 * Examples:
 * - Total -> total
 * - "  myArray " -> myarray
 */
public class NameNormalizer {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Normalizes an identifier into a lookup key (trimmed, lowercase).
   *
   * @param identifier The identifier as written in the source (may be null)
   * @return The lookup key, or null for null input
   */
  public static String normalizeIdentifier(String identifier) {
    if (identifier == null) {
      return identifier;
    }

    String trimmed = identifier.trim();
    if (trimmed.isEmpty()) {
      return trimmed;
    }

    return trimmed.toLowerCase();
  }

  /**
   * Checks if a string is a plain VBScript identifier (letter or underscore first,
   * then letters, digits, underscores).
   *
   * @param identifier The candidate
   * @return true if the candidate is a valid identifier
   */
  public static boolean isValidIdentifier(String identifier) {
    if (identifier == null) {
      return false;
    }
    return IDENTIFIER.matcher(identifier.trim()).matches();
  }

  /**
   * Compares two identifiers the way VBScript does (ignoring case and surrounding blanks).
   */
  public static boolean sameIdentifier(String a, String b) {
    if (a == null || b == null) {
      return false;
    }
    return normalizeIdentifier(a).equals(normalizeIdentifier(b));
  }
}
