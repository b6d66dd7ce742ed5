package me.christianrobert.vbs2js.transformer.builder.functions;

import me.christianrobert.vbs2js.core.tools.CodeCleaner;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps VBScript built-in functions and constants to JavaScript library calls.
 *
 * <p>Arguments arrive already transpiled. A name that is not a built-in, or a call with an
 * argument count the mapping does not cover, yields null and the caller keeps call syntax.</p>
 *
 * <p>Handles:
 * <ul>
 *   <li>Strings: Chr, ChrW, Asc, AscW, UCase, LCase, Len, Trim, LTrim, RTrim, Left, Right, Mid,
 *       InStr, Replace, Split, Join, Space, StrReverse</li>
 *   <li>Arrays: UBound, LBound</li>
 *   <li>Conversion: CInt, CLng, CDbl, CSng, CStr, CBool, Hex</li>
 *   <li>Math: Int, Fix, Round, Abs, Sqr, Sgn, Rnd</li>
 *   <li>Date: Now</li>
 *   <li>Tests: IsEmpty, IsNull, IsNumeric, IsArray, IsObject</li>
 *   <li>Interaction: MsgBox, InputBox</li>
 * </ul>
 */
public class BuiltinFunctionMapper {

  private static final Pattern SIMPLE_OPERAND = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$.\\[\\]]*$|^\"(?:[^\"\\\\]|\\\\.)*\"$");

  private static final Map<String, String> CONSTANTS = Map.of(
      "vbcrlf", "\"\\r\\n\"",
      "vbcr", "\"\\r\"",
      "vblf", "\"\\n\"",
      "vbtab", "\"\\t\"",
      "vbnewline", "\"\\r\\n\"",
      "vbnullstring", "\"\"");

  private static final Set<String> PARAMETERLESS = Set.of("now", "rnd");

  private static final Set<String> UNSUPPORTED_FACTORIES = Set.of("createobject", "getobject");

  /**
   * JavaScript literal for a VBScript string constant such as vbCrLf, or null.
   */
  public static String constant(String name) {
    return CONSTANTS.get(name.toLowerCase());
  }

  /**
   * True for built-ins that are called without parentheses (Now, Rnd).
   */
  public static boolean isParameterless(String name) {
    return PARAMETERLESS.contains(name.toLowerCase());
  }

  /**
   * True for object factories (CreateObject, GetObject) that have no JavaScript counterpart.
   */
  public static boolean isUnsupportedFactory(String name) {
    return UNSUPPORTED_FACTORIES.contains(name.toLowerCase());
  }

  /**
   * Maps a built-in call.
   *
   * @param name Function name as written (case-insensitive)
   * @param args Transpiled arguments
   * @return JavaScript expression, or null when the call is not a mapped built-in
   */
  public static String map(String name, List<String> args) {
    int n = args.size();
    switch (name.toLowerCase()) {
      // ===== Strings =====
      case "chr":
      case "chrw":
        return n == 1 ? "String.fromCharCode(" + args.get(0) + ")" : null;
      case "asc":
      case "ascw":
        return n == 1 ? wrap(args.get(0)) + ".charCodeAt(0)" : null;
      case "ucase":
        return n == 1 ? wrap(args.get(0)) + ".toUpperCase()" : null;
      case "lcase":
        return n == 1 ? wrap(args.get(0)) + ".toLowerCase()" : null;
      case "len":
        return n == 1 ? "String(" + args.get(0) + ").length" : null;
      case "trim":
        return n == 1 ? wrap(args.get(0)) + ".trim()" : null;
      case "ltrim":
        return n == 1 ? wrap(args.get(0)) + ".trimStart()" : null;
      case "rtrim":
        return n == 1 ? wrap(args.get(0)) + ".trimEnd()" : null;
      case "left":
        return n == 2 ? wrap(args.get(0)) + ".substring(0, " + args.get(1) + ")" : null;
      case "right":
        return n == 2 ? wrap(args.get(0)) + ".substring(" + wrap(args.get(0)) + ".length - " + wrap(args.get(1)) + ")" : null;
      case "mid":
        return mapMid(args);
      case "instr":
        return mapInStr(args);
      case "replace":
        return n == 3 ? wrap(args.get(0)) + ".split(" + args.get(1) + ").join(" + args.get(2) + ")" : null;
      case "split":
        if (n == 1) {
          return wrap(args.get(0)) + ".split(\" \")";
        }
        return n == 2 ? wrap(args.get(0)) + ".split(" + args.get(1) + ")" : null;
      case "join":
        if (n == 1) {
          return wrap(args.get(0)) + ".join(\" \")";
        }
        return n == 2 ? wrap(args.get(0)) + ".join(" + args.get(1) + ")" : null;
      case "space":
        return n == 1 ? "\" \".repeat(" + args.get(0) + ")" : null;
      case "strreverse":
        return n == 1 ? wrap(args.get(0)) + ".split(\"\").reverse().join(\"\")" : null;

      // ===== Arrays =====
      case "ubound":
        return n == 1 ? "(" + wrap(args.get(0)) + ".length - 1)" : null;
      case "lbound":
        return n == 1 ? "0" : null;

      // ===== Conversion =====
      case "cint":
      case "clng":
        return n == 1 ? "parseInt(" + args.get(0) + ", 10)" : null;
      case "cdbl":
      case "csng":
        return n == 1 ? "parseFloat(" + args.get(0) + ")" : null;
      case "cstr":
        return n == 1 ? "String(" + args.get(0) + ")" : null;
      case "cbool":
        return n == 1 ? "Boolean(" + args.get(0) + ")" : null;
      case "hex":
        return n == 1 ? wrap(args.get(0)) + ".toString(16).toUpperCase()" : null;

      // ===== Math =====
      case "int":
        return n == 1 ? "Math.floor(" + args.get(0) + ")" : null;
      case "fix":
        return n == 1 ? "Math.trunc(" + args.get(0) + ")" : null;
      case "round":
        if (n == 1) {
          return "Math.round(" + args.get(0) + ")";
        }
        return n == 2 ? "Number((" + args.get(0) + ").toFixed(" + args.get(1) + "))" : null;
      case "abs":
        return n == 1 ? "Math.abs(" + args.get(0) + ")" : null;
      case "sqr":
        return n == 1 ? "Math.sqrt(" + args.get(0) + ")" : null;
      case "sgn":
        return n == 1 ? "Math.sign(" + args.get(0) + ")" : null;
      case "rnd":
        return n <= 1 ? "Math.random()" : null;

      // ===== Date =====
      case "now":
        return n == 0 ? "new Date()" : null;

      // ===== Tests =====
      case "isempty":
        return n == 1 ? "(" + args.get(0) + " === undefined || " + args.get(0) + " === \"\")" : null;
      case "isnull":
        return n == 1 ? "(" + args.get(0) + " === null)" : null;
      case "isnumeric":
        return n == 1 ? "!isNaN(parseFloat(" + args.get(0) + "))" : null;
      case "isarray":
        return n == 1 ? "Array.isArray(" + args.get(0) + ")" : null;
      case "isobject":
        return n == 1 ? "(typeof " + args.get(0) + " === \"object\")" : null;

      // ===== Interaction =====
      case "msgbox":
        // Buttons and title have no counterpart in alert()
        return n >= 1 ? "alert(" + args.get(0) + ")" : null;
      case "inputbox":
        if (n == 1 || n == 2) {
          return "prompt(" + args.get(0) + ")";
        }
        return n >= 3 ? "prompt(" + args.get(0) + ", " + args.get(2) + ")" : null;

      default:
        return null;
    }
  }

  private static String mapMid(List<String> args) {
    if (args.size() != 2 && args.size() != 3) {
      return null;
    }
    String start = args.get(1).trim();
    String zeroBased = CodeCleaner.offsetBound(start, -1);
    String result = wrap(args.get(0)) + ".substr(" + zeroBased;
    if (args.size() == 3) {
      result += ", " + args.get(2);
    }
    return result + ")";
  }

  private static String mapInStr(List<String> args) {
    if (args.size() == 2) {
      return "(" + wrap(args.get(0)) + ".indexOf(" + args.get(1) + ") + 1)";
    }
    if (args.size() == 3 || args.size() == 4) {
      // InStr(start, string, search[, compare]); compare mode is ignored
      String start = args.get(0).trim();
      String zeroBased = CodeCleaner.offsetBound(start, -1);
      return "(" + wrap(args.get(1)) + ".indexOf(" + args.get(2) + ", " + zeroBased + ") + 1)";
    }
    return null;
  }

  /**
   * Parenthesizes an operand unless it is a plain name, member path or string literal.
   */
  static String wrap(String operand) {
    String trimmed = operand.trim();
    return SIMPLE_OPERAND.matcher(trimmed).matches() ? trimmed : "(" + trimmed + ")";
  }
}
