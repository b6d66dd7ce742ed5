package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;

public class VisitLiteral {
  public static String v(VbScriptParser.LiteralContext ctx, JavaScriptCodeBuilder b) {
    String text = ctx.getText();

    switch (ctx.getStart().getType()) {
      case VbScriptParser.STRING:
        return toJavaScriptString(text);
      case VbScriptParser.DATE_LITERAL:
        // #1/31/2024# -> new Date("1/31/2024")
        return "new Date(\"" + text.substring(1, text.length() - 1).trim() + "\")";
      case VbScriptParser.TRUE:
        return "true";
      case VbScriptParser.FALSE:
        return "false";
      case VbScriptParser.NOTHING:
      case VbScriptParser.NULL:
        return "null";
      case VbScriptParser.EMPTY:
        return "\"\"";
      default:
        return text;
    }
  }

  /**
   * Converts a quoted VBScript string literal into a JavaScript one.
   * VBScript has no escapes except the doubled quote, so backslashes become literal.
   */
  public static String toJavaScriptString(String vbsLiteral) {
    String inner = vbsLiteral.substring(1, vbsLiteral.length() - 1);
    String escaped = inner
        .replace("\\", "\\\\")
        .replace("\"\"", "\\\"");
    return "\"" + escaped + "\"";
  }
}
