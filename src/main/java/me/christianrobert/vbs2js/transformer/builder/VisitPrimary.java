package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;

public class VisitPrimary {

  public static String v(VbScriptParser.ParenthesizedPrimaryContext ctx, JavaScriptCodeBuilder b) {
    return "("
        + b.gap(ctx.LPAREN().getSymbol(), ctx.expression().getStart())
        + b.visit(ctx.expression())
        + b.gap(ctx.expression().getStop(), ctx.RPAREN().getSymbol())
        + ")";
  }

  public static String v(VbScriptParser.NewPrimaryContext ctx, JavaScriptCodeBuilder b) {
    // Class instances have no counterpart
    return b.getContext().unknownConstruct(b.originalText(ctx)) + " null";
  }
}
