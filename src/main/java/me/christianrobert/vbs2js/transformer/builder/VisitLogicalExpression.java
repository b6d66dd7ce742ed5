package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;

/**
 * Logical operators: Not -> !, And -> &&, Or -> ||, Xor -> ^, Eqv -> ===, Imp -> (!a || b).
 *
 * Xor, Eqv and Imp bind looser than And/Or and comparisons in VBScript but not in
 * JavaScript, so their compound operands are parenthesized.
 */
public class VisitLogicalExpression {

  public static String v(VbScriptParser.NotExpressionContext ctx, JavaScriptCodeBuilder b) {
    return "!" + wrapCompound(ctx.expression(), b);
  }

  public static String v(VbScriptParser.AndExpressionContext ctx, JavaScriptCodeBuilder b) {
    return VisitArithmeticExpression.binary(ctx.expression(0), ctx.AND().getSymbol(), "&&", ctx.expression(1), b);
  }

  public static String v(VbScriptParser.OrExpressionContext ctx, JavaScriptCodeBuilder b) {
    return VisitArithmeticExpression.binary(ctx.expression(0), ctx.OR().getSymbol(), "||", ctx.expression(1), b);
  }

  public static String v(VbScriptParser.XorExpressionContext ctx, JavaScriptCodeBuilder b) {
    return wrapCompound(ctx.expression(0), b) + " ^ " + wrapCompound(ctx.expression(1), b);
  }

  public static String v(VbScriptParser.EqvExpressionContext ctx, JavaScriptCodeBuilder b) {
    return wrapCompound(ctx.expression(0), b) + " === " + wrapCompound(ctx.expression(1), b);
  }

  public static String v(VbScriptParser.ImpExpressionContext ctx, JavaScriptCodeBuilder b) {
    return "(!" + wrapCompound(ctx.expression(0), b) + " || " + wrapCompound(ctx.expression(1), b) + ")";
  }

  private static String wrapCompound(VbScriptParser.ExpressionContext ctx, JavaScriptCodeBuilder b) {
    String rendered = b.visit(ctx);
    if (ctx instanceof VbScriptParser.PrimaryExpressionContext || ctx instanceof VbScriptParser.NotExpressionContext) {
      return rendered;
    }
    return "(" + rendered + ")";
  }
}
