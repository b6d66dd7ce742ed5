package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;

public class VisitComparisonExpression {
  public static String v(VbScriptParser.ComparisonExpressionContext ctx, JavaScriptCodeBuilder b) {

    // Every '=' reached here is a comparison: the assignment '=' belongs to the statement rule
    String jsOperator;
    switch (ctx.op.getType()) {
      case VbScriptParser.EQ:
      case VbScriptParser.IS:
        jsOperator = "===";
        break;
      case VbScriptParser.NE:
        jsOperator = "!==";
        break;
      case VbScriptParser.LE:
        jsOperator = "<=";
        break;
      case VbScriptParser.GE:
        jsOperator = ">=";
        break;
      default:
        jsOperator = ctx.op.getText();
    }

    return VisitArithmeticExpression.binary(ctx.expression(0), ctx.op, jsOperator, ctx.expression(1), b);
  }
}
