package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;
import org.antlr.v4.runtime.Token;

/**
 * Arithmetic and concatenation operators.
 *
 * ^ -> **, \ -> Math.trunc(a / b), Mod -> %, & -> +. The other operators keep their symbol.
 */
public class VisitArithmeticExpression {

  public static String v(VbScriptParser.PowerExpressionContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.ExpressionContext leftCtx = ctx.expression(0);
    VbScriptParser.ExpressionContext rightCtx = ctx.expression(1);
    Token pow = ctx.POW().getSymbol();

    // ^ groups left to right, ** right to left: 2 ^ 3 ^ 2 is (2 ** 3) ** 2
    String left = b.visit(leftCtx);
    if (leftCtx instanceof VbScriptParser.PowerExpressionContext) {
      left = "(" + left + ")";
    }
    return left + b.gap(leftCtx.getStop(), pow) + "**" + b.gap(pow, rightCtx.getStart()) + b.visit(rightCtx);
  }

  public static String v(VbScriptParser.UnaryExpressionContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.ExpressionContext operand = ctx.expression();
    String rendered = b.visit(operand);

    // JavaScript rejects a unary operator directly before a ** base
    if (operand instanceof VbScriptParser.PowerExpressionContext) {
      rendered = "(" + rendered + ")";
    }
    String gap = b.gap(ctx.op, operand.getStart());
    return ctx.op.getText() + separated(ctx.op.getText(), gap, rendered);
  }

  public static String v(VbScriptParser.MultiplicativeExpressionContext ctx, JavaScriptCodeBuilder b) {
    return binary(ctx.expression(0), ctx.op, ctx.op.getText(), ctx.expression(1), b);
  }

  public static String v(VbScriptParser.IntegerDivisionExpressionContext ctx, JavaScriptCodeBuilder b) {
    String left = b.visit(ctx.expression(0));
    String right = groupedMultiplicative(ctx.expression(1), b);
    return "Math.trunc(" + left + " / " + right + ")";
  }

  public static String v(VbScriptParser.ModuloExpressionContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.ExpressionContext leftCtx = ctx.expression(0);
    VbScriptParser.ExpressionContext rightCtx = ctx.expression(1);
    Token mod = ctx.MOD().getSymbol();

    // Mod binds looser than * and /, % does not: a Mod b * c is a % (b * c)
    return b.visit(leftCtx) + b.gap(leftCtx.getStop(), mod) + "%" + b.gap(mod, rightCtx.getStart())
        + groupedMultiplicative(rightCtx, b);
  }

  public static String v(VbScriptParser.AdditiveExpressionContext ctx, JavaScriptCodeBuilder b) {
    return binary(ctx.expression(0), ctx.op, ctx.op.getText(), ctx.expression(1), b);
  }

  public static String v(VbScriptParser.ConcatenationExpressionContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.ExpressionContext leftCtx = ctx.expression(0);
    VbScriptParser.ExpressionContext rightCtx = ctx.expression(1);
    String left = b.visit(leftCtx);
    String right = b.visit(rightCtx);

    // Addition binds tighter than & but not tighter than +: "a" & 1 + 2 must stay "a3"
    if (leftCtx instanceof VbScriptParser.AdditiveExpressionContext) {
      left = "(" + left + ")";
    }
    if (rightCtx instanceof VbScriptParser.AdditiveExpressionContext) {
      right = "(" + right + ")";
    }

    Token amp = ctx.AMP().getSymbol();
    return left + b.gap(leftCtx.getStop(), amp) + "+" + separated("+", b.gap(amp, rightCtx.getStart()), right);
  }

  static String binary(VbScriptParser.ExpressionContext leftCtx, Token operator, String jsOperator,
                       VbScriptParser.ExpressionContext rightCtx, JavaScriptCodeBuilder b) {
    return b.visit(leftCtx)
        + b.gap(leftCtx.getStop(), operator)
        + jsOperator
        + separated(jsOperator, b.gap(operator, rightCtx.getStart()), b.visit(rightCtx));
  }

  private static String groupedMultiplicative(VbScriptParser.ExpressionContext ctx, JavaScriptCodeBuilder b) {
    String rendered = b.visit(ctx);
    if (ctx instanceof VbScriptParser.MultiplicativeExpressionContext) {
      return "(" + rendered + ")";
    }
    return rendered;
  }

  /**
   * Joins an operator to its right operand. "a - -b" written without blanks would read as
   * the decrement operator, so a blank goes between two equal signs.
   */
  private static String separated(String operator, String gap, String operand) {
    if (gap.isEmpty() && !operand.isEmpty() && !operator.isEmpty()) {
      char last = operator.charAt(operator.length() - 1);
      if ((last == '-' || last == '+') && operand.charAt(0) == last) {
        return " " + operand;
      }
    }
    return gap + operand;
  }
}
