package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;
import org.antlr.v4.runtime.Token;

public class VisitAssignmentStatement {
  public static String v(VbScriptParser.AssignmentStatementContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.MemberChainContext target = ctx.memberChain();
    VbScriptParser.ExpressionContext value = ctx.expression();
    Token eq = ctx.EQ().getSymbol();

    // Function result: "Total = x + y" inside Function Total
    if (target.chainPart().isEmpty() && b.getContext().isReturnTarget(target.IDENTIFIER().getText())) {
      return "return " + b.visit(value) + ";";
    }

    // Set only marks object assignment; it has no counterpart
    String left = VisitMemberChain.v(target, b, VisitMemberChain.Mode.REFERENCE);
    return left + b.gap(target.getStop(), eq) + "=" + b.gap(eq, value.getStart()) + b.visit(value) + ";";
  }
}
