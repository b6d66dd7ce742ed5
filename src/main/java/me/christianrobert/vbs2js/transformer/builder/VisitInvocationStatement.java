package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;
import me.christianrobert.vbs2js.transformer.builder.functions.BuiltinFunctionMapper;

import java.util.List;

/**
 * Procedure calls: {@code Call F(a)}, {@code F a, b}, {@code obj.m a} and bare {@code F}
 * all become {@code F(...);}.
 */
public class VisitInvocationStatement {

  public static String v(VbScriptParser.CallStatementContext ctx, JavaScriptCodeBuilder b) {
    return asStatement(ctx.memberChain(), b);
  }

  public static String v(VbScriptParser.InvocationStatementContext ctx, JavaScriptCodeBuilder b) {
    VbScriptParser.MemberChainContext chain = ctx.memberChain();
    if (ctx.argumentList() == null) {
      return asStatement(chain, b);
    }

    List<String> arguments = b.arguments(ctx.argumentList());

    // "MsgBox x" and "F a, b": the head is the callee
    if (chain.chainPart().isEmpty()) {
      String head = chain.IDENTIFIER().getText();
      if (!b.getContext().isUserDefined(head)) {
        String builtin = BuiltinFunctionMapper.map(head, arguments);
        if (builtin != null) {
          return builtin + ";";
        }
      }
      return b.getContext().canonical(head) + VisitMemberChain.call(arguments) + ";";
    }

    return VisitMemberChain.v(chain, b, VisitMemberChain.Mode.REFERENCE) + VisitMemberChain.call(arguments) + ";";
  }

  private static String asStatement(VbScriptParser.MemberChainContext chain, JavaScriptCodeBuilder b) {
    String rendered = VisitMemberChain.v(chain, b, VisitMemberChain.Mode.REFERENCE);
    List<VbScriptParser.ChainPartContext> parts = chain.chainPart();
    boolean endsWithArguments = !parts.isEmpty()
        && parts.get(parts.size() - 1) instanceof VbScriptParser.ArgumentsPartContext;
    // A bare name or member is a call without arguments
    if (!endsWithArguments && !rendered.endsWith(")")) {
      rendered += "()";
    }
    return rendered + ";";
  }
}
