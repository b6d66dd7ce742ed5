package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptParser;
import me.christianrobert.vbs2js.transformer.builder.functions.BuiltinFunctionMapper;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;

import java.util.List;

/**
 * Renders a reference such as {@code a}, {@code a(i)}, {@code obj.items(2).name} or {@code F(x, y)}.
 *
 * <p>The head decides what parentheses mean:</p>
 * <ul>
 *   <li>container from the knowledge base: {@code a(i, j)} -> {@code a[i][j]}</li>
 *   <li>built-in function not shadowed by a declaration: mapped by {@link BuiltinFunctionMapper}</li>
 *   <li>unknown name followed by a member: structured path, {@code seg(i).m} -> {@code seg[i].m}</li>
 *   <li>anything else: call syntax</li>
 * </ul>
 * <p>Later argument parts follow the structured-path rule: brackets when a member follows,
 * call syntax otherwise.</p>
 */
public class VisitMemberChain {

  public enum Mode {
    /** Value position: a bare callable name becomes an explicit call. */
    VALUE,
    /** Assignment target or statement callee: names are left as written. */
    REFERENCE
  }

  public static String v(VbScriptParser.MemberChainContext ctx, JavaScriptCodeBuilder b, Mode mode) {
    TranspilationContext context = b.getContext();
    String head = ctx.IDENTIFIER().getText();
    List<VbScriptParser.ChainPartContext> parts = ctx.chainPart();
    boolean userDefined = context.isUserDefined(head);

    if (!userDefined && BuiltinFunctionMapper.isUnsupportedFactory(head)) {
      return context.unknownConstruct(b.originalText(ctx)) + " null";
    }

    StringBuilder out = new StringBuilder();
    int index = 0;

    if ("me".equalsIgnoreCase(head) && !userDefined) {
      out.append("this");
    } else if (parts.isEmpty() || parts.get(0) instanceof VbScriptParser.MemberPartContext) {
      if (parts.isEmpty()) {
        String bare = renderBareName(head, context, userDefined, mode);
        if (bare != null) {
          return bare;
        }
      }
      out.append(context.canonical(head));
    } else {
      VbScriptParser.ArgumentsPartContext arguments = (VbScriptParser.ArgumentsPartContext) parts.get(0);
      List<String> rendered = b.arguments(arguments.argumentList());
      boolean followedByMember = parts.size() > 1 && parts.get(1) instanceof VbScriptParser.MemberPartContext;
      String builtin = userDefined ? null : BuiltinFunctionMapper.map(head, rendered);
      index = 1;

      if (context.isContainer(head)) {
        out.append(context.canonical(head)).append(indexAccess(rendered));
      } else if (builtin != null) {
        out.append(builtin);
      } else if (followedByMember && !context.getKnowledgeBase().isCallable(head)) {
        out.append(context.canonical(head)).append(indexAccess(rendered));
      } else {
        out.append(context.canonical(head)).append(call(rendered));
      }
    }

    for (; index < parts.size(); index++) {
      VbScriptParser.ChainPartContext part = parts.get(index);
      if (part instanceof VbScriptParser.MemberPartContext) {
        out.append('.').append(((VbScriptParser.MemberPartContext) part).identifierName().getText());
      } else {
        List<String> rendered = b.arguments(((VbScriptParser.ArgumentsPartContext) part).argumentList());
        boolean followedByMember = index + 1 < parts.size()
            && parts.get(index + 1) instanceof VbScriptParser.MemberPartContext;
        out.append(followedByMember ? indexAccess(rendered) : call(rendered));
      }
    }

    return out.toString();
  }

  /**
   * Handles a name with no member or argument part. Returns null when the name is
   * emitted as is.
   */
  private static String renderBareName(String name, TranspilationContext context, boolean userDefined, Mode mode) {
    if (!userDefined) {
      String constant = BuiltinFunctionMapper.constant(name);
      if (constant != null) {
        return constant;
      }
    }
    if (mode != Mode.VALUE) {
      return null;
    }
    if (context.shouldInvokeBare(name)) {
      return context.canonical(name) + "()";
    }
    if (!userDefined && BuiltinFunctionMapper.isParameterless(name)) {
      return BuiltinFunctionMapper.map(name, List.of());
    }
    return null;
  }

  static String indexAccess(List<String> indices) {
    StringBuilder sb = new StringBuilder();
    for (String index : indices) {
      sb.append('[').append(index).append(']');
    }
    return sb.toString();
  }

  static String call(List<String> arguments) {
    return "(" + String.join(", ", arguments) + ")";
  }
}
