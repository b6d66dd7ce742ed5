package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.antlr.VbScriptBaseVisitor;
import me.christianrobert.vbs2js.antlr.VbScriptParser;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a VBScript statement or expression parse tree as JavaScript text.
 *
 * <p>Each grammar alternative is handled by a static Visit* helper; this class only
 * dispatches and offers the shared helpers. Spacing between operands is copied from the
 * hidden whitespace tokens, so {@code x=1} stays compact and {@code x = 1} keeps its blanks.</p>
 */
public class JavaScriptCodeBuilder extends VbScriptBaseVisitor<String> {

    // no logging is desired, this runs once per statement

    private final TranspilationContext context;
    private final BufferedTokenStream tokens;

    public JavaScriptCodeBuilder(TranspilationContext context, BufferedTokenStream tokens) {
        this.context = context;
        this.tokens = tokens;
    }

    public TranspilationContext getContext() {
        return context;
    }

    // ========== Shared helpers ==========

    /**
     * Whitespace found between two tokens in the source (empty when they touch).
     */
    public String gap(Token left, Token right) {
        if (left == null || right == null || right.getTokenIndex() - left.getTokenIndex() <= 1) {
            return "";
        }
        return tokens.getText(Interval.of(left.getTokenIndex() + 1, right.getTokenIndex() - 1));
    }

    /**
     * Source text of a subtree, whitespace included.
     */
    public String originalText(ParserRuleContext ctx) {
        return tokens.getText(ctx.getSourceInterval());
    }

    /**
     * Renders every argument of a call; a missing list yields an empty list.
     */
    public List<String> arguments(VbScriptParser.ArgumentListContext ctx) {
        List<String> rendered = new ArrayList<>();
        if (ctx == null) {
            return rendered;
        }
        for (VbScriptParser.ExpressionContext argument : ctx.expression()) {
            rendered.add(visit(argument));
        }
        return rendered;
    }

    // ========== Entry points ==========

    @Override
    public String visitStatementLine(VbScriptParser.StatementLineContext ctx) {
        return visit(ctx.statement());
    }

    @Override
    public String visitExpressionLine(VbScriptParser.ExpressionLineContext ctx) {
        return visit(ctx.expression());
    }

    // ========== Statements ==========

    @Override
    public String visitAssignmentStatement(VbScriptParser.AssignmentStatementContext ctx) {
        return VisitAssignmentStatement.v(ctx, this);
    }

    @Override
    public String visitCallStatement(VbScriptParser.CallStatementContext ctx) {
        return VisitInvocationStatement.v(ctx, this);
    }

    @Override
    public String visitInvocationStatement(VbScriptParser.InvocationStatementContext ctx) {
        return VisitInvocationStatement.v(ctx, this);
    }

    @Override
    public String visitArgumentList(VbScriptParser.ArgumentListContext ctx) {
        return String.join(", ", arguments(ctx));
    }

    // ========== Expressions ==========

    @Override
    public String visitPrimaryExpression(VbScriptParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public String visitPowerExpression(VbScriptParser.PowerExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitUnaryExpression(VbScriptParser.UnaryExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitMultiplicativeExpression(VbScriptParser.MultiplicativeExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitIntegerDivisionExpression(VbScriptParser.IntegerDivisionExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitModuloExpression(VbScriptParser.ModuloExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitAdditiveExpression(VbScriptParser.AdditiveExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitConcatenationExpression(VbScriptParser.ConcatenationExpressionContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public String visitComparisonExpression(VbScriptParser.ComparisonExpressionContext ctx) {
        return VisitComparisonExpression.v(ctx, this);
    }

    @Override
    public String visitNotExpression(VbScriptParser.NotExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public String visitAndExpression(VbScriptParser.AndExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public String visitOrExpression(VbScriptParser.OrExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public String visitXorExpression(VbScriptParser.XorExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public String visitEqvExpression(VbScriptParser.EqvExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public String visitImpExpression(VbScriptParser.ImpExpressionContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    // ========== Primaries ==========

    @Override
    public String visitLiteralPrimary(VbScriptParser.LiteralPrimaryContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public String visitLiteral(VbScriptParser.LiteralContext ctx) {
        return VisitLiteral.v(ctx, this);
    }

    @Override
    public String visitParenthesizedPrimary(VbScriptParser.ParenthesizedPrimaryContext ctx) {
        return VisitPrimary.v(ctx, this);
    }

    @Override
    public String visitNewPrimary(VbScriptParser.NewPrimaryContext ctx) {
        return VisitPrimary.v(ctx, this);
    }

    @Override
    public String visitReferencePrimary(VbScriptParser.ReferencePrimaryContext ctx) {
        return VisitMemberChain.v(ctx.memberChain(), this, VisitMemberChain.Mode.VALUE);
    }

    @Override
    public String visitMemberChain(VbScriptParser.MemberChainContext ctx) {
        return VisitMemberChain.v(ctx, this, VisitMemberChain.Mode.VALUE);
    }
}
