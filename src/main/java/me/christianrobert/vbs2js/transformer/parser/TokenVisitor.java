package me.christianrobert.vbs2js.transformer.parser;

/**
 * Exhaustive dispatch over the {@link Token} variants.
 *
 * @param <R> result type
 */
public interface TokenVisitor<R> {

    R visitComment(Token.Comment token);

    R visitDeclaration(Token.Declaration token);

    R visitFunctionStart(Token.FunctionStart token);

    R visitFunctionEnd(Token.FunctionEnd token);

    R visitConditional(Token.Conditional token);

    R visitLoop(Token.Loop token);

    R visitSelectDispatch(Token.SelectDispatch token);

    R visitUnitExit(Token.UnitExit token);

    R visitStatement(Token.Statement token);
}
