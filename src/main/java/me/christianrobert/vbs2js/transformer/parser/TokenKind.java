package me.christianrobert.vbs2js.transformer.parser;

/**
 * Tags of the {@link Token} variants.
 */
public enum TokenKind {
    COMMENT,
    DECLARATION,
    FUNCTION_START,
    FUNCTION_END,
    CONDITIONAL,
    LOOP,
    SELECT_DISPATCH,
    UNIT_EXIT,
    STATEMENT
}
