package me.christianrobert.vbs2js.transformer.context;

/**
 * How a piece of VBScript text is read by the expression transpiler.
 */
public enum ExpressionContext {
    /**
     * A whole statement: the leading '=' of an assignment stays an assignment,
     * comparisons in the right-hand side become strict equality.
     */
    ASSIGNMENT,
    /**
     * A bare expression (conditions, bounds, Case values): every '=' is a comparison.
     */
    COMPARISON
}
