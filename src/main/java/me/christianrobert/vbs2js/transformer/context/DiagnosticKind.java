package me.christianrobert.vbs2js.transformer.context;

/**
 * Categories of recoverable issues recorded during one transpilation.
 */
public enum DiagnosticKind {
    /** Construct without a known mapping, emitted inside an inert comment. */
    UNKNOWN_CONSTRUCT,
    /** Case/default label found outside a switch body, commented out. */
    UNRESOLVED_CASE_PLACEMENT,
    /** Closing braces appended by the post-processor. */
    BRACE_REPAIR,
    /** String.fromCharCode(n) replaced with an escape sequence. */
    CHAR_CODE_CONVERSION,
    /** Name declared both as container and as callable unit. */
    AMBIGUITY_UNRESOLVED,
    /** Block opened without a close, or closed without an open. */
    UNMATCHED_BLOCK,
    /** Container access written with parentheses, fixed by the post-processor. */
    CONTAINER_ACCESS_CORRECTION
}
