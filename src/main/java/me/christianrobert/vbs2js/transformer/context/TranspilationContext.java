package me.christianrobert.vbs2js.transformer.context;

import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;

/**
 * Everything the code builder needs to know while rendering one statement or expression.
 *
 * <p>Two layers:</p>
 * <ul>
 *   <li>Program level: the {@link KnowledgeBase} and the run's {@link Diagnostics}</li>
 *   <li>Statement level: the enclosing unit (null for script-level code), the source line
 *       and the {@link ExpressionContext}</li>
 * </ul>
 *
 * <p>A fresh instance is created per statement; nothing here outlives one run.</p>
 */
public class TranspilationContext {

    private static final String UNKNOWN_PREFIX = "/* UNKNOWN: ";
    private static final String UNKNOWN_SUFFIX = " */";

    private final KnowledgeBase knowledgeBase;
    private final Diagnostics diagnostics;
    private final FunctionUnit currentUnit;
    private final int line;
    private final ExpressionContext expressionContext;

    public TranspilationContext(KnowledgeBase knowledgeBase, Diagnostics diagnostics,
                                FunctionUnit currentUnit, int line, ExpressionContext expressionContext) {
        this.knowledgeBase = knowledgeBase;
        this.diagnostics = diagnostics;
        this.currentUnit = currentUnit;
        this.line = line;
        this.expressionContext = expressionContext;
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Enclosing Function or Sub, or null for script-level code.
     */
    public FunctionUnit getCurrentUnit() {
        return currentUnit;
    }

    public int getLine() {
        return line;
    }

    public ExpressionContext getExpressionContext() {
        return expressionContext;
    }

    public boolean isContainer(String name) {
        return knowledgeBase.isContainer(name);
    }

    public String canonical(String name) {
        return knowledgeBase.canonical(name);
    }

    /**
     * True when a bare name refers to a Function or Sub and must be written as an explicit call:
     * a known callable that is not shadowed by a local or parameter and is not the enclosing unit.
     */
    public boolean shouldInvokeBare(String name) {
        if (!knowledgeBase.isCallable(name)) {
            return false;
        }
        if (currentUnit == null) {
            return true;
        }
        return !currentUnit.isNamed(name) && !currentUnit.declaresLocal(name) && !currentUnit.hasParameter(name);
    }

    /**
     * True when the name is declared by the program (unit, container, local or parameter),
     * so it hides a built-in function of the same name.
     */
    public boolean isUserDefined(String name) {
        if (knowledgeBase.isCallable(name) || knowledgeBase.isContainer(name)) {
            return true;
        }
        return currentUnit != null && (currentUnit.declaresLocal(name) || currentUnit.hasParameter(name));
    }

    /**
     * True when assigning to this name sets the return value of the enclosing Function.
     */
    public boolean isReturnTarget(String name) {
        return currentUnit != null && currentUnit.isValueReturning() && currentUnit.isNamed(name);
    }

    /**
     * Records an unknown construct and returns it wrapped in an inert comment.
     */
    public String unknownConstruct(String sourceText) {
        diagnostics.record(DiagnosticKind.UNKNOWN_CONSTRUCT, line, "Unknown construct: " + sourceText.trim());
        return inertComment(sourceText);
    }

    /**
     * Wraps text in a block comment that cannot be terminated early by the text itself.
     */
    public static String inertComment(String text) {
        return UNKNOWN_PREFIX + text.trim().replace("*/", "* /") + UNKNOWN_SUFFIX;
    }
}
