package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.ExpressionContext;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Transpiles single VBScript statements and expressions to JavaScript.
 *
 * <p>Architecture:
 * <pre>
 * text -> AntlrParser (statementLine | expressionLine) -> JavaScriptCodeBuilder -> JavaScript
 * </pre>
 *
 * <p>Statements come back terminated with ';'. Text the grammar rejects, and statements with
 * no JavaScript counterpart (On Error, With, Class, ...), come back as an inert comment and
 * are counted as unknown constructs; an expression in that state also yields {@code null}
 * so the surrounding code stays well-formed.</p>
 *
 * <p>One instance serves one run: it holds the run's knowledge base and diagnostics.</p>
 */
public class ExpressionTranspiler {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTranspiler.class);

    private static final Pattern UNSUPPORTED_STATEMENT = Pattern.compile(
            "^(?:On\\s+Error|With|End\\s+(?:With|Class|Property)|Class|Property|Randomize|Erase"
                    + "|Execute|ExecuteGlobal|Stop|Option|(?:Public|Private)\\s+(?:Property|Class|Default))\\b",
            Pattern.CASE_INSENSITIVE);

    private final AntlrParser parser;
    private final KnowledgeBase knowledgeBase;
    private final Diagnostics diagnostics;

    public ExpressionTranspiler(AntlrParser parser, KnowledgeBase knowledgeBase, Diagnostics diagnostics) {
        this.parser = parser;
        this.knowledgeBase = knowledgeBase;
        this.diagnostics = diagnostics;
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Transpiles text in the given context.
     *
     * @param text VBScript statement (ASSIGNMENT) or expression (COMPARISON)
     * @param unit Enclosing unit, or null for script-level code
     * @param expressionContext How '=' at the top level is read
     * @param line Source line for diagnostics
     * @return JavaScript text
     */
    public String transpile(String text, FunctionUnit unit, ExpressionContext expressionContext, int line) {
        return expressionContext == ExpressionContext.ASSIGNMENT
                ? transpileStatement(text, unit, line)
                : transpileExpression(text, unit, line);
    }

    public String transpileStatement(String text, FunctionUnit unit, int line) {
        TranspilationContext context = new TranspilationContext(knowledgeBase, diagnostics, unit, line,
                ExpressionContext.ASSIGNMENT);
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return "";
        }

        if (UNSUPPORTED_STATEMENT.matcher(trimmed).find()) {
            return context.unknownConstruct(trimmed);
        }

        ParseResult result = parser.parseStatement(trimmed);
        if (result.hasErrors()) {
            log.debug("Line {}: statement not recognized ({}): {}", line, result.getErrorMessage(), trimmed);
            return context.unknownConstruct(trimmed);
        }

        String js = new JavaScriptCodeBuilder(context, result.getTokens()).visit(result.getTree());
        log.trace("Line {}: {} -> {}", line, trimmed, js);
        return js;
    }

    public String transpileExpression(String text, FunctionUnit unit, int line) {
        TranspilationContext context = new TranspilationContext(knowledgeBase, diagnostics, unit, line,
                ExpressionContext.COMPARISON);
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return context.unknownConstruct("(missing expression)") + " null";
        }

        ParseResult result = parser.parseExpression(trimmed);
        if (result.hasErrors()) {
            log.debug("Line {}: expression not recognized ({}): {}", line, result.getErrorMessage(), trimmed);
            return context.unknownConstruct(trimmed) + " null";
        }

        String js = new JavaScriptCodeBuilder(context, result.getTokens()).visit(result.getTree());
        log.trace("Line {}: {} -> {}", line, trimmed, js);
        return js;
    }
}
