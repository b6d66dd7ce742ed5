package me.christianrobert.vbs2js.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.vbs2js.antlr.VbScriptLexer;
import me.christianrobert.vbs2js.antlr.VbScriptParser;
import me.christianrobert.vbs2js.transformer.context.TransformationException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Thin wrapper around the generated VbScriptParser.
 * Handles parser instantiation and error collection, and provides one parse method per entry rule.
 *
 * Uses two-stage parsing:
 * 1. SLL(*) with a bail-out error strategy (fast path, nearly every statement)
 * 2. LL(*) with full error recovery when SLL fails, collecting the syntax errors
 *
 * A statement that still has errors after stage 2 is not rewritten; the caller emits it
 * as an unknown construct.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    private <T extends ParserRuleContext> ParseResult parseTwoStage(
            String source,
            Function<VbScriptParser, T> parseFunction,
            String description) {

        List<String> errors = new ArrayList<>();
        BaseErrorListener collector = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg,
                                    RecognitionException e) {
                String error = String.format("Position %d - %s", charPositionInLine, msg);
                errors.add(error);
                log.trace("Syntax error in {}: {}", description, error);
            }
        };

        VbScriptLexer lexer = new VbScriptLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        // Stage 1: SLL(*)
        VbScriptParser parser = new VbScriptParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        T tree;
        try {
            tree = parseFunction.apply(parser);
            log.trace("SLL(*) parse succeeded for {}", description);
        } catch (ParseCancellationException sllFailure) {
            log.trace("SLL(*) parse failed for {}, falling back to LL(*)", description);

            // Stage 2: LL(*) with error collection
            tokens.seek(0);
            parser.reset();
            parser.removeErrorListeners();
            parser.addErrorListener(collector);
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            tree = parseFunction.apply(parser);
        }

        return new ParseResult(tree, tokens, errors, source);
    }

    /**
     * Parses one statement (assignment, Call, or invocation with or without parentheses).
     *
     * @param statement VBScript statement without comment or ':' separator
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseStatement(String statement) {
        if (statement == null || statement.trim().isEmpty()) {
            throw new TransformationException("Statement cannot be null or empty");
        }

        log.trace("Parsing statement: {}", statement);

        try {
            return parseTwoStage(statement, VbScriptParser::statementLine, "statement");
        } catch (RuntimeException e) {
            throw new TransformationException("Failed to parse statement: " + e.getMessage(), statement, "ANTLR parsing", e);
        }
    }

    /**
     * Parses one expression (conditions, loop bounds, Case values, initializers).
     *
     * @param expression VBScript expression
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseExpression(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new TransformationException("Expression cannot be null or empty");
        }

        log.trace("Parsing expression: {}", expression);

        try {
            return parseTwoStage(expression, VbScriptParser::expressionLine, "expression");
        } catch (RuntimeException e) {
            throw new TransformationException("Failed to parse expression: " + e.getMessage(), expression, "ANTLR parsing", e);
        }
    }
}
