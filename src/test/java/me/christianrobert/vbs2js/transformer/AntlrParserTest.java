package me.christianrobert.vbs2js.transformer;

import me.christianrobert.vbs2js.transformer.builder.JavaScriptCodeBuilder;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.ExpressionContext;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import me.christianrobert.vbs2js.transformer.context.TransformationException;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the ANTLR parser and direct tree-to-code rendering.
 * Tests the pipeline: VBScript → ANTLR parse tree → JavaScript
 */
class AntlrParserTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private String render(ParseResult parseResult, ExpressionContext expressionContext) {
        TranspilationContext context = new TranspilationContext(KnowledgeBase.empty(), new Diagnostics(),
                null, 1, expressionContext);
        return new JavaScriptCodeBuilder(context, parseResult.getTokens()).visit(parseResult.getTree());
    }

    @Test
    void parseSimpleAssignment() {
        ParseResult parseResult = parser.parseStatement("x = 1");

        assertTrue(parseResult.isSuccess(), "Parsing should succeed");
        assertFalse(parseResult.hasErrors(), "Should have no errors");
        assertNotNull(parseResult.getTree(), "Parse tree should not be null");
    }

    @Test
    void keywordsAreCaseInsensitive() {
        assertTrue(parser.parseStatement("SET obj = NOTHING").isSuccess());
        assertTrue(parser.parseExpression("a AND NOT b oR c").isSuccess());
        assertTrue(parser.parseStatement("call Run(1)").isSuccess());
    }

    @Test
    void parseInvocationWithoutParentheses() {
        ParseResult parseResult = parser.parseStatement("WriteLine \"a\", 2");

        assertTrue(parseResult.isSuccess());
    }

    @Test
    void invalidInput_collectsErrors() {
        ParseResult parseResult = parser.parseExpression("a + * b");

        assertFalse(parseResult.isSuccess());
        assertTrue(parseResult.hasErrors());
        assertFalse(parseResult.getErrorMessage().isEmpty());
    }

    @Test
    void unexpectedCharacter_isAnError() {
        assertTrue(parser.parseExpression("a ? b").hasErrors());
    }

    @Test
    void emptyInput_throws() {
        assertThrows(TransformationException.class, () -> parser.parseStatement("  "));
        assertThrows(TransformationException.class, () -> parser.parseExpression(null));
    }

    @Test
    void fullPipelineStatement() {
        ParseResult parseResult = parser.parseStatement("total = total + price * qty");
        assertTrue(parseResult.isSuccess(), "Parsing should succeed");

        assertEquals("total = total + price * qty;", render(parseResult, ExpressionContext.ASSIGNMENT));
    }

    @Test
    void fullPipelineExpression_keepsSpacing() {
        ParseResult parseResult = parser.parseExpression("a>=b   And c<>d");

        assertEquals("a>=b   && c!==d", render(parseResult, ExpressionContext.COMPARISON));
    }

    @Test
    void precedence_concatenationBindsLooserThanAddition() {
        ParseResult parseResult = parser.parseExpression("\"n=\" & a + b");

        assertEquals("\"n=\" + (a + b)", render(parseResult, ExpressionContext.COMPARISON));
    }
}
