package me.christianrobert.vbs2js.transformer.postprocess;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptScannerTest {

    @Test
    void codeMask_excludesStringsAndComments() {
        String text = "a(\"(\") // (\nb";
        boolean[] mask = JavaScriptScanner.codeMask(text);
        assertTrue(mask[0]);
        assertFalse(mask[3], "inside string");
        assertFalse(mask[10], "inside comment");
        assertTrue(mask[text.length() - 1]);
    }

    @Test
    void escapedQuote_doesNotEndString() {
        String text = "\"a\\\"b\" + c";
        boolean[] mask = JavaScriptScanner.codeMask(text);
        assertFalse(mask[4]);
        assertTrue(mask[text.length() - 1]);
    }

    @Test
    void findClosingParenthesis_skipsQuotedParentheses() {
        String text = "f(a, \")\", g(b)) + 1";
        assertEquals(14, JavaScriptScanner.findClosingParenthesis(text, JavaScriptScanner.codeMask(text), 1));
        String open = "f(a";
        assertEquals(-1, JavaScriptScanner.findClosingParenthesis(open, JavaScriptScanner.codeMask(open), 1));
    }

    @Test
    void splitArguments_respectsNesting() {
        assertEquals(List.of("a", "f(b, c)", "[1, 2]", "\"x,y\""),
                JavaScriptScanner.splitArguments("a, f(b, c), [1, 2], \"x,y\""));
        assertTrue(JavaScriptScanner.splitArguments("  ").isEmpty());
        assertEquals(List.of("a", ""), JavaScriptScanner.splitArguments("a,"));
    }
}
