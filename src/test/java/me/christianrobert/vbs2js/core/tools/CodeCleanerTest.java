package me.christianrobert.vbs2js.core.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeCleanerTest {

    @Test
    void removeComment_stripsTrailingComment() {
        assertEquals("x = 1 ", CodeCleaner.removeComment("x = 1 ' set x"));
    }

    @Test
    void removeComment_ignoresQuoteInsideString() {
        String line = "msg = \"it's fine\"";
        assertEquals(line, CodeCleaner.removeComment(line));
    }

    @Test
    void removeComment_handlesDoubledQuotes() {
        assertEquals("s = \"a\"\"b\" ", CodeCleaner.removeComment("s = \"a\"\"b\" ' quoted"));
    }

    @Test
    void extractComment_returnsTextAfterMarker() {
        assertEquals(" note", CodeCleaner.extractComment("x = 1 ' note"));
        assertNull(CodeCleaner.extractComment("x = 1"));
    }

    @Test
    void endsWithContinuation_requiresBlankBeforeUnderscore() {
        assertTrue(CodeCleaner.endsWithContinuation("total = a + _"));
        assertFalse(CodeCleaner.endsWithContinuation("my_var"));
        assertFalse(CodeCleaner.endsWithContinuation("x = y_"));
    }

    @Test
    void removeContinuation_dropsMarker() {
        assertEquals("total = a + ", CodeCleaner.removeContinuation("total = a + _"));
    }

    @Test
    void splitStatements_splitsOnColonOutsideStrings() {
        List<String> parts = CodeCleaner.splitStatements("a = 1 : b = \"x:y\" : c = 3");
        assertEquals(List.of("a = 1", "b = \"x:y\"", "c = 3"), parts);
    }

    @Test
    void splitTopLevel_keepsNestedCommas() {
        List<String> parts = CodeCleaner.splitTopLevel("a, b(1, 2), \"x,y\"", ',');
        assertEquals(List.of("a", "b(1, 2)", "\"x,y\""), parts);
    }

    @Test
    void splitTopLevel_keepsEmptySegments() {
        assertEquals(List.of("a", ""), CodeCleaner.splitTopLevel("a,", ','));
    }

    @Test
    void indexOfKeyword_respectsWordBoundariesAndStrings() {
        String text = "x = \"Then\" And ThenValue Then";
        assertEquals(text.lastIndexOf("Then"), CodeCleaner.indexOfKeyword(text, "Then", 0));
    }

    @Test
    void indexOfKeyword_isCaseInsensitive() {
        assertEquals(5, CodeCleaner.indexOfKeyword("If x THEN y", "Then", 0));
    }

    @Test
    void parseIntLiteral_rejectsNonDigitsAndOverflow() {
        assertEquals(42, CodeCleaner.parseIntLiteral(" 42 "));
        assertEquals(Integer.MAX_VALUE, CodeCleaner.parseIntLiteral("2147483647"));
        assertNull(CodeCleaner.parseIntLiteral("2147483648"));
        assertNull(CodeCleaner.parseIntLiteral("99999999999"));
        assertNull(CodeCleaner.parseIntLiteral("n"));
        assertNull(CodeCleaner.parseIntLiteral(""));
    }

    @Test
    void offsetBound_computesOnlyWhenResultFits() {
        assertEquals("6", CodeCleaner.offsetBound("5", 1));
        assertEquals("-1", CodeCleaner.offsetBound("0", -1));
        assertEquals("n + 1", CodeCleaner.offsetBound(" n ", 1));
        assertEquals("2147483647 + 1", CodeCleaner.offsetBound("2147483647", 1));
        assertEquals("99999999999 - 1", CodeCleaner.offsetBound("99999999999", -1));
    }
}
