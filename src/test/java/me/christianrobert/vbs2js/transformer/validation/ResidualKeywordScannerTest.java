package me.christianrobert.vbs2js.transformer.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResidualKeywordScannerTest {

    @Test
    void cleanOutput_hasNoFindings() {
        String js = """
            function total(a, b) {
              return a + b;
            }
            """;
        assertTrue(ResidualKeywordScanner.scan(js).isEmpty());
        assertTrue(ResidualKeywordScanner.scan("").isEmpty());
        assertTrue(ResidualKeywordScanner.scan(null).isEmpty());
    }

    @Test
    void reportsKeywordsWithLineNumbers() {
        String js = """
            x = 1;
            If x Then
            End   If
            """;
        assertEquals(List.of("Line 2: Then", "Line 3: End If"), ResidualKeywordScanner.scan(js));
    }

    @Test
    void matchingIsCaseInsensitive() {
        assertEquals(List.of("Line 1: dim"), ResidualKeywordScanner.scan("dim x;"));
        assertEquals(List.of("Line 1: sub Helper"), ResidualKeywordScanner.scan("sub Helper();"));
    }

    @Test
    void stringsCommentsAndMembers_areIgnored() {
        String js = """
            s = "End If";
            // Next
            /* UNKNOWN: ReDim Preserve g(2, 3) */
            p.then(done);
            """;
        assertTrue(ResidualKeywordScanner.scan(js).isEmpty());
    }

    @Test
    void keywordInsideLongerIdentifier_isIgnored() {
        assertTrue(ResidualKeywordScanner.scan("let nextValue = dimension + thenable;").isEmpty());
    }
}
