package me.christianrobert.vbs2js.transformer.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    @Test
    void countsPerKind() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.record(DiagnosticKind.UNKNOWN_CONSTRUCT, 3, "On Error Resume Next");
        diagnostics.record(DiagnosticKind.BRACE_REPAIR, 0, "appended 2", 2);

        assertEquals(1, diagnostics.getUnknownConstructs());
        assertEquals(2, diagnostics.getBraceRepairs());
        assertEquals(3, diagnostics.getTotal());
        assertEquals(2, diagnostics.getMessages().size());
        assertEquals(1, diagnostics.getMessages(DiagnosticKind.BRACE_REPAIR).size());
        assertFalse(diagnostics.isEmpty());
    }

    @Test
    void nonPositiveCount_isIgnored() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.record(DiagnosticKind.BRACE_REPAIR, 0, "nothing", 0);
        assertTrue(diagnostics.isEmpty());
        assertEquals(0, diagnostics.getTotal());
    }

    @Test
    void messageFormat() {
        assertEquals("UNMATCHED_BLOCK (line 4): x",
                new Diagnostic(DiagnosticKind.UNMATCHED_BLOCK, 4, "x").toString());
        assertEquals("BRACE_REPAIR: y", new Diagnostic(DiagnosticKind.BRACE_REPAIR, 0, "y").toString());
    }
}
