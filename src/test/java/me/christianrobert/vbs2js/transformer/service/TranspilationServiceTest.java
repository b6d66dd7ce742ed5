package me.christianrobert.vbs2js.transformer.service;

import me.christianrobert.vbs2js.config.service.ConfigService;
import me.christianrobert.vbs2js.transformer.catalog.ContainerCatalogEntry;
import me.christianrobert.vbs2js.transformer.catalog.FunctionCatalogEntry;
import me.christianrobert.vbs2js.transformer.context.TranspilationResult;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.UnitKind;
import me.christianrobert.vbs2js.transformer.postprocess.PostProcessor;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the transpilation pipeline.
 */
class TranspilationServiceTest {

    private TranspilationService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        service = new TranspilationService();
        service.parser = new AntlrParser();
        configService = new ConfigService();
        service.configService = configService;
    }

    private TranspilationResult transpile(String vbScript) {
        return service.transpile(vbScript, TranspilerOptions.withoutHeader());
    }

    private String javaScript(String vbScript) {
        TranspilationResult result = transpile(vbScript);
        assertTrue(result.isSuccess(), "Transpilation should succeed: " + result.getErrorMessage());
        return result.getJavaScript();
    }

    // ========== Core rules ==========

    @Test
    void singleLineIf() {
        assertEquals("if (x===1) { y=2; }\n", javaScript("if x=1 then y=2"));
    }

    @Test
    void containerDeclarationAndAccess() {
        assertEquals("let a = new Array(6);\na[3] = a[3] + 1;\n", javaScript("Dim a(5)\na(3) = a(3) + 1"));
    }

    @Test
    void functionReturnAssignment() {
        assertEquals("function total() {\n  return x + y;\n}\n",
                javaScript("Function total()\n  total = x + y\nEnd Function"));
    }

    @Test
    void selectCase_breakAfterEachClause() {
        String vbs = """
            Select Case x
              Case 1
                y = 1
              Case 2, 3
                y = 2
              Case Else
                y = 3
            End Select
            """;
        String js = javaScript(vbs);
        assertEquals(3, js.split("break;", -1).length - 1, js);
        assertTrue(js.startsWith("switch (x) {\n"), js);
    }

    @Test
    void containerDeclaredAfterUse_isStillIndexed() {
        String js = javaScript("""
            Sub Fill()
              data(1) = 2
            End Sub
            Dim data(4)
            """);
        assertTrue(js.contains("  data[1] = 2;"), js);
        assertFalse(js.contains("data(1)"), js);
    }

    @Test
    void bareCallableInExpression_isInvoked() {
        String js = javaScript("""
            Function Rate()
              Rate = 3
            End Function
            price = base * Rate
            """);
        assertTrue(js.startsWith("price = base * Rate();\n"), js);
    }

    @Test
    void charCodes_areHumanized() {
        TranspilationResult result = transpile("s = Chr(34) & name & Chr(34)");
        assertEquals("s = \"\\\"\" + name + \"\\\"\";\n", result.getJavaScript());
        assertEquals(2, result.getDiagnostics().getCharCodeConversions());
    }

    @Test
    void unknownConstructs_areCountedAndKeptInert() {
        TranspilationResult result = transpile("On Error Resume Next\nSet fso = CreateObject(\"X\")");
        assertTrue(result.isSuccess());
        assertEquals("/* UNKNOWN: On Error Resume Next */\nfso = /* UNKNOWN: CreateObject(\"X\") */ null;\n",
                result.getJavaScript());
        assertEquals(2, result.getDiagnostics().getUnknownConstructs());
    }

    // ========== Structure ==========

    @Test
    void unclosedBlock_isRepairedAndReported() {
        TranspilationResult result = transpile("If x Then\n  y = 1");
        assertTrue(result.isSuccess());
        assertEquals("if (x) {\n  y = 1;\n}\n", result.getJavaScript());
        assertEquals(1, result.getDiagnostics().getUnmatchedBlocks());
        assertEquals(0, result.getDiagnostics().getBraceRepairs());
    }

    @Test
    void caseOutsideSelect_isCommentedOut() {
        TranspilationResult result = transpile("Case 1\nx = 1");
        assertTrue(result.getJavaScript().startsWith("// FIXME misplaced clause: case 1:\n"), result.getJavaScript());
        assertEquals(1, result.getDiagnostics().getUnresolvedCasePlacements());
    }

    @Test
    void outputIsStableUnderPostProcessing() {
        String js = javaScript("""
            Dim grid(2, 2)
            For i = 0 To 2
              For j = 0 To 2
                grid(i, j) = Chr(9)
              Next
            Next
            """);
        Diagnostics again = new Diagnostics();
        String reprocessed = new PostProcessor(KnowledgeBase.empty(), TranspilerOptions.withoutHeader()).process(js, again);
        assertEquals(js, reprocessed);
        assertTrue(again.isEmpty());
    }

    // ========== Result details ==========

    @Test
    void catalogsDescribeProgram() {
        TranspilationResult result = transpile("""
            Dim scores(10)
            Function Average(values, count)
              Dim sum, i, seen()
              sum = 0
              For i = 0 To count - 1
                sum = sum + i
              Next
              Average = sum / count
            End Function
            Sub Report()
              MsgBox Average(scores, 3)
            End Sub
            """);
        assertTrue(result.isSuccess(), result.getErrorMessage());

        List<FunctionCatalogEntry> functions = result.getFunctionCatalog();
        assertEquals(2, functions.size());
        FunctionCatalogEntry average = functions.get(0);
        assertEquals("Average", average.getName());
        assertEquals(UnitKind.VALUE_RETURNING, average.getKind());
        assertEquals(List.of("values", "count"), average.getParameters());
        assertEquals(3, average.getLocalVariableCount());
        assertEquals(1, average.getReturnAssignmentCount());
        assertEquals(2, average.getStartLine());
        assertEquals(9, average.getEndLine());
        assertEquals(UnitKind.ACTION_ONLY, functions.get(1).getKind());

        List<ContainerCatalogEntry> containers = result.getContainerCatalog();
        assertEquals(2, containers.size());
        assertEquals("scores", containers.get(0).getName());
        assertEquals(ContainerCatalogEntry.GLOBAL_SCOPE, containers.get(0).getScope());
        assertEquals(10, containers.get(0).getDeclaredSize());
        assertEquals("Average", containers.get(1).getScope());
        assertTrue(containers.get(1).isDynamic());

        assertTrue(result.getJavaScript().contains("alert(Average(scores, 3));"), result.getJavaScript());
        assertFalse(result.hasResidualKeywords());
    }

    @Test
    void defaultConfiguration_emitsHeader() {
        TranspilationResult result = service.transpile("x = 1\ny = 2");
        assertEquals("// Transpiled from VBScript by vbs2js\n// Source: 2 lines, 0 units\n\nx = 1;\ny = 2;\n",
                result.getJavaScript());
    }

    @Test
    void configuredIndent_isUsed() {
        configService.setConfigValue(ConfigService.INDENT, "\t");
        configService.setConfigValue(ConfigService.EMIT_HEADER, false);
        TranspilationResult result = service.transpile("If a Then\n  b = 1\nEnd If");
        assertEquals("if (a) {\n\tb = 1;\n}\n", result.getJavaScript());
    }

    // ========== Failures ==========

    @Test
    void emptyInput_fails() {
        assertTrue(service.transpile("").isFailure());
        assertTrue(service.transpile(null).isFailure());
        assertEquals("VBScript source cannot be null or empty", service.transpile("   \n").getErrorMessage());
    }

    @Test
    void unterminatedFunction_failsWithLine() {
        TranspilationResult result = transpile("Function F()\n  F = 1\n");
        assertTrue(result.isFailure());
        assertNull(result.getJavaScript());
        assertTrue(result.getErrorMessage().startsWith("Line 1:"), result.getErrorMessage());
        assertTrue(result.getErrorMessage().contains("not closed"), result.getErrorMessage());
    }

    @Test
    void mismatchedEnd_fails() {
        TranspilationResult result = transpile("Sub S()\nEnd Function");
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Line 2:"), result.getErrorMessage());
    }

    @Test
    void malformedDeclaration_fails() {
        TranspilationResult result = transpile("Dim a(x)");
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("Malformed Dim declaration"), result.getErrorMessage());
    }

    @Test
    void oversizedDeclaration_failsWithLine() {
        TranspilationResult result = transpile("x = 1\nDim a(99999999999)");
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Line 2:"), result.getErrorMessage());
        assertTrue(result.getErrorMessage().contains("Malformed Dim declaration"), result.getErrorMessage());
    }
}
