package me.christianrobert.vbs2js.transformer.controlflow;

import me.christianrobert.vbs2js.transformer.builder.ExpressionTranspiler;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBaseBuilder;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.LineClassifier;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.ProgramParser;
import me.christianrobert.vbs2js.transformer.parser.SourceProgram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for block reconstruction: conditionals, loops, dispatch, exits and declarations.
 * Output is compared before post-processing.
 */
class ControlFlowReconstructorTest {

    private final AntlrParser parser = new AntlrParser();
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private GeneratedProgram reconstruct(String vbs, TranspilerOptions options, List<String> header) {
        ParsedProgram program = new ProgramParser().parse(SourceProgram.of(vbs));
        ExpressionTranspiler transpiler = new ExpressionTranspiler(parser,
                KnowledgeBaseBuilder.build(program, diagnostics), diagnostics);
        return new ControlFlowReconstructor(transpiler, new LineClassifier(), options).reconstruct(program, header);
    }

    private String render(String vbs) {
        return reconstruct(vbs, TranspilerOptions.withoutHeader(), List.of()).render();
    }

    // ========== Conditionals ==========

    @Test
    void singleLineIf() {
        assertEquals("if (x===1) { y=2; }\n", render("If x=1 Then y=2"));
    }

    @Test
    void singleLineIfElse() {
        assertEquals("if (a > b) { m = a; } else { m = b; }\n", render("If a > b Then m = a Else m = b"));
    }

    @Test
    void blockIfWithElseIfAndElse() {
        String vbs = """
            If x > 0 Then
              s = 1
            ElseIf x < 0 Then
              s = -1
            Else
              s = 0
            End If
            """;
        String expected = """
            if (x > 0) {
              s = 1;
            } else if (x < 0) {
              s = -1;
            } else {
              s = 0;
            }
            """;
        assertEquals(expected, render(vbs));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void elseIfWithStatementOnSameLine_keepsStatement() {
        String vbs = """
            If a = 1 Then
              y = 1
            ElseIf a = 2 Then y = 2
            ElseIf a = 3 Then y = 3 : z = 3
            End If
            """;
        String expected = """
            if (a === 1) {
              y = 1;
            } else if (a === 2) {
              y = 2;
            } else if (a === 3) {
              y = 3;
              z = 3;
            }
            """;
        assertEquals(expected, render(vbs));
        assertTrue(diagnostics.isEmpty());
    }

    // ========== Loops ==========

    @Test
    void countedLoop_defaultStep() {
        String expected = """
            for (let i = 1; i <= 10; i++) {
              total = total + i;
            }
            """;
        assertEquals(expected, render("For i = 1 To 10\n  total = total + i\nNext"));
    }

    @Test
    void countedLoop_literalSteps() {
        assertTrue(render("For i = 0 To 10 Step 2\nNext").startsWith("for (let i = 0; i <= 10; i += 2) {"));
        assertTrue(render("For i = 10 To 1 Step -1\nNext").startsWith("for (let i = 10; i >= 1; i--) {"));
        assertTrue(render("For i = 10 To 0 Step -5\nNext").startsWith("for (let i = 10; i >= 0; i -= 5) {"));
    }

    @Test
    void countedLoop_runtimeStep() {
        assertTrue(render("For i = 1 To n Step s\nNext")
                .startsWith("for (let i = 1; (s) >= 0 ? i <= n : i >= n; i += s) {"));
    }

    @Test
    void forEachLoop() {
        String expected = """
            for (const item of items) {
              Process(item);
            }
            """;
        assertEquals(expected, render("For Each item In items\n  Process item\nNext"));
    }

    @Test
    void doLoopVariants() {
        assertEquals("while (n > 0) {\n  n = n - 1;\n}\n", render("Do While n > 0\n  n = n - 1\nLoop"));
        assertEquals("while (!done) {\n  Poll();\n}\n", render("Do Until done\n  Poll\nLoop"));
        assertEquals("do {\n  x = x + 1;\n} while (!(x > 5));\n", render("Do\n  x = x + 1\nLoop Until x > 5"));
        assertEquals("do {\n  x = x + 1;\n} while (x < 5);\n", render("Do\n  x = x + 1\nLoop While x < 5"));
        assertEquals("do {\n  Tick();\n} while (true);\n", render("Do\n  Tick\nLoop"));
    }

    @Test
    void whileWend() {
        assertEquals("while (x < 3) {\n  x = x + 1;\n}\n", render("While x < 3\n  x = x + 1\nWend"));
    }

    // ========== Select Case ==========

    @Test
    void selectCase_clausesEndWithBreak() {
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
        String expected = """
            switch (x) {
              case 1:
                y = 1;
                break;
              case 2:
              case 3:
                y = 2;
                break;
              default:
                y = 3;
                break;
            }
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void selectCase_noBreakAfterReturn() {
        String vbs = """
            Function Label(code)
              Select Case code
                Case 1
                  Label = "one"
                Case Else
                  Label = "other"
              End Select
            End Function
            """;
        String expected = """
            function Label(code) {
              switch (code) {
                case 1:
                  return "one";
                default:
                  return "other";
              }
            }
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void caseOutsideSelect_isLeftForPostProcessing() {
        assertEquals("case 1:\n", render("Case 1"));
    }

    // ========== Exits ==========

    @Test
    void exitFor_insideSelect_breaksToLabel() {
        String vbs = """
            For i = 1 To 5
              Select Case i
                Case 3
                  Exit For
              End Select
            Next
            """;
        String expected = """
            loop1: for (let i = 1; i <= 5; i++) {
              switch (i) {
                case 3:
                  break loop1;
              }
            }
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void exitFor_insideIf_isPlainBreak() {
        String expected = """
            for (let i = 1; i <= 5; i++) {
              if (i === 3) {
                break;
              }
            }
            """;
        assertEquals(expected, render("For i = 1 To 5\n  If i = 3 Then\n    Exit For\n  End If\nNext"));
    }

    @Test
    void exitFor_fromInnerDoLoop_labelsOuterLoop() {
        String vbs = """
            For i = 1 To 5
              Do While busy
                Exit For
              Loop
            Next
            """;
        String out = render(vbs);
        assertTrue(out.startsWith("loop1: for (let i = 1;"), out);
        assertTrue(out.contains("    break loop1;\n"), out);
    }

    @Test
    void exitDo() {
        assertEquals("do {\n  break;\n} while (true);\n", render("Do\n  Exit Do\nLoop"));
    }

    @Test
    void exitFunction_isBareReturn() {
        String vbs = """
            Sub Check(x)
              If x = 0 Then Exit Sub
              Run x
            End Sub
            """;
        String expected = """
            function Check(x) {
              if (x === 0) { return; }
              Run(x);
            }
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void exitOutsideUnitOrLoop_isUnmatched() {
        assertEquals("// UNMATCHED: Exit Function\n", render("Exit Function"));
        assertEquals(1, diagnostics.getUnmatchedBlocks());
        assertEquals("// UNMATCHED: Exit For\n", render("Exit For"));
        assertEquals(2, diagnostics.getUnmatchedBlocks());
    }

    // ========== Units ==========

    @Test
    void functionReturnAssignment() {
        String vbs = """
            Function total()
              total = x + y
            End Function
            """;
        assertEquals("function total() {\n  return x + y;\n}\n", render(vbs));
    }

    @Test
    void functionWithoutReturnAssignment_returnsNull() {
        String vbs = """
            Function Compute(a)
              b = a * 2
            End Function
            """;
        assertEquals("function Compute(a) {\n  b = a * 2;\n  return null;\n}\n", render(vbs));
    }

    @Test
    void subHasNoTrailingReturn() {
        assertEquals("function Show() {\n  alert(\"x\");\n}\n", render("Sub Show()\n  MsgBox \"x\"\nEnd Sub"));
    }

    @Test
    void scriptCodeComesFirst_sectionsSeparatedByBlankLine() {
        String vbs = """
            Sub Greet()
              MsgBox "hi"
            End Sub
            Greet
            """;
        String expected = """
            Greet();

            function Greet() {
              alert("hi");
            }
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void unitsAreReportedSeparately() {
        GeneratedProgram program = reconstruct("x = 1\nSub A()\nEnd Sub\nSub B()\nEnd Sub",
                TranspilerOptions.withoutHeader(), List.of());
        assertTrue(program.getPreamble().isGlobal());
        assertEquals(List.of("x = 1;"), program.getPreamble().getLines());
        assertEquals(2, program.getUnits().size());
        GeneratedUnit b = program.getUnits().get(1);
        assertFalse(b.isGlobal());
        assertEquals("B", b.getName());
        assertEquals(4, b.getStartLine());
        assertEquals(5, b.getEndLine());
    }

    @Test
    void headerLinesComeFirst() {
        String out = reconstruct("x = 1", TranspilerOptions.withoutHeader(), List.of("// generated")).render();
        assertEquals("// generated\n\nx = 1;\n", out);
    }

    @Test
    void indentComesFromOptions() {
        TranspilerOptions fourSpaces = new TranspilerOptions("    ", false, true, true, true, true);
        String out = reconstruct("If a Then\n  b = 1\nEnd If", fourSpaces, List.of()).render();
        assertEquals("if (a) {\n    b = 1;\n}\n", out);
    }

    // ========== Unmatched blocks ==========

    @Test
    void closerWithoutOpener_isKeptAsComment() {
        assertEquals("x = 1;\n// UNMATCHED: End If\n", render("x = 1\nEnd If"));
        assertEquals(1, diagnostics.getUnmatchedBlocks());
    }

    @Test
    void unclosedBlock_isClosedAtEnd() {
        assertEquals("if (x) {\n  y = 1;\n}\n", render("If x Then\n  y = 1"));
        assertEquals(1, diagnostics.getUnmatchedBlocks());
    }

    @Test
    void unclosedBottomTestedDo_getsEndlessTail() {
        assertEquals("do {\n  Tick();\n} while (true);\n", render("Do\n  Tick"));
        assertEquals(1, diagnostics.getUnmatchedBlocks());
    }

    @Test
    void closerSkippingOpenBlock_closesItImplicitly() {
        String vbs = """
            For i = 1 To 3
              If i = 2 Then
                y = i
            Next
            """;
        String expected = """
            for (let i = 1; i <= 3; i++) {
              if (i === 2) {
                y = i;
              }
            }
            """;
        assertEquals(expected, render(vbs));
        assertEquals(1, diagnostics.getUnmatchedBlocks());
        assertTrue(diagnostics.getMessages().get(0).getMessage().contains("closed implicitly by 'Next'"));
    }

    // ========== Declarations ==========

    @Test
    void declarations() {
        String vbs = """
            Dim a(5), x, d()
            Const MAX = 10
            Dim g(2, 3)
            """;
        String expected = """
            let a = new Array(6);
            let x;
            let d = [];
            const MAX = 10;
            let g = Array.from({ length: 3 }, () => new Array(4));
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void largestSize_isNotOverflowed() {
        assertEquals("let a = new Array(2147483647 + 1);\n", render("Dim a(2147483647)"));
        assertEquals("let d = [];\nd = new Array(99999999999 + 1);\n", render("Dim d()\nReDim d(99999999999)"));
    }

    @Test
    void containerUse_afterDeclaration() {
        assertEquals("let a = new Array(6);\na[3] = a[3] + 1;\n", render("Dim a(5)\na(3) = a(3) + 1"));
    }

    @Test
    void resizes() {
        String vbs = """
            Dim d()
            ReDim d(n)
            ReDim Preserve d(10)
            """;
        String expected = """
            let d = [];
            d = new Array(n + 1);
            d.length = 11;
            """;
        assertEquals(expected, render(vbs));
    }

    @Test
    void preserveWithSeveralDimensions_isUnknown() {
        String out = render("Dim g()\nReDim Preserve g(2, 3)");
        assertEquals("let g = [];\n/* UNKNOWN: ReDim Preserve g(2, 3) */\n", out);
        assertEquals(1, diagnostics.getUnknownConstructs());
    }

    // ========== Comments ==========

    @Test
    void commentsAndBlankLines() {
        assertEquals("// note\n\nx = 1;\n// set\n", render("' note\n\nx = 1 ' set"));
    }

    @Test
    void unsupportedStatement_staysInPlace() {
        assertEquals("/* UNKNOWN: On Error Resume Next */\nx = 1;\n", render("On Error Resume Next\nx = 1"));
        assertEquals(1, diagnostics.getUnknownConstructs());
    }
}
