package me.christianrobert.vbs2js.transformer.builder;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.ExpressionContext;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBaseBuilder;
import me.christianrobert.vbs2js.transformer.parser.AntlrParser;
import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.ParsedProgram;
import me.christianrobert.vbs2js.transformer.parser.ProgramParser;
import me.christianrobert.vbs2js.transformer.parser.SourceProgram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for statement and expression transpilation.
 */
class ExpressionTranspilerTest {

    private final AntlrParser parser = new AntlrParser();
    private Diagnostics diagnostics;
    private ExpressionTranspiler transpiler;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        transpiler = new ExpressionTranspiler(parser, KnowledgeBase.empty(), diagnostics);
    }

    private ParsedProgram useProgram(String text) {
        ParsedProgram program = new ProgramParser().parse(SourceProgram.of(text));
        transpiler = new ExpressionTranspiler(parser, KnowledgeBaseBuilder.build(program, diagnostics), diagnostics);
        return program;
    }

    private String expr(String text) {
        return transpiler.transpileExpression(text, null, 1);
    }

    private String stmt(String text) {
        return transpiler.transpileStatement(text, null, 1);
    }

    // ========== Operators ==========

    @Test
    void comparisonEquals_becomesStrictEquality() {
        assertEquals("x===1", expr("x=1"));
        assertEquals("x === 1", expr("x = 1"));
        assertEquals("a !== b", expr("a <> b"));
        assertEquals("a <= b", expr("a =< b"));
        assertEquals("obj === null", expr("obj Is Nothing"));
    }

    @Test
    void arithmeticOperators() {
        assertEquals("x % 2", expr("x Mod 2"));
        assertEquals("Math.trunc(a / b)", expr("a \\ b"));
        assertEquals("2 ** 3", expr("2 ^ 3"));
        assertEquals("(a + b) * c", expr("(a + b) * c"));
    }

    @Test
    void power_groupsLeftToRight() {
        assertEquals("(2 ** 3) ** 2", expr("2 ^ 3 ^ 2"));
        assertEquals("2 ** (3 ** 2)", expr("2 ^ (3 ^ 2)"));
    }

    @Test
    void modulo_keepsMultiplicativeRightOperandGrouped() {
        assertEquals("a % (b * c)", expr("a Mod b * c"));
        assertEquals("a * b % c", expr("a * b Mod c"));
        assertEquals("Math.trunc(a / (b * c))", expr("a \\ b * c"));
    }

    @Test
    void adjacentSigns_areSeparated() {
        assertEquals("x = a- -b;", stmt("x = a--b"));
        assertEquals("x = a+ +b;", stmt("x = a++b"));
        assertEquals("x = a+-b;", stmt("x = a+-b"));
        assertEquals("x = - -b;", stmt("x = --b"));
    }

    @Test
    void concatenation_becomesPlus_andKeepsAdditionGrouped() {
        assertEquals("\"Hello \" + name", expr("\"Hello \" & name"));
        assertEquals("\"a\" + (1 + 2)", expr("\"a\" & 1 + 2"));
    }

    @Test
    void logicalOperators() {
        assertEquals("!done", expr("Not done"));
        assertEquals("a && b || c", expr("a And b Or c"));
        assertEquals("a ^ b", expr("a Xor b"));
        assertEquals("(!a || b)", expr("a Imp b"));
        assertEquals("!(x === 1)", expr("Not (x = 1)"));
    }

    // ========== Literals ==========

    @Test
    void stringLiterals_escapeQuotesAndBackslashes() {
        assertEquals("\"say \\\"hi\\\"\"", expr("\"say \"\"hi\"\"\""));
        assertEquals("\"C:\\\\temp\"", expr("\"C:\\temp\""));
    }

    @Test
    void keywordLiterals() {
        assertEquals("true", expr("True"));
        assertEquals("null", expr("Nothing"));
        assertEquals("null", expr("Null"));
        assertEquals("\"\"", expr("Empty"));
        assertEquals("new Date(\"1/31/2024\")", expr("#1/31/2024#"));
    }

    // ========== Built-ins ==========

    @Test
    void builtinFunctions() {
        assertEquals("name.toUpperCase()", expr("UCase(name)"));
        assertEquals("String(s).length", expr("Len(s)"));
        assertEquals("s.substr(1, 3)", expr("Mid(s, 2, 3)"));
        assertEquals("(s.indexOf(\"x\") + 1)", expr("InStr(s, \"x\")"));
        assertEquals("parseInt(v, 10)", expr("CInt(v)"));
        assertEquals("String.fromCharCode(34)", expr("Chr(34)"));
        assertEquals("(arr.length - 1)", expr("UBound(arr)"));
    }

    @Test
    void startPositionBeyondIntRange_staysSymbolic() {
        assertEquals("s.substr(99999999999 - 1)", expr("Mid(s, 99999999999)"));
        assertEquals("(s.indexOf(\"x\", 99999999999 - 1) + 1)", expr("InStr(99999999999, s, \"x\")"));
    }

    @Test
    void builtinConstantsAndParameterlessCalls() {
        assertEquals("\"\\r\\n\"", expr("vbCrLf"));
        assertEquals("new Date()", expr("Now"));
        assertEquals("Math.random()", expr("Rnd"));
    }

    @Test
    void userDefinedName_hidesBuiltin() {
        useProgram("""
            Function Len(x)
              Len = 0
            End Function
            """);
        assertEquals("Len(s)", expr("Len(s)"));
    }

    // ========== Containers and callables ==========

    @Test
    void containerAccess_usesBrackets() {
        useProgram("Dim grid(2, 3), list(9)");
        assertEquals("grid[1][2] = 5;", stmt("grid(1, 2) = 5"));
        assertEquals("list[i] + 1", expr("LIST(i) + 1"));
    }

    @Test
    void unknownHeadFollowedByMember_isStructuredPath() {
        assertEquals("item[2].name", expr("item(2).name"));
    }

    @Test
    void bareCallable_becomesExplicitCall() {
        useProgram("""
            Function GetValue()
              GetValue = 5
            End Function
            """);
        assertEquals("x = GetValue() + 1;", stmt("x = getvalue + 1"));
    }

    @Test
    void returnAssignment_insideFunction() {
        ParsedProgram program = useProgram("""
            Function Total(a, b)
              Total = a + b
            End Function
            """);
        FunctionUnit unit = program.findUnit("Total").orElseThrow();
        assertEquals("return a + b;", transpiler.transpileStatement("Total = a + b", unit, 2));
    }

    @Test
    void assignmentInsideSub_isNotReturn() {
        ParsedProgram program = useProgram("""
            Sub Reset()
              Reset = 0
            End Sub
            """);
        FunctionUnit unit = program.findUnit("Reset").orElseThrow();
        assertEquals("Reset = 0;", transpiler.transpileStatement("Reset = 0", unit, 2));
    }

    // ========== Statements ==========

    @Test
    void assignments() {
        assertEquals("x = x + 1;", stmt("x = x + 1"));
        assertEquals("obj = null;", stmt("Set obj = Nothing"));
        assertEquals("flag = (x === 1);", stmt("flag = (x = 1)"));
        assertEquals("y = x === 1;", stmt("y = x = 1"));
    }

    @Test
    void procedureCalls() {
        assertEquals("Process(a, b);", stmt("Call Process(a, b)"));
        assertEquals("Process(a, b);", stmt("Process a, b"));
        assertEquals("alert(\"hi\");", stmt("MsgBox \"hi\""));
        assertEquals("DoWork();", stmt("DoWork"));
        assertEquals("log.write(msg);", stmt("log.write msg"));
    }

    // ========== Unknown constructs ==========

    @Test
    void unsupportedStatement_isInertComment() {
        assertEquals("/* UNKNOWN: On Error Resume Next */", stmt("On Error Resume Next"));
        assertEquals(1, diagnostics.getUnknownConstructs());
    }

    @Test
    void objectFactory_isUnknownValue() {
        assertEquals("fso = /* UNKNOWN: CreateObject(\"Scripting.FileSystemObject\") */ null;",
                stmt("Set fso = CreateObject(\"Scripting.FileSystemObject\")"));
        assertEquals(1, diagnostics.getUnknownConstructs());
    }

    @Test
    void unparsableExpression_yieldsNull() {
        assertEquals("/* UNKNOWN: x + */ null", expr("x +"));
        assertEquals(1, diagnostics.getUnknownConstructs());
    }

    @Test
    void unknownText_cannotCloseItsComment() {
        String result = stmt("x = 1 */ 2");
        assertTrue(result.startsWith("/* UNKNOWN: "), result);
        assertEquals(1, result.split("\\*/", -1).length - 1, "only the closing marker remains: " + result);
    }

    @Test
    void contextSelectsStatementOrExpression() {
        assertEquals("x = 1;", transpiler.transpile("x = 1", null, ExpressionContext.ASSIGNMENT, 1));
        assertEquals("x === 1", transpiler.transpile("x = 1", null, ExpressionContext.COMPARISON, 1));
    }

    @Test
    void emptyStatement_isEmpty() {
        assertEquals("", stmt("   "));
        assertTrue(diagnostics.isEmpty());
    }
}
