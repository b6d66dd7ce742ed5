package me.christianrobert.vbs2js.transformer.controlflow;

import me.christianrobert.vbs2js.core.tools.CodeCleaner;
import me.christianrobert.vbs2js.transformer.builder.ExpressionTranspiler;
import me.christianrobert.vbs2js.transformer.context.ExpressionContext;
import me.christianrobert.vbs2js.transformer.context.TranspilationContext;
import me.christianrobert.vbs2js.transformer.parser.FunctionUnit;
import me.christianrobert.vbs2js.transformer.parser.Token;
import me.christianrobert.vbs2js.transformer.parser.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders Dim, Const and ReDim declarations.
 *
 * VBScript sizes are upper bounds, so a container declared with size N holds N + 1 elements:
 * {@code Dim a(5)} becomes {@code let a = new Array(6);}.
 */
class DeclarationRenderer {

    private final ExpressionTranspiler transpiler;

    DeclarationRenderer(ExpressionTranspiler transpiler) {
        this.transpiler = transpiler;
    }

    /**
     * One JavaScript statement per declared name.
     */
    List<String> render(Token.Declaration declaration, FunctionUnit unit) {
        List<String> statements = new ArrayList<>();
        for (VariableDeclaration variable : declaration.getDeclarations()) {
            String name = transpiler.getKnowledgeBase().canonical(variable.getName());
            if (declaration.isResize()) {
                statements.add(renderResize(variable, name, declaration, unit));
            } else if (variable.isConstant()) {
                String value = transpiler.transpileExpression(variable.getInitializer(), unit, declaration.getLine());
                statements.add("const " + name + " = " + value + ";");
            } else if (!variable.isIndexedContainer()) {
                statements.add("let " + name + ";");
            } else if (!variable.hasContainerSize()) {
                statements.add("let " + name + " = [];");
            } else {
                List<String> lengths = new ArrayList<>();
                for (Integer size : variable.getDimensions()) {
                    lengths.add(CodeCleaner.offsetBound(String.valueOf(size), 1));
                }
                statements.add("let " + name + " = " + allocation(lengths) + ";");
            }
        }
        return statements;
    }

    private String renderResize(VariableDeclaration variable, String name, Token.Declaration declaration,
                                FunctionUnit unit) {
        List<String> lengths = new ArrayList<>();
        for (String size : variable.getSizeExpressions()) {
            lengths.add(length(transpiler.transpileExpression(size, unit, declaration.getLine())));
        }

        if (!declaration.isPreserve()) {
            return name + " = " + allocation(lengths) + ";";
        }
        if (lengths.size() == 1) {
            return name + ".length = " + lengths.get(0) + ";";
        }
        // Preserving a multi-dimensional container has no direct counterpart
        return new TranspilationContext(transpiler.getKnowledgeBase(), transpiler.getDiagnostics(), unit,
                declaration.getLine(), ExpressionContext.ASSIGNMENT).unknownConstruct(declaration.getSourceText());
    }

    /**
     * Element count for an upper bound: computed for integer literals, "n + 1" otherwise.
     */
    private static String length(String upperBound) {
        return CodeCleaner.offsetBound(upperBound, 1);
    }

    /**
     * new Array(n) for one dimension, nested Array.from for more.
     */
    static String allocation(List<String> lengths) {
        String inner = "new Array(" + lengths.get(lengths.size() - 1) + ")";
        for (int i = lengths.size() - 2; i >= 0; i--) {
            inner = "Array.from({ length: " + lengths.get(i) + " }, () => " + inner + ")";
        }
        return inner;
    }
}
