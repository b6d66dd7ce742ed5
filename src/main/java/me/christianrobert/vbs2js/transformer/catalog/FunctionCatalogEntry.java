package me.christianrobert.vbs2js.transformer.catalog;

import me.christianrobert.vbs2js.transformer.parser.UnitKind;

import java.util.List;

/**
 * Summary of one Function or Sub for the result catalog.
 */
public class FunctionCatalogEntry {
    private final String name;
    private final UnitKind kind;
    private final List<String> parameters;
    private final int localVariableCount;
    private final int returnAssignmentCount;
    private final int startLine;
    private final int endLine;

    public FunctionCatalogEntry(String name, UnitKind kind, List<String> parameters, int localVariableCount,
                                int returnAssignmentCount, int startLine, int endLine) {
        this.name = name;
        this.kind = kind;
        this.parameters = List.copyOf(parameters);
        this.localVariableCount = localVariableCount;
        this.returnAssignmentCount = returnAssignmentCount;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String getName() {
        return name;
    }

    public UnitKind getKind() {
        return kind;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public int getLocalVariableCount() {
        return localVariableCount;
    }

    public int getReturnAssignmentCount() {
        return returnAssignmentCount;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    // Source lines from the opening to the closing boundary, both included
    public int getLineSpan() {
        return endLine - startLine + 1;
    }

    @Override
    public String toString() {
        return kind + " " + name + parameters + " lines " + startLine + "-" + endLine;
    }
}
