package me.christianrobert.vbs2js.transformer.parser;

import me.christianrobert.vbs2js.core.tools.NameNormalizer;

import java.util.List;

/**
 * One Function or Sub with its parameters, local declarations and body tokens.
 * Read-only once built by {@link ProgramParser}.
 */
public class FunctionUnit {

    private final String name;
    private final UnitKind kind;
    private final List<String> parameters;
    private final List<VariableDeclaration> localDeclarations;
    private final List<Token> bodyTokens;
    private final List<Token.Statement> returnAssignments;
    private final int startLine;
    private final int endLine;

    public FunctionUnit(String name, UnitKind kind, List<String> parameters,
                        List<VariableDeclaration> localDeclarations, List<Token> bodyTokens,
                        List<Token.Statement> returnAssignments, int startLine, int endLine) {
        this.name = name;
        this.kind = kind;
        this.parameters = List.copyOf(parameters);
        this.localDeclarations = List.copyOf(localDeclarations);
        this.bodyTokens = List.copyOf(bodyTokens);
        this.returnAssignments = List.copyOf(returnAssignments);
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String getName() {
        return name;
    }

    public UnitKind getKind() {
        return kind;
    }

    public boolean isValueReturning() {
        return kind == UnitKind.VALUE_RETURNING;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<VariableDeclaration> getLocalDeclarations() {
        return localDeclarations;
    }

    /**
     * Body tokens in source order, boundary tokens excluded.
     */
    public List<Token> getBodyTokens() {
        return bodyTokens;
    }

    public List<Token.Statement> getReturnAssignments() {
        return returnAssignments;
    }

    public boolean hasReturnAssignments() {
        return !returnAssignments.isEmpty();
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public boolean isNamed(String identifier) {
        return NameNormalizer.sameIdentifier(name, identifier);
    }

    public boolean hasParameter(String identifier) {
        return parameters.stream().anyMatch(p -> NameNormalizer.sameIdentifier(p, identifier));
    }

    public boolean declaresLocal(String identifier) {
        return localDeclarations.stream().anyMatch(d -> NameNormalizer.sameIdentifier(d.getName(), identifier));
    }

    @Override
    public String toString() {
        return kind.getKeyword() + " " + name + "(" + String.join(", ", parameters) + ") [" + startLine + "-" + endLine + "]";
    }
}
