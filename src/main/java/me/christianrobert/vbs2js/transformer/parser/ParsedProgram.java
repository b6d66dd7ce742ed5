package me.christianrobert.vbs2js.transformer.parser;

import me.christianrobert.vbs2js.core.tools.NameNormalizer;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link ProgramParser}: the units in source order plus everything outside them.
 */
public class ParsedProgram {

    private final List<FunctionUnit> units;
    private final List<VariableDeclaration> globalDeclarations;
    private final List<Token> globalTokens;
    private final int lineCount;

    public ParsedProgram(List<FunctionUnit> units, List<VariableDeclaration> globalDeclarations,
                         List<Token> globalTokens, int lineCount) {
        this.units = List.copyOf(units);
        this.globalDeclarations = List.copyOf(globalDeclarations);
        this.globalTokens = List.copyOf(globalTokens);
        this.lineCount = lineCount;
    }

    public List<FunctionUnit> getUnits() {
        return units;
    }

    public Optional<FunctionUnit> findUnit(String name) {
        return units.stream().filter(u -> u.isNamed(name)).findFirst();
    }

    public List<VariableDeclaration> getGlobalDeclarations() {
        return globalDeclarations;
    }

    /**
     * Script-level tokens (declarations, statements, comments) outside every unit, in source order.
     */
    public List<Token> getGlobalTokens() {
        return globalTokens;
    }

    public int getLineCount() {
        return lineCount;
    }

    public boolean declaresGlobal(String identifier) {
        return globalDeclarations.stream().anyMatch(d -> NameNormalizer.sameIdentifier(d.getName(), identifier));
    }

    @Override
    public String toString() {
        return "ParsedProgram{units=" + units.size() + ", globals=" + globalDeclarations.size()
                + ", globalTokens=" + globalTokens.size() + ", lines=" + lineCount + "}";
    }
}
