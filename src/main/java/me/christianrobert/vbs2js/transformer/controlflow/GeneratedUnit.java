package me.christianrobert.vbs2js.transformer.controlflow;

import java.util.List;

/**
 * Output lines of one unit (or of the script-level code when the name is null).
 */
public class GeneratedUnit {

    private final String name;
    private final List<String> lines;
    private final int startLine;
    private final int endLine;

    public GeneratedUnit(String name, List<String> lines, int startLine, int endLine) {
        this.name = name;
        this.lines = List.copyOf(lines);
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String getName() {
        return name;
    }

    public boolean isGlobal() {
        return name == null;
    }

    public List<String> getLines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.stream().allMatch(l -> l.trim().isEmpty());
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public String render() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "GeneratedUnit{" + (name == null ? "<global>" : name) + ", " + lines.size() + " lines}";
    }
}
