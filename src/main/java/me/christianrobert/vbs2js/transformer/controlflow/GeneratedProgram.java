package me.christianrobert.vbs2js.transformer.controlflow;

import java.util.ArrayList;
import java.util.List;

/**
 * Script-level code followed by every unit, rendered as one JavaScript text.
 */
public class GeneratedProgram {

    private final List<String> header;
    private final GeneratedUnit preamble;
    private final List<GeneratedUnit> units;

    public GeneratedProgram(List<String> header, GeneratedUnit preamble, List<GeneratedUnit> units) {
        this.header = List.copyOf(header);
        this.preamble = preamble;
        this.units = List.copyOf(units);
    }

    public List<String> getHeader() {
        return header;
    }

    public GeneratedUnit getPreamble() {
        return preamble;
    }

    public List<GeneratedUnit> getUnits() {
        return units;
    }

    /**
     * Header, script-level code, then the units, each section separated by one blank line.
     */
    public String render() {
        List<String> sections = new ArrayList<>();
        if (!header.isEmpty()) {
            sections.add(String.join("\n", header));
        }
        if (preamble != null && !preamble.isEmpty()) {
            sections.add(preamble.render());
        }
        for (GeneratedUnit unit : units) {
            sections.add(unit.render());
        }
        return String.join("\n\n", sections) + "\n";
    }
}
