package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.DiagnosticKind;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Comments out {@code case}/{@code default} labels that are not directly inside a switch body.
 *
 * <p>Tracks the brace depth line by line. Opening a switch records the depth of its body;
 * a label is in place only at exactly that depth of the innermost open switch.</p>
 */
public class MisplacedClauseDetector implements PostProcessingStep {

    static final String MARKER = "// FIXME misplaced clause: ";

    private static final Pattern SWITCH_HEADER = Pattern.compile("^(?:[A-Za-z_$][\\w$]*:\\s*)?switch\\s*\\(.*");
    private static final Pattern CLAUSE_LABEL = Pattern.compile("^(?:case\\b.*|default\\s*:.*)");

    @Override
    public String getName() {
        return "misplaced clause detection";
    }

    @Override
    public String apply(String text, Diagnostics diagnostics) {
        boolean[] mask = JavaScriptScanner.codeMask(text);
        String[] lines = text.split("\n", -1);
        Deque<Integer> switchBodies = new ArrayDeque<>();
        StringBuilder out = new StringBuilder();
        int depth = 0;
        int offset = 0;

        for (int n = 0; n < lines.length; n++) {
            String line = lines[n];
            String trimmed = line.trim();
            int opened = 0;
            int closed = 0;
            for (int i = 0; i < line.length(); i++) {
                if (!mask[offset + i]) {
                    continue;
                }
                if (line.charAt(i) == '{') {
                    opened++;
                } else if (line.charAt(i) == '}') {
                    closed++;
                }
            }

            boolean startsInCode = !trimmed.isEmpty() && mask[offset + line.indexOf(trimmed.charAt(0))];
            if (startsInCode && CLAUSE_LABEL.matcher(trimmed).matches()
                    && (switchBodies.isEmpty() || switchBodies.peek() != depth)) {
                String indent = line.substring(0, line.indexOf(trimmed.charAt(0)));
                line = indent + MARKER + trimmed;
                diagnostics.record(DiagnosticKind.UNRESOLVED_CASE_PLACEMENT, 0,
                        "Commented out clause label outside a switch body: " + trimmed);
                opened = 0;
                closed = 0;
            } else if (startsInCode && SWITCH_HEADER.matcher(trimmed).matches()) {
                switchBodies.push(depth + 1);
            }

            depth += opened - closed;
            while (!switchBodies.isEmpty() && depth < switchBodies.peek()) {
                switchBodies.pop();
            }

            out.append(line);
            if (n < lines.length - 1) {
                out.append('\n');
            }
            offset += lines[n].length() + 1;
        }
        return out.toString();
    }
}
