package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.Diagnostics;

/**
 * Final layout pass: trailing whitespace trimmed, runs of blank lines collapsed to one,
 * leading and trailing blank lines dropped, exactly one trailing newline.
 */
public class OutputFormatter implements PostProcessingStep {

    @Override
    public String getName() {
        return "formatting";
    }

    @Override
    public String apply(String text, Diagnostics diagnostics) {
        StringBuilder out = new StringBuilder();
        boolean previousBlank = true;  // Suppresses leading blank lines
        for (String line : text.split("\r\n|\r|\n", -1)) {
            String trimmed = line.stripTrailing();
            if (trimmed.isEmpty()) {
                if (!previousBlank) {
                    out.append('\n');
                }
                previousBlank = true;
                continue;
            }
            out.append(trimmed).append('\n');
            previousBlank = false;
        }

        // A blank line may still be pending at the end
        int length = out.length();
        while (length > 1 && out.charAt(length - 1) == '\n' && out.charAt(length - 2) == '\n') {
            length--;
        }
        out.setLength(length);
        if (out.length() == 0) {
            return "\n";
        }
        return out.toString();
    }
}
