package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.DiagnosticKind;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;

/**
 * Appends the closing braces missing at the end of the text. Never removes a brace.
 */
public class BraceBalancer implements PostProcessingStep {

    @Override
    public String getName() {
        return "brace repair";
    }

    @Override
    public String apply(String text, Diagnostics diagnostics) {
        boolean[] mask = JavaScriptScanner.codeMask(text);
        int open = JavaScriptScanner.countInCode(text, mask, '{');
        int close = JavaScriptScanner.countInCode(text, mask, '}');
        int missing = open - close;
        if (missing <= 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.stripTrailing());
        for (int i = 0; i < missing; i++) {
            out.append('\n').append('}');
        }
        out.append('\n');
        diagnostics.record(DiagnosticKind.BRACE_REPAIR, 0,
                "Unbalanced braces: " + open + " open, " + close + " close; appended " + missing, missing);
        return out.toString();
    }
}
