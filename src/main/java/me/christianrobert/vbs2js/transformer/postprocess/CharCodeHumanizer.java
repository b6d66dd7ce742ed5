package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.DiagnosticKind;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code String.fromCharCode(N)} for well-known control and quote characters with
 * the equivalent escaped string literal. Other codes stay explicit conversions.
 */
public class CharCodeHumanizer implements PostProcessingStep {

    private static final Pattern FROM_CHAR_CODE = Pattern.compile("String\\.fromCharCode\\(\\s*(\\d+)\\s*\\)");

    private static final Map<Integer, String> LITERALS = Map.of(
            0, "\"\\0\"",
            9, "\"\\t\"",
            10, "\"\\n\"",
            13, "\"\\r\"",
            34, "\"\\\"\"",
            39, "\"'\"",
            92, "\"\\\\\"");

    @Override
    public String getName() {
        return "char-code humanization";
    }

    @Override
    public String apply(String text, Diagnostics diagnostics) {
        boolean[] mask = JavaScriptScanner.codeMask(text);
        Matcher matcher = FROM_CHAR_CODE.matcher(text);
        StringBuilder out = new StringBuilder();
        int last = 0;
        int converted = 0;

        while (matcher.find()) {
            if (!mask[matcher.start()]) {
                continue;
            }
            String code = matcher.group(1);
            String literal = code.length() > 3 ? null : LITERALS.get(Integer.parseInt(code));
            if (literal == null) {
                continue;
            }
            out.append(text, last, matcher.start()).append(literal);
            last = matcher.end();
            converted++;
        }

        if (converted == 0) {
            return text;
        }
        out.append(text.substring(last));
        diagnostics.record(DiagnosticKind.CHAR_CODE_CONVERSION, 0,
                "Replaced " + converted + " String.fromCharCode call(s) with string literals", converted);
        return out.toString();
    }
}
