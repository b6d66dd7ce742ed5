package me.christianrobert.vbs2js.transformer.postprocess;

import me.christianrobert.vbs2js.transformer.context.DiagnosticKind;
import me.christianrobert.vbs2js.transformer.context.Diagnostics;
import me.christianrobert.vbs2js.transformer.context.KnowledgeBase;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites {@code X(args)} to {@code X[args]} for every container of the knowledge base
 * that still appears with call syntax in the generated text.
 *
 * <p>Skips strings, comments, member accesses ({@code obj.X(...)}) and function
 * declarations. Nested accesses inside the arguments are corrected as well.</p>
 */
public class ContainerAccessCorrector implements PostProcessingStep {

    private final KnowledgeBase knowledgeBase;
    private final Pattern containerCall;

    public ContainerAccessCorrector(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
        this.containerCall = buildPattern(knowledgeBase);
    }

    private static Pattern buildPattern(KnowledgeBase knowledgeBase) {
        if (knowledgeBase.getContainerNames().isEmpty()) {
            return null;
        }
        String alternatives = knowledgeBase.getContainerNames().stream()
                .sorted((a, b) -> b.length() - a.length())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w$.])(" + alternatives + ")\\s*\\(", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String getName() {
        return "container access correction";
    }

    @Override
    public String apply(String text, Diagnostics diagnostics) {
        if (containerCall == null) {
            return text;
        }

        String current = text;
        boolean[] mask = JavaScriptScanner.codeMask(current);
        int position = 0;

        while (true) {
            Matcher matcher = containerCall.matcher(current);
            if (!matcher.find(position)) {
                break;
            }
            int start = matcher.start(1);
            int open = matcher.end() - 1;
            position = matcher.end();

            if (!mask[start] || isFunctionDeclaration(current, start)) {
                continue;
            }
            int close = JavaScriptScanner.findClosingParenthesis(current, mask, open);
            if (close < 0) {
                continue;
            }
            List<String> arguments = JavaScriptScanner.splitArguments(current.substring(open + 1, close));
            if (arguments.isEmpty() || arguments.contains("")) {
                continue;
            }

            String name = knowledgeBase.canonical(matcher.group(1));
            StringBuilder replacement = new StringBuilder(name);
            for (String argument : arguments) {
                replacement.append('[').append(argument).append(']');
            }
            String original = current.substring(start, close + 1);
            current = current.substring(0, start) + replacement + current.substring(close + 1);
            mask = JavaScriptScanner.codeMask(current);
            position = start + name.length();

            diagnostics.record(DiagnosticKind.CONTAINER_ACCESS_CORRECTION, 0,
                    "Rewrote container access " + original + " as " + replacement);
        }
        return current;
    }

    private static boolean isFunctionDeclaration(String text, int nameStart) {
        return text.substring(0, nameStart).stripTrailing().endsWith("function");
    }
}
