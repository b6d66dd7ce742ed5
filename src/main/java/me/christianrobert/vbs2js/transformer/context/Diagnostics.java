package me.christianrobert.vbs2js.transformer.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Counters and messages for the recoverable issues of one transpilation.
 *
 * <p>One instance is created per run by the service and passed explicitly to every
 * pipeline step that can record an issue. A caller receives it with the best-effort
 * output and decides whether to trust that output.</p>
 */
public class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final Map<DiagnosticKind, Integer> counters = new EnumMap<>(DiagnosticKind.class);
    private final List<Diagnostic> messages = new ArrayList<>();

    /**
     * Records one occurrence of an issue.
     */
    public void record(DiagnosticKind kind, int line, String message) {
        record(kind, line, message, 1);
    }

    /**
     * Records an issue that counts more than once (e.g. several appended braces)
     * under a single message.
     */
    public void record(DiagnosticKind kind, int line, String message, int count) {
        if (count <= 0) {
            return;
        }
        counters.merge(kind, count, Integer::sum);
        Diagnostic diagnostic = new Diagnostic(kind, line, message);
        messages.add(diagnostic);
        log.warn("{}", diagnostic);
    }

    public int getCount(DiagnosticKind kind) {
        return counters.getOrDefault(kind, 0);
    }

    public int getUnknownConstructs() {
        return getCount(DiagnosticKind.UNKNOWN_CONSTRUCT);
    }

    public int getUnresolvedCasePlacements() {
        return getCount(DiagnosticKind.UNRESOLVED_CASE_PLACEMENT);
    }

    public int getBraceRepairs() {
        return getCount(DiagnosticKind.BRACE_REPAIR);
    }

    public int getCharCodeConversions() {
        return getCount(DiagnosticKind.CHAR_CODE_CONVERSION);
    }

    public int getAmbiguities() {
        return getCount(DiagnosticKind.AMBIGUITY_UNRESOLVED);
    }

    public int getUnmatchedBlocks() {
        return getCount(DiagnosticKind.UNMATCHED_BLOCK);
    }

    public int getContainerCorrections() {
        return getCount(DiagnosticKind.CONTAINER_ACCESS_CORRECTION);
    }

    public int getTotal() {
        return counters.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<Diagnostic> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<Diagnostic> getMessages(DiagnosticKind kind) {
        return messages.stream()
                .filter(d -> d.getKind() == kind)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    @Override
    public String toString() {
        return "Diagnostics" + counters;
    }
}
