package me.christianrobert.vbs2js.transformer.context;

/**
 * One recorded diagnostic message.
 * Line is the 1-based source line, or 0 when the issue is found in generated text.
 */
public class Diagnostic {

    private final DiagnosticKind kind;
    private final int line;
    private final String message;

    public Diagnostic(DiagnosticKind kind, int line, String message) {
        this.kind = kind;
        this.line = line;
        this.message = message;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return line > 0
                ? kind + " (line " + line + "): " + message
                : kind + ": " + message;
    }
}
