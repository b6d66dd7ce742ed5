package me.christianrobert.vbs2js.transformer.context;

/**
 * Exception thrown during VBScript to JavaScript transpilation.
 * Captures the offending source text and the pipeline step that failed.
 */
public class TransformationException extends RuntimeException {

    private final String sourceText;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.sourceText = null;
        this.context = null;
    }

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
        this.sourceText = null;
        this.context = null;
    }

    public TransformationException(String message, String sourceText, String context) {
        super(message);
        this.sourceText = sourceText;
        this.context = context;
    }

    public TransformationException(String message, String sourceText, String context, Throwable cause) {
        super(message, cause);
        this.sourceText = sourceText;
        this.context = context;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the VBScript source and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (sourceText != null) {
            sb.append("\nVBScript: ").append(sourceText);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
