package me.christianrobert.vbs2js.transformer.context;

/**
 * Immutable snapshot of the transpiler settings for one run.
 */
public class TranspilerOptions {

    public static final String DEFAULT_INDENT = "  ";

    private final String indent;
    private final boolean emitHeader;
    private final boolean postProcessingEnabled;
    private final boolean humanizeCharCodes;
    private final boolean containerCorrection;
    private final boolean residualKeywordScan;

    public TranspilerOptions(String indent, boolean emitHeader, boolean postProcessingEnabled,
                             boolean humanizeCharCodes, boolean containerCorrection, boolean residualKeywordScan) {
        this.indent = indent == null ? DEFAULT_INDENT : indent;
        this.emitHeader = emitHeader;
        this.postProcessingEnabled = postProcessingEnabled;
        this.humanizeCharCodes = humanizeCharCodes;
        this.containerCorrection = containerCorrection;
        this.residualKeywordScan = residualKeywordScan;
    }

    public static TranspilerOptions defaults() {
        return new TranspilerOptions(DEFAULT_INDENT, true, true, true, true, true);
    }

    /**
     * Defaults without the header comment; keeps test expectations short.
     */
    public static TranspilerOptions withoutHeader() {
        return new TranspilerOptions(DEFAULT_INDENT, false, true, true, true, true);
    }

    public String getIndent() {
        return indent;
    }

    public boolean isEmitHeader() {
        return emitHeader;
    }

    public boolean isPostProcessingEnabled() {
        return postProcessingEnabled;
    }

    public boolean isHumanizeCharCodes() {
        return humanizeCharCodes;
    }

    public boolean isContainerCorrection() {
        return containerCorrection;
    }

    public boolean isResidualKeywordScan() {
        return residualKeywordScan;
    }

    @Override
    public String toString() {
        return "TranspilerOptions{indent='" + indent + "', emitHeader=" + emitHeader
                + ", postProcessing=" + postProcessingEnabled + ", humanizeCharCodes=" + humanizeCharCodes
                + ", containerCorrection=" + containerCorrection + ", residualKeywordScan=" + residualKeywordScan + "}";
    }
}
