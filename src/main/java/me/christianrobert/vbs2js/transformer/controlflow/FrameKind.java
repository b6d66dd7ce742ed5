package me.christianrobert.vbs2js.transformer.controlflow;

/**
 * Kinds of open blocks tracked by the reconstructor.
 */
public enum FrameKind {
    IF("If", "End If"),
    FOR("For", "Next"),
    FOR_EACH("For Each", "Next"),
    /** Do loop tested at the top (Do While / Do Until). */
    DO_TOP("Do", "Loop"),
    /** Bare Do, optionally tested at the bottom (Loop While / Loop Until). */
    DO_BOTTOM("Do", "Loop"),
    WHILE("While", "Wend"),
    SELECT("Select Case", "End Select");

    private final String opener;
    private final String closer;

    FrameKind(String opener, String closer) {
        this.opener = opener;
        this.closer = closer;
    }

    public String getOpener() {
        return opener;
    }

    public String getCloser() {
        return closer;
    }

    public boolean isLoop() {
        return this != IF && this != SELECT;
    }

    public boolean isCountedLoop() {
        return this == FOR || this == FOR_EACH;
    }

    public boolean isDoLoop() {
        return this == DO_TOP || this == DO_BOTTOM;
    }
}
