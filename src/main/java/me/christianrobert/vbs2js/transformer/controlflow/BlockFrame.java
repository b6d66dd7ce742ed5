package me.christianrobert.vbs2js.transformer.controlflow;

/**
 * One open block on the reconstructor's stack.
 *
 * Remembers where its header was emitted so an Exit inside a switch can label the loop
 * after the fact.
 */
class BlockFrame {

    private final FrameKind kind;
    private final int sourceLine;
    private final int headerIndex;
    private final int depth;
    private final String header;

    private String label;
    private boolean clauseOpen;

    BlockFrame(FrameKind kind, int sourceLine, int headerIndex, int depth, String header) {
        this.kind = kind;
        this.sourceLine = sourceLine;
        this.headerIndex = headerIndex;
        this.depth = depth;
        this.header = header;
    }

    FrameKind getKind() {
        return kind;
    }

    int getSourceLine() {
        return sourceLine;
    }

    /**
     * Index of the header line in the unit's output.
     */
    int getHeaderIndex() {
        return headerIndex;
    }

    /**
     * Indentation depth of the header line.
     */
    int getDepth() {
        return depth;
    }

    String getHeader() {
        return header;
    }

    String getLabel() {
        return label;
    }

    void setLabel(String label) {
        this.label = label;
    }

    boolean isClauseOpen() {
        return clauseOpen;
    }

    void setClauseOpen(boolean clauseOpen) {
        this.clauseOpen = clauseOpen;
    }

    /**
     * Depth added for the lines inside this block. A switch with an open clause adds two
     * (one for the case label, one for the clause body).
     */
    int innerDepth() {
        return kind == FrameKind.SELECT && clauseOpen ? 2 : 1;
    }

    @Override
    public String toString() {
        return kind.getOpener() + "@" + sourceLine;
    }
}
