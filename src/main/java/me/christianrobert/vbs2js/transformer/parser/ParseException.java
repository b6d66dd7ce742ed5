package me.christianrobert.vbs2js.transformer.parser;

import me.christianrobert.vbs2js.transformer.context.TransformationException;

/**
 * Fatal parse failure: unterminated or mismatched function boundary, or a malformed
 * declaration. Aborts the transpilation of the whole document.
 */
public class ParseException extends TransformationException {

    private final int lineNumber;
    private final String construct;

    public ParseException(int lineNumber, String construct, String message, String sourceText) {
        super("Line " + lineNumber + ": " + message, sourceText, construct);
        this.lineNumber = lineNumber;
        this.construct = construct;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Short name of the malformed construct (e.g. "Function", "Dim").
     */
    public String getConstruct() {
        return construct;
    }
}
