package me.christianrobert.vbs2js.transformer.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable VBScript source text with a 1-based line index.
 */
public final class SourceProgram {

    private final String text;
    private final List<String> lines;

    public SourceProgram(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Source text cannot be null");
        }
        this.text = text;

        List<String> split = new ArrayList<>(Arrays.asList(text.split("\\r\\n|\\r|\\n", -1)));
        // A trailing newline does not start another line
        if (split.size() > 1 && split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }
        this.lines = Collections.unmodifiableList(split);
    }

    public static SourceProgram of(String text) {
        return new SourceProgram(text);
    }

    public String getText() {
        return text;
    }

    public int getLineCount() {
        return text.isEmpty() ? 0 : lines.size();
    }

    /**
     * Gets a physical line.
     *
     * @param lineNumber 1-based line number
     * @return the line without its terminator
     */
    public String getLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > getLineCount()) {
            throw new IndexOutOfBoundsException("Line " + lineNumber + " outside 1.." + getLineCount());
        }
        return lines.get(lineNumber - 1);
    }

    public List<String> getLines() {
        return text.isEmpty() ? Collections.emptyList() : lines;
    }
}
