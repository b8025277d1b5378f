package com.formstudio.models;

/**
 * Location of a statement in the source text.
 * Offsets are char indices into the text; {@code end} is exclusive. Lines are zero-based.
 */
public class SourceRange {
    private final int start;
    private final int end;
    private final int line;
    private final int lineStart;

    public SourceRange(int start, int end, int line, int lineStart) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.lineStart = lineStart;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLine() {
        return line;
    }

    public int getLineStart() {
        return lineStart;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ") line " + line;
    }
}
