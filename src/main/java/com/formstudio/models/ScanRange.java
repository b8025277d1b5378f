package com.formstudio.models;

/**
 * Window of the source text that is actually scanned for form statements.
 */
public class ScanRange {
    private final int start;
    private final int end;

    public ScanRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static ScanRange whole(String text) {
        return new ScanRange(0, text != null ? text.length() : 0);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
