package com.formstudio.models;

/**
 * Replacement of the text between {@code start} (inclusive) and {@code end} (exclusive)
 * with {@code newText}. Offsets refer to the text snapshot the edit was computed from.
 * An insertion has {@code start == end}; a deletion has an empty {@code newText}.
 */
public class TextEdit {
    private int start;
    private int end;
    private String newText;

    public TextEdit() {}

    public TextEdit(int start, int end, String newText) {
        this.start = start;
        this.end = end;
        this.newText = newText;
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, offset, text);
    }

    public static TextEdit delete(int start, int end) {
        return new TextEdit(start, end, "");
    }

    public int getStart() { return start; }
    public void setStart(int start) { this.start = start; }

    public int getEnd() { return end; }
    public void setEnd(int end) { this.end = end; }

    public String getNewText() { return newText; }
    public void setNewText(String newText) { this.newText = newText; }

    @Override
    public String toString() {
        return "TextEdit[" + start + "," + end + ") -> \"" + newText + "\"";
    }
}
