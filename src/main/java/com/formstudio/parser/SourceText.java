package com.formstudio.parser;

/**
 * Line and offset helpers over a source text snapshot.
 */
public final class SourceText {

    private SourceText() {
    }

    public static int clamp(String text, int offset) {
        return Math.max(0, Math.min(offset, text.length()));
    }

    /**
     * Zero-based line of {@code offset}.
     */
    public static int lineOf(String text, int offset) {
        int limit = clamp(text, offset);
        int line = 0;
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Offset of the first character of {@code line}, or the text length when the line does not exist.
     */
    public static int lineToOffset(String text, int line) {
        if (line <= 0) {
            return 0;
        }
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                current++;
                if (current == line) {
                    return i + 1;
                }
            }
        }
        return text.length();
    }

    public static int lineStartOf(String text, int offset) {
        int o = clamp(text, offset);
        return text.lastIndexOf('\n', o - 1) + 1;
    }

    /**
     * Offset of the line terminator of the line containing {@code offset} (the {@code \r}
     * of a {@code \r\n} pair), or the text length on the last line.
     */
    public static int lineEndOf(String text, int offset) {
        int o = clamp(text, offset);
        int nl = text.indexOf('\n', o);
        if (nl < 0) {
            return text.length();
        }
        if (nl > 0 && text.charAt(nl - 1) == '\r' && nl - 1 >= o) {
            return nl - 1;
        }
        return nl;
    }

    /**
     * Offset just past the line break of the line containing {@code offset}, or the text length.
     */
    public static int nextLineStart(String text, int offset) {
        int nl = text.indexOf('\n', clamp(text, offset));
        return nl < 0 ? text.length() : nl + 1;
    }

    public static String leadingWhitespace(String text, int lineStart) {
        int i = clamp(text, lineStart);
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(clamp(text, lineStart), i);
    }

    public static String lineText(String text, int lineStart) {
        return text.substring(clamp(text, lineStart), lineEndOf(text, lineStart));
    }

    /**
     * The line separator the text already uses; {@code \n} when it has none.
     */
    public static String lineSeparator(String text) {
        int nl = text.indexOf('\n');
        if (nl > 0 && text.charAt(nl - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }

    /**
     * Index of the first {@code ;} that starts a comment on the line segment, or -1.
     */
    public static int commentStart(String line) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                i = ParamTokenizer.skipString(line, i);
                continue;
            }
            if (c == ';') {
                return i;
            }
            i++;
        }
        return -1;
    }
}
