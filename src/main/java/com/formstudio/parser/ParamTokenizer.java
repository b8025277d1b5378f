package com.formstudio.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits and decodes the argument text of a statement.
 * All methods are pure and never throw on malformed input.
 */
public final class ParamTokenizer {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("([+-]?)\\$([0-9A-Fa-f]+)");
    private static final Pattern BINARY = Pattern.compile("([+-]?)%([01]+)");

    private ParamTokenizer() {
    }

    /**
     * A single top-level argument: its trimmed text and its {@code [start, end)} offsets
     * relative to the argument text it was split from.
     */
    public record ParamSpan(String text, int start, int end) {
    }

    /**
     * Splits on commas at paren depth 0 outside string literals. Fields are trimmed.
     * Blank input yields an empty list.
     */
    public static List<String> splitParams(String args) {
        List<String> out = new ArrayList<>();
        for (ParamSpan span : splitParamSpans(args)) {
            out.add(span.text());
        }
        return out;
    }

    public static List<ParamSpan> splitParamSpans(String args) {
        List<ParamSpan> out = new ArrayList<>();
        if (args == null || args.isBlank()) {
            return out;
        }
        int depth = 0;
        int fieldStart = 0;
        int i = 0;
        int n = args.length();
        while (i < n) {
            char c = args.charAt(i);
            if (c == '"') {
                i = skipString(args, i);
                continue;
            }
            if (c == ';') {
                // Comment inside a statement continued over several lines.
                i = commentEnd(args, i, n);
                continue;
            }
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                out.add(trimmedSpan(args, fieldStart, i));
                fieldStart = i + 1;
            }
            i++;
        }
        out.add(trimmedSpan(args, fieldStart, n));
        return out;
    }

    /**
     * Returns the index just past the string literal opening at {@code quoteIndex}.
     * {@code ~"..."} literals honor backslash escapes; plain literals end at the next quote
     * (a doubled quote is read as two adjacent literals, which keeps it inside the field).
     * An unterminated literal runs to the end of the line.
     */
    public static int skipString(String s, int quoteIndex) {
        boolean escaped = quoteIndex > 0 && s.charAt(quoteIndex - 1) == '~';
        int i = quoteIndex + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (escaped && c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            if (c == '\n') {
                return i;
            }
            i++;
        }
        return s.length();
    }

    /**
     * Trims whitespace and {@code ;} comments from both ends of {@code [from, to)}. Comments
     * between the field's tokens are dropped from its text but stay inside its span.
     */
    private static ParamSpan trimmedSpan(String s, int from, int to) {
        int start = -1;
        int end = to;
        int i = from;
        while (i < to) {
            char c = s.charAt(i);
            if (c == ';') {
                i = commentEnd(s, i, to);
                continue;
            }
            if (c == '"') {
                int close = Math.min(skipString(s, i), to);
                if (start < 0) {
                    start = i;
                }
                end = close;
                i = close;
                continue;
            }
            if (!Character.isWhitespace(c)) {
                if (start < 0) {
                    start = i;
                }
                end = i + 1;
            }
            i++;
        }
        if (start < 0) {
            return new ParamSpan("", to, to);
        }
        return new ParamSpan(withoutComments(s, start, end), start, end);
    }

    private static String withoutComments(String s, int start, int end) {
        int semicolon = s.indexOf(';', start);
        if (semicolon < 0 || semicolon >= end) {
            return s.substring(start, end);
        }
        StringBuilder sb = new StringBuilder(end - start);
        int i = start;
        while (i < end) {
            char c = s.charAt(i);
            if (c == '"') {
                int close = Math.min(skipString(s, i), end);
                sb.append(s, i, close);
                i = close;
            } else if (c == ';') {
                i = commentEnd(s, i, end);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static int commentEnd(String s, int semicolon, int limit) {
        int i = semicolon;
        while (i < limit && s.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    /**
     * Removes the quotes of a string literal. Plain literals collapse doubled quotes,
     * {@code ~"..."} literals decode their backslash escapes. Anything that is not a single
     * literal, such as a constant or a concatenation, is returned trimmed but otherwise unchanged.
     */
    public static String unquoteString(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        if (t.length() >= 3 && t.startsWith("~\"") && t.endsWith("\"")) {
            String inner = t.substring(2, t.length() - 1);
            String decoded = decodeEscapes(inner);
            return decoded != null ? decoded : t;
        }
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
            String inner = t.substring(1, t.length() - 1);
            if (!isSingleLiteralBody(inner)) {
                return t;
            }
            return inner.replace("\"\"", "\"");
        }
        return t;
    }

    private static boolean isSingleLiteralBody(String inner) {
        int i = 0;
        while (i < inner.length()) {
            if (inner.charAt(i) == '"') {
                if (i + 1 < inner.length() && inner.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return false;
            }
            i++;
        }
        return true;
    }

    private static String decodeEscapes(String inner) {
        StringBuilder sb = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '"') {
                return null;
            }
            if (c != '\\' || i + 1 >= inner.length()) {
                sb.append(c);
                continue;
            }
            char next = inner.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case '"':
                    sb.append('"');
                    break;
                case '\\':
                    sb.append('\\');
                    break;
                default:
                    sb.append('\\').append(next);
                    break;
            }
        }
        return sb.toString();
    }

    /**
     * Builds a plain string literal for {@code text}, doubling embedded quotes.
     */
    public static String quoteString(String text) {
        String value = text != null ? text : "";
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    /**
     * Parses an integer, decimal, {@code $}-hex or {@code %}-binary literal.
     *
     * @return the value, or null when {@code raw} is not a plain numeric literal
     */
    public static Double asNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String t = raw.trim();
        if (t.isEmpty()) {
            return null;
        }
        try {
            if (DECIMAL.matcher(t).matches()) {
                return Double.parseDouble(t);
            }
            var hex = HEX.matcher(t);
            if (hex.matches()) {
                long value = Long.parseLong(hex.group(2), 16);
                return (double) ("-".equals(hex.group(1)) ? -value : value);
            }
            var bin = BINARY.matcher(t);
            if (bin.matches()) {
                long value = Long.parseLong(bin.group(2), 2);
                return (double) ("-".equals(bin.group(1)) ? -value : value);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    /**
     * {@link #asNumber(String)} truncated toward zero, or {@code fallback}.
     */
    public static int asInt(String raw, int fallback) {
        Double value = asNumber(raw);
        if (value == null || value.isNaN() || value.isInfinite()) {
            return fallback;
        }
        return (int) value.doubleValue();
    }

    /**
     * Formats a geometry value the way it is written back into source: truncated toward zero.
     */
    public static String formatInt(double value) {
        return Long.toString((long) value);
    }
}
