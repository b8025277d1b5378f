package com.formstudio.parser;

import com.formstudio.models.ScanRange;
import com.formstudio.models.SourceRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds {@code [Var[.type] =] Name(args)} statements in a region of text.
 *
 * Statements start at the beginning of a line or after a {@code :} separator. The argument
 * list may continue over several lines; parentheses are balanced outside string literals and
 * {@code ;} comments. Anything that does not have the call shape is skipped up to the next
 * statement boundary.
 */
public class CallScanner {

    private static final Set<String> KEYWORDS = Set.of(
        "if", "elseif", "else", "while", "until", "repeat", "select", "case", "default",
        "procedurereturn", "for", "foreach", "next", "debug", "not", "and", "or", "xor",
        "return", "with", "protected", "global", "shared", "static", "define", "declare",
        "procedure", "macro", "compilerif", "compilerelseif"
    );

    private final String text;
    private final int[] lineStarts;

    private CallScanner(String text) {
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    public static List<Call> scanCalls(String text) {
        return scanCalls(text, null);
    }

    /**
     * Scans {@code [range.start, range.end)}, or the whole text when {@code range} is null.
     * Offsets of the returned calls are absolute.
     */
    public static List<Call> scanCalls(String text, ScanRange range) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        int start = range != null ? SourceText.clamp(text, range.getStart()) : 0;
        int end = range != null ? SourceText.clamp(text, range.getEnd()) : text.length();
        return new CallScanner(text).scan(start, end);
    }

    static boolean isKeyword(String identifier) {
        return identifier != null && KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT));
    }

    private List<Call> scan(int start, int end) {
        List<Call> calls = new ArrayList<>();
        int pos = start;
        while (pos < end) {
            pos = skipBlanks(pos, end);
            if (pos >= end) {
                break;
            }
            char c = text.charAt(pos);
            if (c == '\n' || c == ':') {
                pos++;
                continue;
            }
            if (c == ';') {
                pos = skipComment(pos, end);
                continue;
            }
            Call call = tryMatch(pos, end);
            if (call != null) {
                calls.add(call);
                pos = skipStatement(call.getRange().getEnd(), end);
            } else {
                pos = skipStatement(pos, end);
            }
        }
        return calls;
    }

    private Call tryMatch(int pos, int end) {
        int firstEnd = readIdentifier(pos, end);
        if (firstEnd < 0) {
            return null;
        }
        String first = text.substring(pos, firstEnd);
        int p = skipBlanks(firstEnd, end);
        boolean typed = false;
        if (p < end && text.charAt(p) == '.') {
            int typeEnd = readIdentifier(p + 1, end);
            if (typeEnd < 0) {
                return null;
            }
            typed = true;
            p = skipBlanks(typeEnd, end);
        }

        String assignedVar = null;
        String name = first;
        int nameStart = pos;
        if (p < end && text.charAt(p) == '=' && (p + 1 >= end || text.charAt(p + 1) != '=')) {
            if (isKeyword(first)) {
                return null;
            }
            assignedVar = first;
            nameStart = skipBlanks(p + 1, end);
            int nameEnd = readIdentifier(nameStart, end);
            if (nameEnd < 0) {
                return null;
            }
            name = text.substring(nameStart, nameEnd);
            p = skipBlanks(nameEnd, end);
        } else if (typed) {
            return null;
        }

        if (isKeyword(name) || p >= end || text.charAt(p) != '(') {
            return null;
        }
        int argsStart = p + 1;
        int close = findClosingParen(argsStart, end);
        if (close < 0) {
            return null;
        }

        int line = lineOf(pos);
        int lineStart = lineStarts[line];
        SourceRange range = new SourceRange(pos, close + 1, line, lineStart);
        String indent = SourceText.leadingWhitespace(text, lineStart);
        return new Call(name, nameStart, assignedVar, text.substring(argsStart, close), argsStart, close,
            indent, range, lineOf(close));
    }

    /**
     * Index of the parenthesis closing the list opened just before {@code from}, or -1.
     */
    private int findClosingParen(int from, int end) {
        int depth = 1;
        int i = from;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '"') {
                i = ParamTokenizer.skipString(text, i);
                continue;
            }
            if (c == ';') {
                i = skipComment(i, end);
                continue;
            }
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth == 0) {
                    return c == ')' ? i : -1;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Moves past the rest of the current statement: to just after the next {@code :} separator
     * or line break outside strings and comments.
     */
    private int skipStatement(int pos, int end) {
        int i = pos;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '"') {
                i = ParamTokenizer.skipString(text, i);
                continue;
            }
            if (c == ';') {
                i = skipComment(i, end);
                continue;
            }
            if (c == '\n') {
                return i + 1;
            }
            if (c == ':') {
                if (i + 1 < end && text.charAt(i + 1) == ':') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return end;
    }

    private int skipComment(int pos, int end) {
        int i = pos;
        while (i < end && text.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    private int skipBlanks(int pos, int end) {
        int i = pos;
        while (i < end) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r') {
                break;
            }
            i++;
        }
        return i;
    }

    /**
     * End of the identifier starting at {@code pos} (a trailing {@code $} is part of it), or -1.
     */
    private int readIdentifier(int pos, int end) {
        if (pos >= end) {
            return -1;
        }
        char c = text.charAt(pos);
        if (!(Character.isLetter(c) || c == '_')) {
            return -1;
        }
        int i = pos + 1;
        while (i < end && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        if (i < end && text.charAt(i) == '$') {
            i++;
        }
        return i;
    }

    private int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    private static int[] computeLineStarts(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }
}
