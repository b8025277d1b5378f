package com.formstudio.emitter;

import com.formstudio.models.ScanRange;
import com.formstudio.models.TextEdit;
import com.formstudio.parser.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code Global} declaration lines in the scanned region and edits against them.
 */
final class GlobalDeclarations {

    private static final Pattern GLOBAL = Pattern.compile("^(\\s*)Global\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME = Pattern.compile("\\*?(\\w+)");

    /**
     * One declared name: its offsets and the offsets of its whole declarator
     * ({@code Name[.type][ = value]}) on the line.
     */
    static class Declared {
        final String name;
        final int nameStart;
        final int declStart;
        final int declEnd;
        final GlobalLine line;

        Declared(String name, int nameStart, int declStart, int declEnd, GlobalLine line) {
            this.name = name;
            this.nameStart = nameStart;
            this.declStart = declStart;
            this.declEnd = declEnd;
            this.line = line;
        }
    }

    static class GlobalLine {
        final int lineStart;
        final int codeEnd;
        final List<Declared> names = new ArrayList<>();

        GlobalLine(int lineStart, int codeEnd) {
            this.lineStart = lineStart;
            this.codeEnd = codeEnd;
        }
    }

    private final String text;
    private final List<GlobalLine> lines = new ArrayList<>();

    private GlobalDeclarations(String text) {
        this.text = text;
    }

    static GlobalDeclarations scan(String text, ScanRange range) {
        GlobalDeclarations out = new GlobalDeclarations(text);
        int start = range != null ? SourceText.clamp(text, range.getStart()) : 0;
        int end = range != null ? SourceText.clamp(text, range.getEnd()) : text.length();
        int lineStart = SourceText.lineStartOf(text, start);
        while (lineStart < end) {
            int lineEnd = SourceText.lineEndOf(text, lineStart);
            String raw = text.substring(lineStart, lineEnd);
            int comment = SourceText.commentStart(raw);
            String code = comment >= 0 ? raw.substring(0, comment) : raw;
            Matcher m = GLOBAL.matcher(code);
            if (m.find()) {
                out.lines.add(parseLine(code, lineStart, m.end()));
            }
            int next = SourceText.nextLineStart(text, lineStart);
            if (next <= lineStart) {
                break;
            }
            lineStart = next;
        }
        return out;
    }

    private static GlobalLine parseLine(String code, int lineStart, int listStart) {
        int codeEnd = code.length();
        while (codeEnd > listStart && Character.isWhitespace(code.charAt(codeEnd - 1))) {
            codeEnd--;
        }
        GlobalLine line = new GlobalLine(lineStart, lineStart + codeEnd);
        int fieldStart = listStart;
        int depth = 0;
        for (int i = listStart; i <= codeEnd; i++) {
            char c = i < codeEnd ? code.charAt(i) : ',';
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                int s = fieldStart;
                while (s < i && Character.isWhitespace(code.charAt(s))) {
                    s++;
                }
                int e = i;
                while (e > s && Character.isWhitespace(code.charAt(e - 1))) {
                    e--;
                }
                Matcher name = NAME.matcher(code.substring(s, e));
                if (name.lookingAt()) {
                    line.names.add(new Declared(name.group(1), lineStart + s + name.start(1),
                        lineStart + s, lineStart + e, line));
                }
                fieldStart = i + 1;
            }
        }
        return line;
    }

    boolean isEmpty() {
        return lines.isEmpty();
    }

    Declared find(String name) {
        for (GlobalLine line : lines) {
            for (Declared declared : line.names) {
                if (declared.name.equalsIgnoreCase(name)) {
                    return declared;
                }
            }
        }
        return null;
    }

    /**
     * New {@code Global name} line after the last Global line, or null when there is none.
     */
    TextEdit insertAfterLast(String name) {
        if (lines.isEmpty()) {
            return null;
        }
        GlobalLine last = lines.get(lines.size() - 1);
        String separator = SourceText.lineSeparator(text);
        String indent = SourceText.leadingWhitespace(text, last.lineStart);
        int next = SourceText.nextLineStart(text, last.lineStart);
        if (next >= text.length() && SourceText.lineEndOf(text, last.lineStart) == text.length()) {
            return TextEdit.insert(text.length(), separator + indent + "Global " + name);
        }
        return TextEdit.insert(next, indent + "Global " + name + separator);
    }

    /**
     * Removes the declarator; a line left without names is removed entirely.
     */
    TextEdit remove(Declared declared) {
        GlobalLine line = declared.line;
        if (line.names.size() == 1) {
            return TextEdit.delete(line.lineStart, SourceText.nextLineStart(text, line.lineStart));
        }
        int index = line.names.indexOf(declared);
        if (index < line.names.size() - 1) {
            return TextEdit.delete(declared.declStart, line.names.get(index + 1).declStart);
        }
        return TextEdit.delete(line.names.get(index - 1).declEnd, declared.declEnd);
    }

    TextEdit rename(Declared declared, String newName) {
        return new TextEdit(declared.nameStart, declared.nameStart + declared.name.length(), newName);
    }
}
