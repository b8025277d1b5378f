package com.formstudio.emitter;

import com.formstudio.models.TextEdit;
import com.formstudio.parser.Call;
import com.formstudio.parser.ParamTokenizer;
import com.formstudio.parser.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Minimal text edits against a single statement found by the call scanner.
 */
final class StatementEdits {

    private StatementEdits() {
    }

    /**
     * One edit per argument in {@code replacements} (index to new token). Returns null when the
     * statement has fewer arguments than an index requires.
     */
    static List<TextEdit> replaceArguments(Call call, Map<Integer, String> replacements) {
        List<ParamTokenizer.ParamSpan> spans = call.paramSpans();
        List<TextEdit> edits = new ArrayList<>();
        for (Map.Entry<Integer, String> replacement : replacements.entrySet()) {
            int index = replacement.getKey();
            if (index >= spans.size()) {
                return null;
            }
            ParamTokenizer.ParamSpan span = spans.get(index);
            edits.add(new TextEdit(call.getArgsStart() + span.start(), call.getArgsStart() + span.end(),
                replacement.getValue()));
        }
        return edits;
    }

    /**
     * Inserts {@code statement} as a new line after the line holding the end of {@code anchor},
     * indented like the anchor.
     */
    static TextEdit insertAfter(String text, Call anchor, String statement) {
        String separator = SourceText.lineSeparator(text);
        int anchorEnd = anchor.getRange().getEnd();
        int lineEnd = SourceText.lineEndOf(text, anchorEnd);
        int next = SourceText.nextLineStart(text, anchorEnd);
        String line = anchor.getIndent() + statement;
        if (next >= text.length() && lineEnd == text.length()) {
            return TextEdit.insert(text.length(), separator + line);
        }
        return TextEdit.insert(next, line + separator);
    }

    /**
     * Replaces the statement itself; indentation and anything after the closing parenthesis stay.
     */
    static TextEdit replaceStatement(Call call, String statement) {
        return new TextEdit(call.getRange().getStart(), call.getRange().getEnd(), statement);
    }

    /**
     * Removes the statement's whole line(s) when nothing else shares them, otherwise only the
     * statement and the {@code :} separator that follows it.
     */
    static TextEdit deleteStatement(String text, Call call) {
        int start = call.getRange().getStart();
        int end = call.getRange().getEnd();
        int lineStart = call.getRange().getLineStart();
        int lineEnd = SourceText.lineEndOf(text, end);
        String before = text.substring(lineStart, start);
        String after = text.substring(end, lineEnd).trim();

        if (before.isBlank() && (after.isEmpty() || after.startsWith(";"))) {
            int next = SourceText.nextLineStart(text, end);
            if (next >= text.length() && lineEnd == text.length() && lineStart > 0) {
                int from = lineStart - 1;
                if (from > 0 && text.charAt(from - 1) == '\r') {
                    from--;
                }
                return TextEdit.delete(from, text.length());
            }
            return TextEdit.delete(lineStart, next);
        }

        int cut = end;
        while (cut < lineEnd && (text.charAt(cut) == ' ' || text.charAt(cut) == '\t')) {
            cut++;
        }
        if (cut < lineEnd && text.charAt(cut) == ':') {
            cut++;
            while (cut < lineEnd && (text.charAt(cut) == ' ' || text.charAt(cut) == '\t')) {
                cut++;
            }
            return TextEdit.delete(start, cut);
        }
        // Trailing statement of a joined line: take the preceding separator with it.
        int from = start;
        while (from > lineStart && (text.charAt(from - 1) == ' ' || text.charAt(from - 1) == '\t')) {
            from--;
        }
        if (from > lineStart && text.charAt(from - 1) == ':') {
            from--;
            while (from > lineStart && (text.charAt(from - 1) == ' ' || text.charAt(from - 1) == '\t')) {
                from--;
            }
        }
        return TextEdit.delete(from, end);
    }
}
