package com.formstudio.emitter;

import com.formstudio.models.TextEdit;
import com.formstudio.parser.ParamTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-token, case-insensitive replacement of an identifier or {@code #Constant} in code,
 * skipping string literals and comments.
 */
final class IdentifierRewriter {

    private IdentifierRewriter() {
    }

    static List<TextEdit> replaceTokens(String text, int from, int to, String oldToken, String newToken) {
        List<TextEdit> edits = new ArrayList<>();
        if (oldToken == null || oldToken.isEmpty() || oldToken.equalsIgnoreCase(newToken)) {
            return edits;
        }
        int len = oldToken.length();
        int i = Math.max(0, from);
        int end = Math.min(to, text.length());
        while (i < end) {
            char c = text.charAt(i);
            if (c == '"') {
                i = ParamTokenizer.skipString(text, i);
                continue;
            }
            if (c == ';') {
                while (i < end && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (i + len <= end && text.regionMatches(true, i, oldToken, 0, len)
                && isBoundaryBefore(text, i) && isBoundaryAfter(text, i + len)) {
                edits.add(new TextEdit(i, i + len, newToken));
                i += len;
                continue;
            }
            i++;
        }
        return edits;
    }

    private static boolean isBoundaryBefore(String text, int index) {
        if (index == 0) {
            return true;
        }
        char prev = text.charAt(index - 1);
        return !(isIdentifierChar(prev) || prev == '#' || prev == '.' || prev == '\\');
    }

    private static boolean isBoundaryAfter(String text, int index) {
        if (index >= text.length()) {
            return true;
        }
        char next = text.charAt(index);
        return !(isIdentifierChar(next) || next == '$');
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentifierChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
