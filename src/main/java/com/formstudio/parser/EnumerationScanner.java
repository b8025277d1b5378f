package com.formstudio.parser;

import com.formstudio.models.ScanRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code Enumeration FormWindow} / {@code Enumeration FormGadget} blocks together
 * with the offsets the identity patches need to edit them.
 */
public final class EnumerationScanner {

    public static final String FORM_WINDOW = "FormWindow";
    public static final String FORM_GADGET = "FormGadget";

    private static final Pattern BLOCK_START = Pattern.compile("^\\s*Enumeration\\s+(\\w+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_END = Pattern.compile("^\\s*EndEnumeration\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTRY = Pattern.compile("^(\\s*)(#\\w+\\$?)(?:\\s*=\\s*(.*?))?\\s*$");

    private EnumerationScanner() {
    }

    public static class EnumerationEntry {
        private final String symbol;
        private final String valueRaw;
        private final int line;
        private final int lineStart;
        private final int contentStart;
        private final int contentEnd;

        EnumerationEntry(String symbol, String valueRaw, int line, int lineStart, int contentStart, int contentEnd) {
            this.symbol = symbol;
            this.valueRaw = valueRaw;
            this.line = line;
            this.lineStart = lineStart;
            this.contentStart = contentStart;
            this.contentEnd = contentEnd;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * Text after {@code =}, or null for an implicitly numbered entry.
         */
        public String getValueRaw() {
            return valueRaw;
        }

        public int getLine() {
            return line;
        }

        public int getLineStart() {
            return lineStart;
        }

        /**
         * Offsets of {@code #Symbol[ = value]} on its line; leading indentation and any
         * trailing comment lie outside.
         */
        public int getContentStart() {
            return contentStart;
        }

        public int getContentEnd() {
            return contentEnd;
        }
    }

    public static class EnumerationBlock {
        private final String name;
        private final int headerLine;
        private final int headerLineStart;
        private final List<EnumerationEntry> entries = new ArrayList<>();
        private int endLineStart = -1;

        EnumerationBlock(String name, int headerLine, int headerLineStart) {
            this.name = name;
            this.headerLine = headerLine;
            this.headerLineStart = headerLineStart;
        }

        public String getName() {
            return name;
        }

        public int getHeaderLine() {
            return headerLine;
        }

        public int getHeaderLineStart() {
            return headerLineStart;
        }

        public List<EnumerationEntry> getEntries() {
            return entries;
        }

        /**
         * Start of the {@code EndEnumeration} line, or -1 for an unterminated block.
         */
        public int getEndLineStart() {
            return endLineStart;
        }

        public boolean isClosed() {
            return endLineStart >= 0;
        }

        public EnumerationEntry findEntry(String symbol) {
            for (EnumerationEntry entry : entries) {
                if (entry.getSymbol().equalsIgnoreCase(symbol)) {
                    return entry;
                }
            }
            return null;
        }

        public List<String> symbols() {
            List<String> out = new ArrayList<>();
            for (EnumerationEntry entry : entries) {
                out.add(entry.getSymbol());
            }
            return out;
        }

        /**
         * Indentation used for a new entry: that of the last entry, or one tab.
         */
        public String bodyIndent(String text) {
            if (entries.isEmpty()) {
                return "\t";
            }
            return SourceText.leadingWhitespace(text, entries.get(entries.size() - 1).getLineStart());
        }
    }

    public static List<EnumerationBlock> scan(String text, ScanRange range) {
        List<EnumerationBlock> blocks = new ArrayList<>();
        int start = range != null ? SourceText.clamp(text, range.getStart()) : 0;
        int end = range != null ? SourceText.clamp(text, range.getEnd()) : text.length();
        int lineStart = SourceText.lineStartOf(text, start);
        int line = SourceText.lineOf(text, lineStart);
        EnumerationBlock current = null;

        while (lineStart < end) {
            int lineEnd = SourceText.lineEndOf(text, lineStart);
            String raw = text.substring(lineStart, lineEnd);
            int comment = SourceText.commentStart(raw);
            String code = comment >= 0 ? raw.substring(0, comment) : raw;

            if (current == null) {
                Matcher m = BLOCK_START.matcher(code);
                if (m.find()) {
                    current = new EnumerationBlock(m.group(1), line, lineStart);
                    blocks.add(current);
                }
            } else if (BLOCK_END.matcher(code).find()) {
                current.endLineStart = lineStart;
                current = null;
            } else {
                Matcher m = ENTRY.matcher(code);
                if (m.matches()) {
                    int contentStart = lineStart + m.end(1);
                    int contentEnd = lineStart + m.end(m.group(3) != null ? 3 : 2);
                    String value = m.group(3) != null && !m.group(3).isEmpty() ? m.group(3) : null;
                    current.entries.add(new EnumerationEntry(m.group(2), value, line, lineStart, contentStart, contentEnd));
                }
            }

            int next = SourceText.nextLineStart(text, lineStart);
            if (next <= lineStart) {
                break;
            }
            lineStart = next;
            line++;
        }
        return blocks;
    }

    public static EnumerationBlock find(List<EnumerationBlock> blocks, String name) {
        for (EnumerationBlock block : blocks) {
            if (block.getName().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                return block;
            }
        }
        return null;
    }
}
