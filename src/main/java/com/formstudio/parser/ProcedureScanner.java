package com.formstudio.parser;

import com.formstudio.models.ScanRange;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code Procedure ... EndProcedure} blocks and {@code Declare} lines.
 */
public final class ProcedureScanner {

    private static final Pattern PROCEDURE = Pattern.compile(
        "^\\s*(Procedure(?:C|DLL|CDLL)?|Declare(?:C|DLL|CDLL)?)(?:\\.\\w+)?\\s+(\\w+\\$?)\\s*\\(",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern END_PROCEDURE = Pattern.compile("^\\s*EndProcedure\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAM_NAME = Pattern.compile("^(?:(?:List|Map|Array)\\s+)?\\*?(\\w+\\$?)");

    private ProcedureScanner() {
    }

    public record ProcedureParam(String name, String defaultRaw) {
    }

    /**
     * A {@code Procedure} or {@code Declare} header. For declarations {@code endOffset} is the
     * end of the header line.
     */
    public static class ProcedureBlock {
        private final String name;
        private final int nameStart;
        private final boolean declaration;
        private final int headerLine;
        private final int startOffset;
        private final List<ProcedureParam> params;
        private int endOffset;

        ProcedureBlock(String name, int nameStart, boolean declaration, int headerLine, int startOffset,
                       List<ProcedureParam> params) {
            this.name = name;
            this.nameStart = nameStart;
            this.declaration = declaration;
            this.headerLine = headerLine;
            this.startOffset = startOffset;
            this.params = params;
        }

        public String getName() {
            return name;
        }

        public int getNameStart() {
            return nameStart;
        }

        public int getNameEnd() {
            return nameStart + name.length();
        }

        public boolean isDeclaration() {
            return declaration;
        }

        public int getHeaderLine() {
            return headerLine;
        }

        public int getStartOffset() {
            return startOffset;
        }

        public int getEndOffset() {
            return endOffset;
        }

        public List<ProcedureParam> getParams() {
            return params;
        }

        public boolean contains(int offset) {
            return offset >= startOffset && offset < endOffset;
        }

        /**
         * Default value of the parameter named {@code paramName} (case-insensitive), or null.
         */
        public String defaultOf(String paramName) {
            for (ProcedureParam param : params) {
                if (param.name().equalsIgnoreCase(paramName)) {
                    return param.defaultRaw();
                }
            }
            return null;
        }
    }

    public static List<ProcedureBlock> scan(String text, ScanRange range) {
        List<ProcedureBlock> out = new ArrayList<>();
        int start = range != null ? SourceText.clamp(text, range.getStart()) : 0;
        int end = range != null ? SourceText.clamp(text, range.getEnd()) : text.length();
        int lineStart = SourceText.lineStartOf(text, start);
        int line = SourceText.lineOf(text, lineStart);
        ProcedureBlock open = null;

        while (lineStart < end) {
            int lineEnd = SourceText.lineEndOf(text, lineStart);
            String raw = text.substring(lineStart, lineEnd);
            int comment = SourceText.commentStart(raw);
            String code = comment >= 0 ? raw.substring(0, comment) : raw;

            Matcher m = PROCEDURE.matcher(code);
            if (m.find()) {
                boolean declaration = m.group(1).regionMatches(true, 0, "Declare", 0, 7);
                String args = argumentText(code, m.end());
                ProcedureBlock block = new ProcedureBlock(m.group(2), lineStart + m.start(2), declaration, line,
                    lineStart, parseParams(args));
                out.add(block);
                if (declaration) {
                    block.endOffset = lineEnd;
                } else {
                    if (open != null) {
                        open.endOffset = lineStart;
                    }
                    open = block;
                }
            } else if (open != null && END_PROCEDURE.matcher(code).find()) {
                open.endOffset = lineEnd;
                open = null;
            }

            int next = SourceText.nextLineStart(text, lineStart);
            if (next <= lineStart) {
                break;
            }
            lineStart = next;
            line++;
        }
        if (open != null) {
            open.endOffset = end;
        }
        return out;
    }

    /**
     * The procedure body (declarations excluded) containing {@code offset}, or null.
     */
    public static ProcedureBlock enclosing(List<ProcedureBlock> blocks, int offset) {
        for (ProcedureBlock block : blocks) {
            if (!block.isDeclaration() && block.contains(offset)) {
                return block;
            }
        }
        return null;
    }

    private static String argumentText(String code, int afterParen) {
        int depth = 1;
        int i = afterParen;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == '"') {
                i = ParamTokenizer.skipString(code, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return code.substring(afterParen, i);
                }
            }
            i++;
        }
        return code.substring(afterParen);
    }

    private static List<ProcedureParam> parseParams(String args) {
        List<ProcedureParam> params = new ArrayList<>();
        for (String field : ParamTokenizer.splitParams(args)) {
            if (field.isEmpty()) {
                continue;
            }
            int eq = field.indexOf('=');
            String decl = eq >= 0 ? field.substring(0, eq).trim() : field;
            String defaultRaw = eq >= 0 ? field.substring(eq + 1).trim() : null;
            Matcher m = PARAM_NAME.matcher(decl);
            if (m.find()) {
                params.add(new ProcedureParam(m.group(1), defaultRaw));
            }
        }
        return params;
    }
}
