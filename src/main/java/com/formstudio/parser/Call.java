package com.formstudio.parser;

import com.formstudio.models.SourceRange;

import java.util.List;

/**
 * One {@code [Var =] Name(args)} statement found by the {@link CallScanner}.
 * {@code range} runs from the first meaningful token (the assigned variable when present)
 * to just past the closing parenthesis; trailing comments are not part of it.
 */
public class Call {
    private final String name;
    private final int nameStart;
    private final String assignedVar;
    private final String args;
    private final int argsStart;
    private final int argsEnd;
    private final String indent;
    private final SourceRange range;
    private final int endLine;

    public Call(String name, int nameStart, String assignedVar, String args, int argsStart, int argsEnd,
                String indent, SourceRange range, int endLine) {
        this.name = name;
        this.nameStart = nameStart;
        this.assignedVar = assignedVar;
        this.args = args;
        this.argsStart = argsStart;
        this.argsEnd = argsEnd;
        this.indent = indent;
        this.range = range;
        this.endLine = endLine;
    }

    public String getName() {
        return name;
    }

    public int getNameStart() {
        return nameStart;
    }

    public String getAssignedVar() {
        return assignedVar;
    }

    public String getArgs() {
        return args;
    }

    /**
     * Offset of the first character after the opening parenthesis.
     */
    public int getArgsStart() {
        return argsStart;
    }

    /**
     * Offset of the closing parenthesis.
     */
    public int getArgsEnd() {
        return argsEnd;
    }

    public String getIndent() {
        return indent;
    }

    public SourceRange getRange() {
        return range;
    }

    public int getLine() {
        return range.getLine();
    }

    /**
     * Line holding the closing parenthesis; differs from {@link #getLine()} for statements
     * continued over several lines.
     */
    public int getEndLine() {
        return endLine;
    }

    public List<String> params() {
        return ParamTokenizer.splitParams(args);
    }

    public List<ParamTokenizer.ParamSpan> paramSpans() {
        return ParamTokenizer.splitParamSpans(args);
    }

    public String firstParam() {
        List<String> params = params();
        return params.isEmpty() ? "" : params.get(0);
    }

    @Override
    public String toString() {
        return (assignedVar != null ? assignedVar + " = " : "") + name + "(" + args + ") @" + range;
    }
}
