package com.formstudio.models;

/**
 * The "; Form Designer for PureBasic - x.xx" header comment.
 */
public class FormHeaderInfo {
    private final String version;
    private final int line;
    private final boolean hasStrictSyntaxWarning;

    public FormHeaderInfo(String version, int line, boolean hasStrictSyntaxWarning) {
        this.version = version;
        this.line = line;
        this.hasStrictSyntaxWarning = hasStrictSyntaxWarning;
    }

    public String getVersion() {
        return version;
    }

    public int getLine() {
        return line;
    }

    public boolean isHasStrictSyntaxWarning() {
        return hasStrictSyntaxWarning;
    }
}
