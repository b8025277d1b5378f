package com.formstudio.parser;

/**
 * Statements that open a section. Every one of them also ends the section before it.
 */
public enum SectionKind {
    MENU("CreateMenu"),
    TOOLBAR("CreateToolBar"),
    STATUSBAR("CreateStatusBar"),
    WINDOW("OpenWindow");

    private final String openerName;

    SectionKind(String openerName) {
        this.openerName = openerName;
    }

    public String getOpenerName() {
        return openerName;
    }

    /**
     * @return the section opened by a call of this name, or null
     */
    public static SectionKind ofOpener(String callName) {
        for (SectionKind kind : values()) {
            if (kind.openerName.equals(callName)) {
                return kind;
            }
        }
        return null;
    }

    public static boolean isBoundary(String callName) {
        return ofOpener(callName) != null;
    }
}
