package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MenuEntryKind {
    MENU_TITLE("MenuTitle"),
    MENU_ITEM("MenuItem"),
    MENU_BAR("MenuBar"),
    OPEN_SUB_MENU("OpenSubMenu"),
    CLOSE_SUB_MENU("CloseSubMenu");

    private final String callName;

    MenuEntryKind(String callName) {
        this.callName = callName;
    }

    @JsonValue
    public String getCallName() {
        return callName;
    }

    public static MenuEntryKind fromCallName(String name) {
        for (MenuEntryKind kind : values()) {
            if (kind.callName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
