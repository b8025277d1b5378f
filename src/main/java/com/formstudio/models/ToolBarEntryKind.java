package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolBarEntryKind {
    STANDARD_BUTTON("ToolBarStandardButton"),
    BUTTON("ToolBarButton"),
    SEPARATOR("ToolBarSeparator"),
    TOOL_TIP("ToolBarToolTip");

    private final String callName;

    ToolBarEntryKind(String callName) {
        this.callName = callName;
    }

    @JsonValue
    public String getCallName() {
        return callName;
    }

    public static ToolBarEntryKind fromCallName(String name) {
        for (ToolBarEntryKind kind : values()) {
            if (kind.callName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
