package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Patch requests accepted by the designer API, by wire name.
 */
public enum FormPatchType {
    MOVE_GADGET("moveGadget"),
    SET_GADGET_RECT("setGadgetRect"),
    SET_GADGET_TEXT("setGadgetText"),
    SET_WINDOW_RECT("setWindowRect"),
    SET_WINDOW_TITLE("setWindowTitle"),
    TOGGLE_WINDOW_PB_ANY("toggleWindowPbAny"),
    SET_WINDOW_ENUM_VALUE("setWindowEnumValue"),
    SET_WINDOW_VARIABLE_NAME("setWindowVariableName"),
    INSERT_GADGET_ITEM("insertGadgetItem"),
    UPDATE_GADGET_ITEM("updateGadgetItem"),
    DELETE_GADGET_ITEM("deleteGadgetItem"),
    INSERT_GADGET_COLUMN("insertGadgetColumn"),
    UPDATE_GADGET_COLUMN("updateGadgetColumn"),
    DELETE_GADGET_COLUMN("deleteGadgetColumn"),
    INSERT_MENU_ENTRY("insertMenuEntry"),
    UPDATE_MENU_ENTRY("updateMenuEntry"),
    DELETE_MENU_ENTRY("deleteMenuEntry"),
    INSERT_TOOLBAR_ENTRY("insertToolBarEntry"),
    UPDATE_TOOLBAR_ENTRY("updateToolBarEntry"),
    DELETE_TOOLBAR_ENTRY("deleteToolBarEntry"),
    INSERT_STATUSBAR_FIELD("insertStatusBarField"),
    UPDATE_STATUSBAR_FIELD("updateStatusBarField"),
    DELETE_STATUSBAR_FIELD("deleteStatusBarField");

    private final String wireName;

    FormPatchType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for an unknown or missing name
     */
    public static FormPatchType fromWire(String name) {
        for (FormPatchType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown patch type: " + name);
    }
}
