package com.formstudio.parser;

import com.formstudio.models.GadgetKind;
import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ToolBarEntryKind;

/**
 * The closed statement vocabulary the form builder reacts to.
 */
public enum FormStatement {
    OPEN_WINDOW,
    GADGET,
    ADD_GADGET_ITEM,
    ADD_GADGET_COLUMN,
    OPEN_GADGET_LIST,
    CLOSE_GADGET_LIST,
    CREATE_MENU,
    MENU_ENTRY,
    CREATE_TOOLBAR,
    TOOLBAR_ENTRY,
    CREATE_STATUSBAR,
    STATUSBAR_FIELD,
    OTHER;

    public static final String OPEN_WINDOW_CALL = "OpenWindow";
    public static final String ADD_GADGET_ITEM_CALL = "AddGadgetItem";
    public static final String ADD_GADGET_COLUMN_CALL = "AddGadgetColumn";
    public static final String ADD_STATUSBAR_FIELD_CALL = "AddStatusBarField";

    public static FormStatement classify(String callName) {
        if (callName == null) {
            return OTHER;
        }
        switch (callName) {
            case OPEN_WINDOW_CALL:
                return OPEN_WINDOW;
            case ADD_GADGET_ITEM_CALL:
                return ADD_GADGET_ITEM;
            case ADD_GADGET_COLUMN_CALL:
                return ADD_GADGET_COLUMN;
            case "OpenGadgetList":
                return OPEN_GADGET_LIST;
            case "CloseGadgetList":
                return CLOSE_GADGET_LIST;
            case "CreateMenu":
                return CREATE_MENU;
            case "CreateToolBar":
                return CREATE_TOOLBAR;
            case "CreateStatusBar":
                return CREATE_STATUSBAR;
            case ADD_STATUSBAR_FIELD_CALL:
                return STATUSBAR_FIELD;
            default:
                break;
        }
        if (MenuEntryKind.fromCallName(callName) != null) {
            return MENU_ENTRY;
        }
        if (ToolBarEntryKind.fromCallName(callName) != null) {
            return TOOLBAR_ENTRY;
        }
        if (GadgetKind.fromCallName(callName) != null) {
            return GADGET;
        }
        return OTHER;
    }
}
