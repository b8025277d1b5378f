package com.formstudio.emitter;

import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ToolBarEntryKind;
import com.formstudio.parser.FormStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders entry statements in the layout the Form Designer writes them.
 */
final class StatementBuilder {

    private static final String EMPTY_STRING = "\"\"";

    private StatementBuilder() {
    }

    static String gadgetItem(String gadgetKey, GadgetItemArgs args) {
        List<String> out = new ArrayList<>();
        out.add(gadgetKey);
        out.add(orDefault(args.posRaw(), "-1"));
        out.add(orDefault(args.textRaw(), EMPTY_STRING));
        if (args.imageRaw() != null || args.flagsRaw() != null) {
            out.add(orDefault(args.imageRaw(), "0"));
        }
        if (args.flagsRaw() != null) {
            out.add(args.flagsRaw().trim());
        }
        return call(FormStatement.ADD_GADGET_ITEM_CALL, out);
    }

    static String gadgetColumn(String gadgetKey, GadgetColumnArgs args) {
        return call(FormStatement.ADD_GADGET_COLUMN_CALL, List.of(
            gadgetKey,
            orDefault(args.colRaw(), "0"),
            orDefault(args.titleRaw(), EMPTY_STRING),
            orDefault(args.widthRaw(), "100")));
    }

    static String menuEntry(MenuEntryArgs args) {
        MenuEntryKind kind = args.kind();
        switch (kind) {
            case MENU_TITLE:
            case OPEN_SUB_MENU:
                return call(kind.getCallName(), List.of(orDefault(args.textRaw(), EMPTY_STRING)));
            case MENU_ITEM:
                return call(kind.getCallName(), List.of(orDefault(args.idRaw(), "0"),
                    orDefault(args.textRaw(), EMPTY_STRING)));
            default:
                return call(kind.getCallName(), List.of());
        }
    }

    static String toolBarEntry(ToolBarEntryArgs args) {
        ToolBarEntryKind kind = args.kind();
        switch (kind) {
            case STANDARD_BUTTON:
                return call(kind.getCallName(), List.of(orDefault(args.idRaw(), "0"), orDefault(args.iconRaw(), "0")));
            case BUTTON:
                return call(kind.getCallName(), List.of(orDefault(args.idRaw(), "0"), orDefault(args.iconRaw(), "0"),
                    orDefault(args.textRaw(), EMPTY_STRING)));
            case TOOL_TIP:
                return call(kind.getCallName(), List.of(orDefault(args.idRaw(), "0"),
                    orDefault(args.textRaw(), EMPTY_STRING)));
            default:
                return call(kind.getCallName(), List.of());
        }
    }

    static String statusBarField(String widthRaw) {
        return call(FormStatement.ADD_STATUSBAR_FIELD_CALL, List.of(orDefault(widthRaw, "100")));
    }

    private static String call(String name, List<String> args) {
        return name + "(" + String.join(", ", args) + ")";
    }

    private static String orDefault(String raw, String fallback) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        return raw.trim();
    }
}
