package com.formstudio.emitter;

import com.formstudio.models.GadgetKind;
import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ScanRange;
import com.formstudio.models.TextEdit;
import com.formstudio.models.ToolBarEntryKind;
import com.formstudio.parser.Call;
import com.formstudio.parser.CallScanner;
import com.formstudio.parser.FormStatement;
import com.formstudio.parser.ParamTokenizer;
import com.formstudio.parser.SectionKind;
import com.formstudio.parser.SectionResolver;
import com.formstudio.parser.SourceText;
import com.formstudio.parser.StableKey;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Field and structural patches. Every operation re-scans the text it is given, locates the
 * statement that produced the addressed entity and returns the smallest edit list that
 * applies the change.
 */
public final class PatchEmitter {

    private static final Set<String> MENU_ENTRY_NAMES = Arrays.stream(MenuEntryKind.values())
        .map(MenuEntryKind::getCallName).collect(Collectors.toUnmodifiableSet());
    private static final Set<String> TOOLBAR_ENTRY_NAMES = Arrays.stream(ToolBarEntryKind.values())
        .map(ToolBarEntryKind::getCallName).collect(Collectors.toUnmodifiableSet());
    private static final Set<String> STATUSBAR_ENTRY_NAMES = Set.of(FormStatement.ADD_STATUSBAR_FIELD_CALL);

    private static final int WINDOW_TITLE_INDEX = 5;

    private PatchEmitter() {
    }

    // Field patches

    public static PatchResult moveGadget(String text, String gadgetKey, double x, double y, ScanRange scanRange) {
        Map<Integer, String> fields = new LinkedHashMap<>();
        fields.put(1, ParamTokenizer.formatInt(x));
        fields.put(2, ParamTokenizer.formatInt(y));
        return patchGadgetFields(text, gadgetKey, fields, scanRange);
    }

    public static PatchResult setGadgetRect(String text, String gadgetKey, double x, double y, double w, double h,
                                            ScanRange scanRange) {
        return patchGadgetFields(text, gadgetKey, rectFields(x, y, w, h), scanRange);
    }

    public static PatchResult setGadgetText(String text, String gadgetKey, String newText, ScanRange scanRange) {
        if (StableKey.PB_ANY.equals(gadgetKey)) {
            return PatchResult.noEdit(unaddressable("gadget"));
        }
        Call call = findGadgetCall(CallScanner.scanCalls(text, scanRange), gadgetKey);
        if (call == null) {
            return PatchResult.noEdit("No matching gadget call found.");
        }
        GadgetKind kind = GadgetKind.fromCallName(call.getName());
        if (!kind.hasText()) {
            return PatchResult.noEdit(call.getName() + " has no text argument.");
        }
        return fieldResult(call, Map.of(kind.getTextIndex(), ParamTokenizer.quoteString(newText)));
    }

    public static PatchResult setWindowRect(String text, String windowKey, double x, double y, double w, double h,
                                            ScanRange scanRange) {
        if (StableKey.PB_ANY.equals(windowKey)) {
            return PatchResult.noEdit(unaddressable("window"));
        }
        Call call = findWindowCall(CallScanner.scanCalls(text, scanRange), windowKey);
        if (call == null) {
            return PatchResult.noEdit("No matching OpenWindow call found.");
        }
        return fieldResult(call, rectFields(x, y, w, h));
    }

    public static PatchResult setWindowTitle(String text, String windowKey, String title, ScanRange scanRange) {
        if (StableKey.PB_ANY.equals(windowKey)) {
            return PatchResult.noEdit(unaddressable("window"));
        }
        Call call = findWindowCall(CallScanner.scanCalls(text, scanRange), windowKey);
        if (call == null) {
            return PatchResult.noEdit("No matching OpenWindow call found.");
        }
        return fieldResult(call, Map.of(WINDOW_TITLE_INDEX, ParamTokenizer.quoteString(title)));
    }

    private static PatchResult patchGadgetFields(String text, String gadgetKey, Map<Integer, String> fields,
                                                 ScanRange scanRange) {
        if (StableKey.PB_ANY.equals(gadgetKey)) {
            return PatchResult.noEdit(unaddressable("gadget"));
        }
        Call call = findGadgetCall(CallScanner.scanCalls(text, scanRange), gadgetKey);
        if (call == null) {
            return PatchResult.noEdit("No matching gadget call found.");
        }
        return fieldResult(call, fields);
    }

    private static PatchResult fieldResult(Call call, Map<Integer, String> fields) {
        List<TextEdit> edits = StatementEdits.replaceArguments(call, fields);
        if (edits == null) {
            return PatchResult.noEdit(call.getName() + " at line " + (call.getLine() + 1)
                + " has too few arguments.");
        }
        return PatchResult.of(edits);
    }

    private static Map<Integer, String> rectFields(double x, double y, double w, double h) {
        Map<Integer, String> fields = new LinkedHashMap<>();
        fields.put(1, ParamTokenizer.formatInt(x));
        fields.put(2, ParamTokenizer.formatInt(y));
        fields.put(3, ParamTokenizer.formatInt(w));
        fields.put(4, ParamTokenizer.formatInt(h));
        return fields;
    }

    // Gadget items and columns

    public static PatchResult insertGadgetItem(String text, String gadgetKey, GadgetItemArgs args, ScanRange scanRange) {
        return insertOwnEntry(text, gadgetKey, FormStatement.ADD_GADGET_ITEM_CALL,
            StatementBuilder.gadgetItem(gadgetKey, args), scanRange);
    }

    public static PatchResult updateGadgetItem(String text, String gadgetKey, int sourceLine, GadgetItemArgs args,
                                               ScanRange scanRange) {
        Call call = findOwnEntry(text, gadgetKey, sourceLine, FormStatement.ADD_GADGET_ITEM_CALL, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noEntryAt(FormStatement.ADD_GADGET_ITEM_CALL, sourceLine));
        }
        return PatchResult.of(StatementEdits.replaceStatement(call, StatementBuilder.gadgetItem(gadgetKey, args)));
    }

    public static PatchResult deleteGadgetItem(String text, String gadgetKey, int sourceLine, ScanRange scanRange) {
        Call call = findOwnEntry(text, gadgetKey, sourceLine, FormStatement.ADD_GADGET_ITEM_CALL, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noEntryAt(FormStatement.ADD_GADGET_ITEM_CALL, sourceLine));
        }
        return PatchResult.of(StatementEdits.deleteStatement(text, call));
    }

    public static PatchResult insertGadgetColumn(String text, String gadgetKey, GadgetColumnArgs args,
                                                 ScanRange scanRange) {
        return insertOwnEntry(text, gadgetKey, FormStatement.ADD_GADGET_COLUMN_CALL,
            StatementBuilder.gadgetColumn(gadgetKey, args), scanRange);
    }

    public static PatchResult updateGadgetColumn(String text, String gadgetKey, int sourceLine, GadgetColumnArgs args,
                                                 ScanRange scanRange) {
        Call call = findOwnEntry(text, gadgetKey, sourceLine, FormStatement.ADD_GADGET_COLUMN_CALL, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noEntryAt(FormStatement.ADD_GADGET_COLUMN_CALL, sourceLine));
        }
        return PatchResult.of(StatementEdits.replaceStatement(call, StatementBuilder.gadgetColumn(gadgetKey, args)));
    }

    public static PatchResult deleteGadgetColumn(String text, String gadgetKey, int sourceLine, ScanRange scanRange) {
        Call call = findOwnEntry(text, gadgetKey, sourceLine, FormStatement.ADD_GADGET_COLUMN_CALL, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noEntryAt(FormStatement.ADD_GADGET_COLUMN_CALL, sourceLine));
        }
        return PatchResult.of(StatementEdits.deleteStatement(text, call));
    }

    /**
     * Inserts after the gadget's last statement named {@code entryName}, else after the
     * statement that creates the gadget.
     */
    private static PatchResult insertOwnEntry(String text, String gadgetKey, String entryName, String statement,
                                              ScanRange scanRange) {
        if (StableKey.PB_ANY.equals(gadgetKey)) {
            return PatchResult.noEdit(unaddressable("gadget"));
        }
        List<Call> calls = CallScanner.scanCalls(text, scanRange);
        Call anchor = null;
        for (Call call : calls) {
            if (entryName.equals(call.getName()) && gadgetKey.equals(call.firstParam())) {
                anchor = call;
            }
        }
        if (anchor == null) {
            anchor = findGadgetCall(calls, gadgetKey);
        }
        if (anchor == null) {
            return PatchResult.noEdit("No matching gadget call found.");
        }
        return PatchResult.of(StatementEdits.insertAfter(text, anchor, statement));
    }

    private static Call findOwnEntry(String text, String gadgetKey, int sourceLine, String entryName,
                                     ScanRange scanRange) {
        if (!isValidLine(text, sourceLine) || gadgetKey == null) {
            return null;
        }
        for (Call call : CallScanner.scanCalls(text, scanRange)) {
            if (call.getLine() == sourceLine && entryName.equals(call.getName())
                && gadgetKey.equals(call.firstParam())) {
                return call;
            }
        }
        return null;
    }

    // Menus, toolbars and status bars

    public static PatchResult insertMenuEntry(String text, String menuId, MenuEntryArgs args, ScanRange scanRange) {
        return insertSectionEntry(text, SectionKind.MENU, menuId, MENU_ENTRY_NAMES,
            StatementBuilder.menuEntry(args), scanRange);
    }

    public static PatchResult updateMenuEntry(String text, String menuId, int sourceLine, MenuEntryArgs args,
                                              ScanRange scanRange) {
        String name = args.kind().getCallName();
        Call call = findSectionEntry(text, SectionKind.MENU, menuId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "menu", menuId, sourceLine));
        }
        return PatchResult.of(StatementEdits.replaceStatement(call, StatementBuilder.menuEntry(args)));
    }

    public static PatchResult deleteMenuEntry(String text, String menuId, int sourceLine, MenuEntryKind kind,
                                              ScanRange scanRange) {
        String name = kind.getCallName();
        Call call = findSectionEntry(text, SectionKind.MENU, menuId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "menu", menuId, sourceLine));
        }
        return PatchResult.of(StatementEdits.deleteStatement(text, call));
    }

    public static PatchResult insertToolBarEntry(String text, String toolBarId, ToolBarEntryArgs args,
                                                 ScanRange scanRange) {
        return insertSectionEntry(text, SectionKind.TOOLBAR, toolBarId, TOOLBAR_ENTRY_NAMES,
            StatementBuilder.toolBarEntry(args), scanRange);
    }

    public static PatchResult updateToolBarEntry(String text, String toolBarId, int sourceLine, ToolBarEntryArgs args,
                                                 ScanRange scanRange) {
        String name = args.kind().getCallName();
        Call call = findSectionEntry(text, SectionKind.TOOLBAR, toolBarId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "toolbar", toolBarId, sourceLine));
        }
        return PatchResult.of(StatementEdits.replaceStatement(call, StatementBuilder.toolBarEntry(args)));
    }

    public static PatchResult deleteToolBarEntry(String text, String toolBarId, int sourceLine, ToolBarEntryKind kind,
                                                 ScanRange scanRange) {
        String name = kind.getCallName();
        Call call = findSectionEntry(text, SectionKind.TOOLBAR, toolBarId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "toolbar", toolBarId, sourceLine));
        }
        return PatchResult.of(StatementEdits.deleteStatement(text, call));
    }

    public static PatchResult insertStatusBarField(String text, String statusBarId, String widthRaw,
                                                   ScanRange scanRange) {
        return insertSectionEntry(text, SectionKind.STATUSBAR, statusBarId, STATUSBAR_ENTRY_NAMES,
            StatementBuilder.statusBarField(widthRaw), scanRange);
    }

    public static PatchResult updateStatusBarField(String text, String statusBarId, int sourceLine, String widthRaw,
                                                   ScanRange scanRange) {
        String name = FormStatement.ADD_STATUSBAR_FIELD_CALL;
        Call call = findSectionEntry(text, SectionKind.STATUSBAR, statusBarId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "status bar", statusBarId, sourceLine));
        }
        return PatchResult.of(StatementEdits.replaceStatement(call, StatementBuilder.statusBarField(widthRaw)));
    }

    public static PatchResult deleteStatusBarField(String text, String statusBarId, int sourceLine,
                                                   ScanRange scanRange) {
        String name = FormStatement.ADD_STATUSBAR_FIELD_CALL;
        Call call = findSectionEntry(text, SectionKind.STATUSBAR, statusBarId, sourceLine, name, scanRange);
        if (call == null) {
            return PatchResult.noEdit(noSectionEntryAt(name, "status bar", statusBarId, sourceLine));
        }
        return PatchResult.of(StatementEdits.deleteStatement(text, call));
    }

    private static PatchResult insertSectionEntry(String text, SectionKind kind, String sectionId,
                                                  Set<String> entryNames, String statement, ScanRange scanRange) {
        List<Call> calls = CallScanner.scanCalls(text, scanRange);
        int opener = SectionResolver.findOpener(calls, kind, sectionId);
        if (opener < 0) {
            return PatchResult.noEdit("No " + kind.getOpenerName() + "(" + sectionId + ", ...) call found.");
        }
        Call anchor = SectionResolver.lastEntry(calls, opener, entryNames);
        return PatchResult.of(StatementEdits.insertAfter(text, anchor, statement));
    }

    private static Call findSectionEntry(String text, SectionKind kind, String sectionId, int sourceLine,
                                         String entryName, ScanRange scanRange) {
        if (!isValidLine(text, sourceLine)) {
            return null;
        }
        List<Call> calls = CallScanner.scanCalls(text, scanRange);
        for (Call call : calls) {
            if (call.getLine() == sourceLine && entryName.equals(call.getName())) {
                return SectionResolver.isInsideSection(calls, sourceLine, kind, sectionId) ? call : null;
            }
        }
        return null;
    }

    // Lookup

    /**
     * First gadget-constructor statement whose stable key is {@code gadgetKey}.
     */
    static Call findGadgetCall(List<Call> calls, String gadgetKey) {
        for (Call call : calls) {
            if (GadgetKind.fromCallName(call.getName()) == null) {
                continue;
            }
            StableKey.Identity identity = StableKey.of(call);
            if (identity.stable() && identity.key().equals(gadgetKey)) {
                return call;
            }
        }
        return null;
    }

    static Call findWindowCall(List<Call> calls, String windowKey) {
        for (Call call : calls) {
            if (!FormStatement.OPEN_WINDOW_CALL.equals(call.getName())) {
                continue;
            }
            StableKey.Identity identity = StableKey.of(call);
            if (identity.stable() && identity.key().equals(windowKey)) {
                return call;
            }
        }
        return null;
    }

    private static boolean isValidLine(String text, int line) {
        return line >= 0 && line <= SourceText.lineOf(text, text.length());
    }

    private static String unaddressable(String what) {
        return "A " + what + " created with #PB_Any and no assigned variable cannot be addressed.";
    }

    private static String noEntryAt(String name, int sourceLine) {
        return "No matching " + name + " call found at line " + (sourceLine + 1) + ".";
    }

    private static String noSectionEntryAt(String name, String section, String sectionId, int sourceLine) {
        return "No " + name + " call of " + section + " '" + sectionId + "' found at line " + (sourceLine + 1) + ".";
    }
}
