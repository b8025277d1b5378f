package com.formstudio.parser;

import com.formstudio.models.FormDocument;
import com.formstudio.models.FormEnumerations;
import com.formstudio.models.FormHeaderInfo;
import com.formstudio.models.FormIssue;
import com.formstudio.models.FormMenu;
import com.formstudio.models.FormMenuEntry;
import com.formstudio.models.FormMeta;
import com.formstudio.models.FormStatusBar;
import com.formstudio.models.FormStatusBarField;
import com.formstudio.models.FormToolBar;
import com.formstudio.models.FormToolBarEntry;
import com.formstudio.models.FormWindow;
import com.formstudio.models.Gadget;
import com.formstudio.models.GadgetColumn;
import com.formstudio.models.GadgetItem;
import com.formstudio.models.GadgetKind;
import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ScanRange;
import com.formstudio.models.ToolBarEntryKind;

import java.util.List;

/**
 * Builds a {@link FormDocument} from form source in a single pass over the call stream.
 * Never throws for malformed input; problems end up as issues on the document.
 */
public class FormParser {

    static final String MISSING_HEADER =
        "Missing Form Designer header ('; Form Designer for PureBasic - x.xx').";
    static final String MISSING_STRICT_SYNTAX =
        "Strict syntax warning line not found. The PureBasic IDE usually writes it as the second header comment.";

    public FormDocument parse(String text) {
        String source = text != null ? text : "";
        FormHeaderInfo header = FormHeaderScanner.scanHeader(source);
        ScanRange scanRange = FormHeaderScanner.detectScanRange(source, header);

        List<EnumerationScanner.EnumerationBlock> blocks = EnumerationScanner.scan(source, scanRange);
        EnumerationScanner.EnumerationBlock windowBlock = EnumerationScanner.find(blocks, EnumerationScanner.FORM_WINDOW);
        EnumerationScanner.EnumerationBlock gadgetBlock = EnumerationScanner.find(blocks, EnumerationScanner.FORM_GADGET);
        FormEnumerations enums = new FormEnumerations(
            windowBlock != null ? windowBlock.symbols() : null,
            gadgetBlock != null ? gadgetBlock.symbols() : null);

        FormMeta meta = new FormMeta(header, scanRange, enums);
        if (header == null) {
            meta.addIssue(FormIssue.warning(MISSING_HEADER, 0));
        } else if (!header.isHasStrictSyntaxWarning()) {
            meta.addIssue(FormIssue.info(MISSING_STRICT_SYNTAX, header.getLine()));
        }

        FormDocument document = new FormDocument(meta);
        ParseState state = new ParseState(document, ProcedureScanner.scan(source, scanRange), windowBlock);
        for (Call call : CallScanner.scanCalls(source, scanRange)) {
            apply(state, call);
        }
        return document;
    }

    /**
     * Scan range of {@code text} without building the document.
     */
    public static ScanRange detectScanRange(String text) {
        return FormHeaderScanner.detectScanRange(text != null ? text : "");
    }

    private void apply(ParseState state, Call call) {
        switch (FormStatement.classify(call.getName())) {
            case CREATE_MENU:
                createMenu(state, call);
                break;
            case MENU_ENTRY:
                menuEntry(state, call);
                break;
            case CREATE_TOOLBAR:
                createToolBar(state, call);
                break;
            case TOOLBAR_ENTRY:
                toolBarEntry(state, call);
                break;
            case CREATE_STATUSBAR:
                createStatusBar(state, call);
                break;
            case STATUSBAR_FIELD:
                statusBarField(state, call);
                break;
            case CLOSE_GADGET_LIST:
                state.popContainer();
                break;
            case OPEN_GADGET_LIST:
                openGadgetList(state, call);
                break;
            case ADD_GADGET_ITEM:
                addGadgetItem(state, call);
                break;
            case ADD_GADGET_COLUMN:
                addGadgetColumn(state, call);
                break;
            case OPEN_WINDOW:
                openWindow(state, call);
                break;
            case GADGET:
                gadget(state, call);
                break;
            default:
                break;
        }
    }

    // Sections

    private void createMenu(ParseState state, Call call) {
        String id = call.firstParam();
        state.openMenu(id.isEmpty() ? null : new FormMenu(StableKey.of(call).key(), call.getRange()));
    }

    private void createToolBar(ParseState state, Call call) {
        String id = call.firstParam();
        state.openToolBar(id.isEmpty() ? null : new FormToolBar(StableKey.of(call).key(), call.getRange()));
    }

    private void createStatusBar(ParseState state, Call call) {
        String id = call.firstParam();
        state.openStatusBar(id.isEmpty() ? null : new FormStatusBar(StableKey.of(call).key(), call.getRange()));
    }

    private void menuEntry(ParseState state, Call call) {
        FormMenu menu = state.currentMenu();
        if (menu == null) {
            return;
        }
        MenuEntryKind kind = MenuEntryKind.fromCallName(call.getName());
        List<String> p = call.params();
        FormMenuEntry entry;
        switch (kind) {
            case MENU_TITLE:
                entry = new FormMenuEntry(kind, state.menuLevel(), call.getRange());
                setMenuText(entry, param(p, 0));
                break;
            case MENU_ITEM:
                entry = new FormMenuEntry(kind, state.menuLevel(), call.getRange());
                entry.setIdRaw(param(p, 0));
                setMenuText(entry, param(p, 1));
                break;
            case OPEN_SUB_MENU:
                entry = new FormMenuEntry(kind, state.menuLevel(), call.getRange());
                setMenuText(entry, param(p, 0));
                state.enterSubMenu();
                break;
            case CLOSE_SUB_MENU:
                state.leaveSubMenu();
                entry = new FormMenuEntry(kind, state.menuLevel(), call.getRange());
                break;
            default:
                entry = new FormMenuEntry(kind, state.menuLevel(), call.getRange());
                break;
        }
        menu.getEntries().add(entry);
    }

    private void setMenuText(FormMenuEntry entry, String textRaw) {
        entry.setTextRaw(textRaw);
        entry.setText(ParamTokenizer.unquoteString(textRaw));
    }

    private void toolBarEntry(ParseState state, Call call) {
        FormToolBar toolBar = state.currentToolBar();
        if (toolBar == null) {
            return;
        }
        ToolBarEntryKind kind = ToolBarEntryKind.fromCallName(call.getName());
        List<String> p = call.params();
        FormToolBarEntry entry = new FormToolBarEntry(kind, call.getRange());
        switch (kind) {
            case STANDARD_BUTTON:
                entry.setIdRaw(param(p, 0));
                entry.setIconRaw(param(p, 1));
                break;
            case BUTTON:
                entry.setIdRaw(param(p, 0));
                entry.setIconRaw(param(p, 1));
                if (p.size() > 2) {
                    entry.setTextRaw(p.get(2));
                    entry.setText(ParamTokenizer.unquoteString(p.get(2)));
                }
                break;
            case TOOL_TIP:
                entry.setIdRaw(param(p, 0));
                entry.setTextRaw(param(p, 1));
                entry.setText(ParamTokenizer.unquoteString(param(p, 1)));
                break;
            default:
                break;
        }
        toolBar.getEntries().add(entry);
    }

    private void statusBarField(ParseState state, Call call) {
        FormStatusBar statusBar = state.currentStatusBar();
        String width = call.firstParam();
        if (statusBar == null || width.isEmpty()) {
            return;
        }
        statusBar.getFields().add(new FormStatusBarField(width, call.getRange()));
    }

    // Gadget lists

    private void openGadgetList(ParseState state, Call call) {
        List<String> p = call.params();
        Gadget gadget = state.gadget(param(p, 0));
        if (gadget == null) {
            return;
        }
        state.pushContainer(gadget);
        Double item = p.size() > 1 ? ParamTokenizer.asNumber(p.get(1)) : null;
        if (gadget.getKind() == GadgetKind.PANEL && item != null && item >= 0) {
            state.setPanelItem(gadget.getId(), item.intValue());
        }
    }

    private void addGadgetItem(ParseState state, Call call) {
        List<String> p = call.params();
        if (p.size() < 3) {
            return;
        }
        Gadget gadget = state.gadget(p.get(0));
        if (gadget == null) {
            return;
        }
        GadgetItem item = new GadgetItem();
        item.setPosRaw(p.get(1));
        item.setTextRaw(p.get(2));
        item.setText(ParamTokenizer.unquoteString(p.get(2)));
        item.setImageRaw(optional(p, 3));
        item.setFlagsRaw(optional(p, 4));
        item.setSource(call.getRange());
        item.setIndex(explicitIndex(p.get(1), gadget.itemCount()));
        gadget.addItem(item);

        if (gadget.getKind() == GadgetKind.PANEL) {
            state.setPanelItem(gadget.getId(), item.getIndex());
        }
    }

    private void addGadgetColumn(ParseState state, Call call) {
        List<String> p = call.params();
        if (p.size() < 4) {
            return;
        }
        Gadget gadget = state.gadget(p.get(0));
        if (gadget == null) {
            return;
        }
        GadgetColumn column = new GadgetColumn();
        column.setColRaw(p.get(1));
        column.setTitleRaw(p.get(2));
        column.setTitle(ParamTokenizer.unquoteString(p.get(2)));
        column.setWidthRaw(p.get(3));
        column.setSource(call.getRange());
        column.setIndex(explicitIndex(p.get(1), gadget.columnCount()));
        gadget.addColumn(column);
    }

    private int explicitIndex(String raw, int count) {
        Double pos = ParamTokenizer.asNumber(raw);
        return pos != null && pos >= 0 ? pos.intValue() : count;
    }

    // Window and gadgets

    private void openWindow(ParseState state, Call call) {
        List<String> p = call.params();
        if (p.size() < 6) {
            return;
        }
        state.closeSections();
        StableKey.Identity identity = StableKey.of(call);

        FormWindow window = new FormWindow();
        window.setId(identity.key());
        window.setPbAny(identity.pbAny());
        window.setPatchable(identity.stable());
        window.setVariable(call.getAssignedVar());
        window.setFirstParam(p.get(0));
        window.setXRaw(p.get(1));
        window.setYRaw(p.get(2));
        window.setWRaw(p.get(3));
        window.setHRaw(p.get(4));

        ProcedureScanner.ProcedureBlock procedure =
            ProcedureScanner.enclosing(state.procedures(), call.getRange().getStart());
        window.setX(geometry(p.get(1), procedure));
        window.setY(geometry(p.get(2), procedure));
        window.setW(geometry(p.get(3), procedure));
        window.setH(geometry(p.get(4), procedure));
        window.setTitle(ParamTokenizer.unquoteString(p.get(5)));
        window.setFlagsExpr(optional(p, 6));
        window.setSource(call.getRange());

        if (!identity.pbAny() && state.windowEnumeration() != null) {
            EnumerationScanner.EnumerationEntry entry = state.windowEnumeration().findEntry(identity.key());
            if (entry != null) {
                window.setEnumValueRaw(entry.getValueRaw());
            }
        }
        if (!identity.stable()) {
            state.issue(FormIssue.error(
                "Found OpenWindow(#PB_Any, ...) without a stable assignment (expected: Var = OpenWindow(#PB_Any, ...)). "
                    + "The window cannot be patched.", call.getLine()));
        }
        state.document().setWindow(window);
    }

    /**
     * Numeric token, else the default of the enclosing procedure's parameter of that name, else 0.
     */
    private int geometry(String raw, ProcedureScanner.ProcedureBlock procedure) {
        Double value = ParamTokenizer.asNumber(raw);
        if (value != null) {
            return (int) value.doubleValue();
        }
        if (procedure != null) {
            return ParamTokenizer.asInt(procedure.defaultOf(raw.trim()), 0);
        }
        return 0;
    }

    private void gadget(ParseState state, Call call) {
        List<String> p = call.params();
        if (p.size() < 5) {
            return;
        }
        GadgetKind kind = GadgetKind.fromCallName(call.getName());
        StableKey.Identity identity = StableKey.of(call);

        Gadget gadget = new Gadget();
        gadget.setId(identity.key());
        gadget.setKind(kind);
        gadget.setPbAny(identity.pbAny());
        gadget.setPatchable(identity.stable());
        gadget.setFirstParam(p.get(0));
        gadget.setVariable(call.getAssignedVar());
        gadget.setX(ParamTokenizer.asInt(p.get(1), 0));
        gadget.setY(ParamTokenizer.asInt(p.get(2), 0));
        gadget.setW(ParamTokenizer.asInt(p.get(3), 0));
        gadget.setH(ParamTokenizer.asInt(p.get(4), 0));
        if (kind.hasText() && p.size() > kind.getTextIndex()) {
            gadget.setText(ParamTokenizer.unquoteString(p.get(kind.getTextIndex())));
        }
        if (kind.getFlagsIndex() >= 0) {
            gadget.setFlagsExpr(optional(p, kind.getFlagsIndex()));
        }
        gadget.setSource(call.getRange());

        if (!identity.stable()) {
            state.issue(FormIssue.error(
                "Found " + call.getName() + "(#PB_Any, ...) without a stable assignment (expected: Var = "
                    + call.getName() + "(#PB_Any, ...)). The gadget cannot be patched.", call.getLine()));
        }
        state.addGadget(gadget);
    }

    private static String param(List<String> params, int index) {
        return index < params.size() ? params.get(index) : "";
    }

    private static String optional(List<String> params, int index) {
        if (index >= params.size() || params.get(index).isEmpty()) {
            return null;
        }
        return params.get(index);
    }
}
