package com.formstudio;

import com.formstudio.emitter.GadgetColumnArgs;
import com.formstudio.emitter.GadgetItemArgs;
import com.formstudio.emitter.MenuEntryArgs;
import com.formstudio.emitter.PatchEmitter;
import com.formstudio.emitter.PatchResult;
import com.formstudio.emitter.ToolBarEntryArgs;
import com.formstudio.emitter.WindowIdentityEmitter;
import com.formstudio.models.DesignerConfig;
import com.formstudio.models.FormDocument;
import com.formstudio.models.FormHeaderInfo;
import com.formstudio.models.FormIssue;
import com.formstudio.models.FormPatchRequest;
import com.formstudio.models.FormPatchType;
import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ScanRange;
import com.formstudio.models.TextEdit;
import com.formstudio.models.ToolBarEntryKind;
import com.formstudio.parser.FormParser;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads form sources from the workspace, parses them and applies designer patches as minimal
 * text edits.
 */
public class FormDesignerService {

    private final WorkspaceService workspaceService;
    private final DesignerConfigStore configStore;
    private final FormParser parser = new FormParser();

    public FormDesignerService(WorkspaceService workspaceService, DesignerConfigStore configStore) {
        this.workspaceService = workspaceService;
        this.configStore = configStore;
    }

    public List<String> listForms() throws IOException {
        return workspaceService.listForms();
    }

    public synchronized FormDocument parse(String path) throws IOException {
        return parseText(workspaceService.readFile(path));
    }

    public DesignerConfig getConfig() {
        return configStore.loadOrDefault();
    }

    public synchronized DesignerConfig saveConfig(DesignerConfig config) throws IOException {
        DesignerConfig saved = configStore.save(config);
        log("Designer config saved to " + configStore.getConfigPath());
        return saved;
    }

    /**
     * Parses {@code text}. An unexpected parser failure yields an empty document carrying a
     * single error issue.
     */
    FormDocument parseText(String text) {
        FormDocument document;
        try {
            document = parser.parse(text);
        } catch (RuntimeException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.error("Form parse failed: " + e.getMessage(), e);
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return FormDocument.failed(text, "Failed to parse form: " + message);
        }
        checkExpectedVersion(document, configStore.loadOrDefault().getExpectedPbVersion());
        return document;
    }

    static void checkExpectedVersion(FormDocument document, String expected) {
        if (expected == null || expected.isEmpty()) {
            return;
        }
        FormHeaderInfo header = document.getMeta().getHeader();
        String actual = header != null ? header.getVersion() : null;
        if (actual == null || actual.isEmpty()) {
            document.getMeta().addIssue(FormIssue.warning(
                "Expected PureBasic version '" + expected + "', but the Form Designer header has no version.", null));
        } else if (!actual.equals(expected)) {
            document.getMeta().addIssue(FormIssue.warning(
                "Form header version is '" + actual + "', but the expected PureBasic version is set to '"
                    + expected + "'.", header.getLine()));
        }
    }

    /**
     * Computes the patch and the resulting document without writing anything.
     */
    public synchronized PatchOutcome preview(String path, FormPatchRequest request) throws IOException {
        String text = workspaceService.readFile(path);
        Computed computed = compute(text, request, configStore.loadOrDefault());
        if (!computed.result().hasEdits()) {
            return PatchOutcome.noEdit(computed.failureMessage());
        }
        String patched = computed.result().applyTo(text);
        return PatchOutcome.success(false, "Preview of " + computed.type().getWireName() + ".",
            diff(path, text, patched), computed.result().getEdits(), parseText(patched));
    }

    /**
     * Computes the patch and writes it as one atomic change.
     *
     * @throws IllegalStateException if the file changed while the patch was computed
     */
    public synchronized PatchOutcome apply(String path, FormPatchRequest request) throws IOException {
        String text = workspaceService.readFile(path);
        Computed computed = compute(text, request, configStore.loadOrDefault());
        if (!computed.result().hasEdits()) {
            log("No edit for " + computed.type().getWireName() + " on " + path + ": " + computed.result().getReason());
            return PatchOutcome.noEdit(computed.failureMessage());
        }
        List<TextEdit> edits = computed.result().getEdits();
        String patched = workspaceService.applyEdits(path, text, edits);
        log("Applied " + computed.type().getWireName() + " to " + path + " (" + edits.size() + " edit(s))");
        return PatchOutcome.success(true, "Applied " + computed.type().getWireName() + ".",
            diff(path, text, patched), edits, parseText(patched));
    }

    record Computed(FormPatchType type, String target, PatchResult result, ScanRange scanRange) {
        String failureMessage() {
            String reason = result.getReason() != null ? result.getReason() : "No edit.";
            if (reason.endsWith(".")) {
                reason = reason.substring(0, reason.length() - 1);
            }
            return "Could not patch " + target + ". " + reason + " (scanRange: " + scanRange + ").";
        }
    }

    static Computed compute(String text, FormPatchRequest request, DesignerConfig config) {
        if (request == null) {
            throw new IllegalArgumentException("Patch request body is required");
        }
        FormPatchType type = FormPatchType.fromWire(request.getType());
        ScanRange sr = FormParser.detectScanRange(text);
        boolean propagate = request.getPropagateProcedureRenames() != null
            ? request.getPropagateProcedureRenames()
            : config.isPropagateProcedureRenames();

        switch (type) {
            case MOVE_GADGET: {
                String id = require(request.getId(), "id");
                return new Computed(type, gadget(id), PatchEmitter.moveGadget(text, id,
                    require(request.getX(), "x"), require(request.getY(), "y"), sr), sr);
            }
            case SET_GADGET_RECT: {
                String id = require(request.getId(), "id");
                double w = Math.max(config.getMinGadgetWidth(), require(request.getW(), "w"));
                double h = Math.max(config.getMinGadgetHeight(), require(request.getH(), "h"));
                return new Computed(type, gadget(id), PatchEmitter.setGadgetRect(text, id,
                    require(request.getX(), "x"), require(request.getY(), "y"), w, h, sr), sr);
            }
            case SET_GADGET_TEXT: {
                String id = require(request.getId(), "id");
                return new Computed(type, gadget(id),
                    PatchEmitter.setGadgetText(text, id, require(request.getText(), "text"), sr), sr);
            }
            case SET_WINDOW_RECT: {
                String id = require(request.getId(), "id");
                double w = Math.max(config.getMinWindowWidth(), require(request.getW(), "w"));
                double h = Math.max(config.getMinWindowHeight(), require(request.getH(), "h"));
                return new Computed(type, window(id), PatchEmitter.setWindowRect(text, id,
                    require(request.getX(), "x"), require(request.getY(), "y"), w, h, sr), sr);
            }
            case SET_WINDOW_TITLE: {
                String id = require(request.getId(), "id");
                return new Computed(type, window(id),
                    PatchEmitter.setWindowTitle(text, id, require(request.getText(), "text"), sr), sr);
            }
            case TOGGLE_WINDOW_PB_ANY: {
                String id = require(request.getId(), "id");
                boolean toPbAny = require(request.getToPbAny(), "toPbAny");
                String variableName = toPbAny ? require(request.getVariableName(), "variableName") : null;
                String enumSymbol = toPbAny ? null : require(request.getEnumSymbol(), "enumSymbol");
                return new Computed(type, window(id), WindowIdentityEmitter.toggleWindowPbAny(text, id, toPbAny,
                    variableName, enumSymbol, request.getEnumValueRaw(), propagate, sr), sr);
            }
            case SET_WINDOW_ENUM_VALUE: {
                String symbol = require(request.getEnumSymbol(), "enumSymbol");
                return new Computed(type, "FormWindow enumeration entry '" + symbol + "'",
                    WindowIdentityEmitter.setWindowEnumValue(text, symbol, request.getEnumValueRaw(), sr), sr);
            }
            case SET_WINDOW_VARIABLE_NAME: {
                String name = require(request.getVariableName(), "variableName");
                return new Computed(type, "FormWindow variable name '" + name + "'",
                    WindowIdentityEmitter.renameWindow(text, name, propagate, sr), sr);
            }
            case INSERT_GADGET_ITEM: {
                String id = require(request.getId(), "id");
                return new Computed(type, "items of " + gadget(id),
                    PatchEmitter.insertGadgetItem(text, id, itemArgs(request), sr), sr);
            }
            case UPDATE_GADGET_ITEM: {
                String id = require(request.getId(), "id");
                return new Computed(type, "items of " + gadget(id), PatchEmitter.updateGadgetItem(text, id,
                    require(request.getSourceLine(), "sourceLine"), itemArgs(request), sr), sr);
            }
            case DELETE_GADGET_ITEM: {
                String id = require(request.getId(), "id");
                return new Computed(type, "items of " + gadget(id), PatchEmitter.deleteGadgetItem(text, id,
                    require(request.getSourceLine(), "sourceLine"), sr), sr);
            }
            case INSERT_GADGET_COLUMN: {
                String id = require(request.getId(), "id");
                return new Computed(type, "columns of " + gadget(id),
                    PatchEmitter.insertGadgetColumn(text, id, columnArgs(request), sr), sr);
            }
            case UPDATE_GADGET_COLUMN: {
                String id = require(request.getId(), "id");
                return new Computed(type, "columns of " + gadget(id), PatchEmitter.updateGadgetColumn(text, id,
                    require(request.getSourceLine(), "sourceLine"), columnArgs(request), sr), sr);
            }
            case DELETE_GADGET_COLUMN: {
                String id = require(request.getId(), "id");
                return new Computed(type, "columns of " + gadget(id), PatchEmitter.deleteGadgetColumn(text, id,
                    require(request.getSourceLine(), "sourceLine"), sr), sr);
            }
            case INSERT_MENU_ENTRY: {
                String menuId = require(request.getMenuId(), "menuId");
                return new Computed(type, menu(menuId),
                    PatchEmitter.insertMenuEntry(text, menuId, menuArgs(request), sr), sr);
            }
            case UPDATE_MENU_ENTRY: {
                String menuId = require(request.getMenuId(), "menuId");
                return new Computed(type, menu(menuId), PatchEmitter.updateMenuEntry(text, menuId,
                    require(request.getSourceLine(), "sourceLine"), menuArgs(request), sr), sr);
            }
            case DELETE_MENU_ENTRY: {
                String menuId = require(request.getMenuId(), "menuId");
                return new Computed(type, menu(menuId), PatchEmitter.deleteMenuEntry(text, menuId,
                    require(request.getSourceLine(), "sourceLine"), menuKind(request.getKind()), sr), sr);
            }
            case INSERT_TOOLBAR_ENTRY: {
                String toolBarId = require(request.getToolBarId(), "toolBarId");
                return new Computed(type, toolBar(toolBarId),
                    PatchEmitter.insertToolBarEntry(text, toolBarId, toolBarArgs(request), sr), sr);
            }
            case UPDATE_TOOLBAR_ENTRY: {
                String toolBarId = require(request.getToolBarId(), "toolBarId");
                return new Computed(type, toolBar(toolBarId), PatchEmitter.updateToolBarEntry(text, toolBarId,
                    require(request.getSourceLine(), "sourceLine"), toolBarArgs(request), sr), sr);
            }
            case DELETE_TOOLBAR_ENTRY: {
                String toolBarId = require(request.getToolBarId(), "toolBarId");
                return new Computed(type, toolBar(toolBarId), PatchEmitter.deleteToolBarEntry(text, toolBarId,
                    require(request.getSourceLine(), "sourceLine"), toolBarKind(request.getKind()), sr), sr);
            }
            case INSERT_STATUSBAR_FIELD: {
                String statusBarId = require(request.getStatusBarId(), "statusBarId");
                return new Computed(type, statusBar(statusBarId),
                    PatchEmitter.insertStatusBarField(text, statusBarId, request.getWidthRaw(), sr), sr);
            }
            case UPDATE_STATUSBAR_FIELD: {
                String statusBarId = require(request.getStatusBarId(), "statusBarId");
                return new Computed(type, statusBar(statusBarId), PatchEmitter.updateStatusBarField(text,
                    statusBarId, require(request.getSourceLine(), "sourceLine"), request.getWidthRaw(), sr), sr);
            }
            case DELETE_STATUSBAR_FIELD: {
                String statusBarId = require(request.getStatusBarId(), "statusBarId");
                return new Computed(type, statusBar(statusBarId), PatchEmitter.deleteStatusBarField(text,
                    statusBarId, require(request.getSourceLine(), "sourceLine"), sr), sr);
            }
            default:
                throw new IllegalArgumentException("Unsupported patch type: " + type.getWireName());
        }
    }

    private static GadgetItemArgs itemArgs(FormPatchRequest request) {
        return new GadgetItemArgs(request.getPosRaw(), request.getTextRaw(), request.getImageRaw(),
            request.getFlagsRaw());
    }

    private static GadgetColumnArgs columnArgs(FormPatchRequest request) {
        return new GadgetColumnArgs(request.getColRaw(), request.getTitleRaw(), request.getWidthRaw());
    }

    private static MenuEntryArgs menuArgs(FormPatchRequest request) {
        return new MenuEntryArgs(menuKind(request.getKind()), request.getIdRaw(), request.getTextRaw());
    }

    private static ToolBarEntryArgs toolBarArgs(FormPatchRequest request) {
        return new ToolBarEntryArgs(toolBarKind(request.getKind()), request.getIdRaw(), request.getIconRaw(),
            request.getTextRaw());
    }

    private static MenuEntryKind menuKind(String kind) {
        MenuEntryKind resolved = MenuEntryKind.fromCallName(require(kind, "kind"));
        if (resolved == null) {
            throw new IllegalArgumentException("Unsupported menu entry kind: " + kind);
        }
        return resolved;
    }

    private static ToolBarEntryKind toolBarKind(String kind) {
        ToolBarEntryKind resolved = ToolBarEntryKind.fromCallName(require(kind, "kind"));
        if (resolved == null) {
            throw new IllegalArgumentException("Unsupported toolbar entry kind: " + kind);
        }
        return resolved;
    }

    private static <T> T require(T value, String field) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static String gadget(String id) {
        return "gadget '" + id + "'";
    }

    private static String window(String id) {
        return "window '" + id + "'";
    }

    private static String menu(String id) {
        return "menu '" + id + "'";
    }

    private static String toolBar(String id) {
        return "toolbar '" + id + "'";
    }

    private static String statusBar(String id) {
        return "statusbar '" + id + "'";
    }

    static String diff(String path, String original, String patched) {
        List<String> before = Arrays.asList(original.split("\r?\n", -1));
        List<String> after = Arrays.asList(patched.split("\r?\n", -1));
        var patch = DiffUtils.diff(before, after);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(path, path, before, patch, 3);
        return String.join("\n", unified);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[FormDesignerService] " + message);
        }
    }

    public static class PatchOutcome {
        private final boolean applied;
        private final String message;
        private final String diff;
        private final List<TextEdit> edits;
        private final FormDocument document;

        private PatchOutcome(boolean applied, String message, String diff, List<TextEdit> edits,
                             FormDocument document) {
            this.applied = applied;
            this.message = message;
            this.diff = diff;
            this.edits = edits;
            this.document = document;
        }

        static PatchOutcome success(boolean applied, String message, String diff, List<TextEdit> edits,
                                    FormDocument document) {
            return new PatchOutcome(applied, message, diff, edits, document);
        }

        static PatchOutcome noEdit(String message) {
            return new PatchOutcome(false, message, "", Collections.emptyList(), null);
        }

        public boolean isApplied() {
            return applied;
        }

        public String getMessage() {
            return message;
        }

        public String getDiff() {
            return diff;
        }

        public List<TextEdit> getEdits() {
            return edits;
        }

        public FormDocument getDocument() {
            return document;
        }

        /**
         * True when the patch produced at least one edit.
         */
        public boolean hasEdits() {
            return !edits.isEmpty();
        }
    }
}
