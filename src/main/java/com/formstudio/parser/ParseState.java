package com.formstudio.parser;

import com.formstudio.models.FormDocument;
import com.formstudio.models.FormIssue;
import com.formstudio.models.FormMenu;
import com.formstudio.models.FormStatusBar;
import com.formstudio.models.FormToolBar;
import com.formstudio.models.Gadget;
import com.formstudio.models.GadgetKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for one run of {@link FormParser}. Holds the container stack, the open
 * section and the gadget index; discarded after the parse.
 */
class ParseState {

    static class ParentFrame {
        final String id;
        final GadgetKind kind;
        Integer currentItem;

        ParentFrame(String id, GadgetKind kind, Integer currentItem) {
            this.id = id;
            this.kind = kind;
            this.currentItem = currentItem;
        }
    }

    private final FormDocument document;
    private final List<ProcedureScanner.ProcedureBlock> procedures;
    private final EnumerationScanner.EnumerationBlock windowEnumeration;
    private final Map<String, Gadget> gadgetsById = new HashMap<>();
    private final Map<String, Integer> panelCurrentItem = new HashMap<>();
    private final Deque<ParentFrame> parents = new ArrayDeque<>();

    private FormMenu currentMenu;
    private int menuLevel;
    private FormToolBar currentToolBar;
    private FormStatusBar currentStatusBar;

    ParseState(FormDocument document, List<ProcedureScanner.ProcedureBlock> procedures,
               EnumerationScanner.EnumerationBlock windowEnumeration) {
        this.document = document;
        this.procedures = procedures;
        this.windowEnumeration = windowEnumeration;
    }

    FormDocument document() {
        return document;
    }

    void issue(FormIssue issue) {
        document.getMeta().addIssue(issue);
    }

    List<ProcedureScanner.ProcedureBlock> procedures() {
        return procedures;
    }

    EnumerationScanner.EnumerationBlock windowEnumeration() {
        return windowEnumeration;
    }

    // Sections

    void closeSections() {
        currentMenu = null;
        currentToolBar = null;
        currentStatusBar = null;
        menuLevel = 0;
    }

    void openMenu(FormMenu menu) {
        closeSections();
        currentMenu = menu;
        if (menu != null) {
            document.getMenus().add(menu);
        }
    }

    void openToolBar(FormToolBar toolBar) {
        closeSections();
        currentToolBar = toolBar;
        if (toolBar != null) {
            document.getToolbars().add(toolBar);
        }
    }

    void openStatusBar(FormStatusBar statusBar) {
        closeSections();
        currentStatusBar = statusBar;
        if (statusBar != null) {
            document.getStatusbars().add(statusBar);
        }
    }

    FormMenu currentMenu() {
        return currentMenu;
    }

    FormToolBar currentToolBar() {
        return currentToolBar;
    }

    FormStatusBar currentStatusBar() {
        return currentStatusBar;
    }

    int menuLevel() {
        return menuLevel;
    }

    void enterSubMenu() {
        menuLevel++;
    }

    void leaveSubMenu() {
        menuLevel = Math.max(0, menuLevel - 1);
    }

    // Gadgets and containers

    void addGadget(Gadget gadget) {
        ParentFrame parent = parents.peek();
        if (parent != null) {
            gadget.setParentId(parent.id);
            if (parent.kind == GadgetKind.PANEL && parent.currentItem != null) {
                gadget.setParentItem(parent.currentItem);
            }
        }
        document.getGadgets().add(gadget);
        if (gadget.isPatchable()) {
            gadgetsById.put(gadget.getId(), gadget);
        }
        if (gadget.getKind().isContainer()) {
            pushContainer(gadget);
        }
    }

    Gadget gadget(String id) {
        return id != null ? gadgetsById.get(id.trim()) : null;
    }

    void pushContainer(Gadget gadget) {
        Integer item = gadget.getKind() == GadgetKind.PANEL ? panelCurrentItem.get(gadget.getId()) : null;
        parents.push(new ParentFrame(gadget.getId(), gadget.getKind(), item));
    }

    void popContainer() {
        if (!parents.isEmpty()) {
            parents.pop();
        }
    }

    /**
     * Records the active tab of a panel and mirrors it into the nearest stack frame for it.
     */
    void setPanelItem(String panelId, int item) {
        panelCurrentItem.put(panelId, item);
        for (ParentFrame frame : parents) {
            if (frame.kind == GadgetKind.PANEL && frame.id.equals(panelId)) {
                frame.currentItem = item;
                break;
            }
        }
    }
}
