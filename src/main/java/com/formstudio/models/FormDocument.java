package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured model of one form source file. Built fresh on every parse.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormDocument {
    private FormWindow window;
    private final List<Gadget> gadgets = new ArrayList<>();
    private final List<FormMenu> menus = new ArrayList<>();
    private final List<FormToolBar> toolbars = new ArrayList<>();
    private final List<FormStatusBar> statusbars = new ArrayList<>();
    private final FormMeta meta;

    public FormDocument(FormMeta meta) {
        this.meta = meta;
    }

    /**
     * Document with no entities and a single error issue, used when parsing failed unexpectedly.
     */
    public static FormDocument failed(String text, String message) {
        FormMeta meta = new FormMeta(null, ScanRange.whole(text), null);
        meta.addIssue(FormIssue.error(message, null));
        return new FormDocument(meta);
    }

    public FormWindow getWindow() {
        return window;
    }

    public void setWindow(FormWindow window) {
        this.window = window;
    }

    public List<Gadget> getGadgets() {
        return gadgets;
    }

    public List<FormMenu> getMenus() {
        return menus;
    }

    public List<FormToolBar> getToolbars() {
        return toolbars;
    }

    public List<FormStatusBar> getStatusbars() {
        return statusbars;
    }

    public FormMeta getMeta() {
        return meta;
    }

    public Gadget findGadget(String id) {
        if (id == null) {
            return null;
        }
        for (Gadget gadget : gadgets) {
            if (id.equals(gadget.getId())) {
                return gadget;
            }
        }
        return null;
    }
}
