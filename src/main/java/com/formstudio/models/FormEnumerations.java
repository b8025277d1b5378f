package com.formstudio.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbols declared in the {@code Enumeration FormWindow} and {@code Enumeration FormGadget} blocks.
 */
public class FormEnumerations {
    private List<String> windows = new ArrayList<>();
    private List<String> gadgets = new ArrayList<>();

    public FormEnumerations() {
    }

    public FormEnumerations(List<String> windows, List<String> gadgets) {
        setWindows(windows);
        setGadgets(gadgets);
    }

    public List<String> getWindows() {
        return windows;
    }

    public void setWindows(List<String> windows) {
        this.windows = windows != null ? new ArrayList<>(windows) : new ArrayList<>();
    }

    public List<String> getGadgets() {
        return gadgets;
    }

    public void setGadgets(List<String> gadgets) {
        this.gadgets = gadgets != null ? new ArrayList<>(gadgets) : new ArrayList<>();
    }
}
