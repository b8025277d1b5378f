package com.formstudio.models;

import java.util.ArrayList;
import java.util.List;

public class FormToolBar {
    private final String id;
    private final List<FormToolBarEntry> entries = new ArrayList<>();
    private final SourceRange source;

    public FormToolBar(String id, SourceRange source) {
        this.id = id;
        this.source = source;
    }

    public String getId() {
        return id;
    }

    public List<FormToolBarEntry> getEntries() {
        return entries;
    }

    public SourceRange getSource() {
        return source;
    }
}
