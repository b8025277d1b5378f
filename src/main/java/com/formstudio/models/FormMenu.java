package com.formstudio.models;

import java.util.ArrayList;
import java.util.List;

public class FormMenu {
    private final String id;
    private final List<FormMenuEntry> entries = new ArrayList<>();
    private final SourceRange source;

    public FormMenu(String id, SourceRange source) {
        this.id = id;
        this.source = source;
    }

    public String getId() {
        return id;
    }

    public List<FormMenuEntry> getEntries() {
        return entries;
    }

    public SourceRange getSource() {
        return source;
    }
}
