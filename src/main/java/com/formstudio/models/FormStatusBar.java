package com.formstudio.models;

import java.util.ArrayList;
import java.util.List;

public class FormStatusBar {
    private final String id;
    private final List<FormStatusBarField> fields = new ArrayList<>();
    private final SourceRange source;

    public FormStatusBar(String id, SourceRange source) {
        this.id = id;
        this.source = source;
    }

    public String getId() {
        return id;
    }

    public List<FormStatusBarField> getFields() {
        return fields;
    }

    public SourceRange getSource() {
        return source;
    }
}
