package com.formstudio.models;

public class FormStatusBarField {
    private final String widthRaw;
    private final SourceRange source;

    public FormStatusBarField(String widthRaw, SourceRange source) {
        this.widthRaw = widthRaw;
        this.source = source;
    }

    public String getWidthRaw() {
        return widthRaw;
    }

    public SourceRange getSource() {
        return source;
    }
}
