package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormToolBarEntry {
    private ToolBarEntryKind kind;
    private String idRaw;
    private String iconRaw;
    private String textRaw;
    private String text;
    private SourceRange source;

    public FormToolBarEntry() {
    }

    public FormToolBarEntry(ToolBarEntryKind kind, SourceRange source) {
        this.kind = kind;
        this.source = source;
    }

    public ToolBarEntryKind getKind() { return kind; }
    public void setKind(ToolBarEntryKind kind) { this.kind = kind; }

    public String getIdRaw() { return idRaw; }
    public void setIdRaw(String idRaw) { this.idRaw = idRaw; }

    public String getIconRaw() { return iconRaw; }
    public void setIconRaw(String iconRaw) { this.iconRaw = iconRaw; }

    public String getTextRaw() { return textRaw; }
    public void setTextRaw(String textRaw) { this.textRaw = textRaw; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public SourceRange getSource() { return source; }
    public void setSource(SourceRange source) { this.source = source; }
}
