package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormMenuEntry {
    private MenuEntryKind kind;
    private int level;
    private String idRaw;
    private String textRaw;
    private String text;
    private SourceRange source;

    public FormMenuEntry() {
    }

    public FormMenuEntry(MenuEntryKind kind, int level, SourceRange source) {
        this.kind = kind;
        this.level = level;
        this.source = source;
    }

    public MenuEntryKind getKind() { return kind; }
    public void setKind(MenuEntryKind kind) { this.kind = kind; }

    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = level; }

    public String getIdRaw() { return idRaw; }
    public void setIdRaw(String idRaw) { this.idRaw = idRaw; }

    public String getTextRaw() { return textRaw; }
    public void setTextRaw(String textRaw) { this.textRaw = textRaw; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public SourceRange getSource() { return source; }
    public void setSource(SourceRange source) { this.source = source; }
}
