package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One {@code AddGadgetColumn} statement attached to a gadget.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GadgetColumn {
    private int index;
    private String colRaw;
    private String titleRaw;
    private String title;
    private String widthRaw;
    private SourceRange source;

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getColRaw() { return colRaw; }
    public void setColRaw(String colRaw) { this.colRaw = colRaw; }

    public String getTitleRaw() { return titleRaw; }
    public void setTitleRaw(String titleRaw) { this.titleRaw = titleRaw; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getWidthRaw() { return widthRaw; }
    public void setWidthRaw(String widthRaw) { this.widthRaw = widthRaw; }

    public SourceRange getSource() { return source; }
    public void setSource(SourceRange source) { this.source = source; }
}
