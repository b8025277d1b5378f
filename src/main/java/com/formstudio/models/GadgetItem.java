package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One {@code AddGadgetItem} statement attached to a gadget.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GadgetItem {
    private int index;
    private String posRaw;
    private String textRaw;
    private String text;
    private String imageRaw;
    private String flagsRaw;
    private SourceRange source;

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getPosRaw() { return posRaw; }
    public void setPosRaw(String posRaw) { this.posRaw = posRaw; }

    public String getTextRaw() { return textRaw; }
    public void setTextRaw(String textRaw) { this.textRaw = textRaw; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getImageRaw() { return imageRaw; }
    public void setImageRaw(String imageRaw) { this.imageRaw = imageRaw; }

    public String getFlagsRaw() { return flagsRaw; }
    public void setFlagsRaw(String flagsRaw) { this.flagsRaw = flagsRaw; }

    public SourceRange getSource() { return source; }
    public void setSource(SourceRange source) { this.source = source; }
}
