package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The form's window, built from its {@code OpenWindow} statement.
 * {@code id} follows the gadget identity rule; {@code enumValueRaw} is only set when the
 * window is addressed by a named constant that carries an explicit enumeration value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormWindow {
    private String id;
    private boolean pbAny;
    private boolean patchable = true;
    private String variable;
    private String enumValueRaw;
    private String firstParam;
    private int x;
    private int y;
    private int w;
    private int h;
    private String xRaw;
    private String yRaw;
    private String wRaw;
    private String hRaw;
    private String title;
    private String flagsExpr;
    private SourceRange source;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public boolean isPbAny() { return pbAny; }
    public void setPbAny(boolean pbAny) { this.pbAny = pbAny; }

    public boolean isPatchable() { return patchable; }
    public void setPatchable(boolean patchable) { this.patchable = patchable; }

    public String getVariable() { return variable; }
    public void setVariable(String variable) { this.variable = variable; }

    public String getEnumValueRaw() { return enumValueRaw; }
    public void setEnumValueRaw(String enumValueRaw) { this.enumValueRaw = enumValueRaw; }

    public String getFirstParam() { return firstParam; }
    public void setFirstParam(String firstParam) { this.firstParam = firstParam; }

    public int getX() { return x; }
    public void setX(int x) { this.x = x; }

    public int getY() { return y; }
    public void setY(int y) { this.y = y; }

    public int getW() { return w; }
    public void setW(int w) { this.w = w; }

    public int getH() { return h; }
    public void setH(int h) { this.h = h; }

    @JsonProperty("xRaw")
    public String getXRaw() { return xRaw; }
    public void setXRaw(String xRaw) { this.xRaw = xRaw; }

    @JsonProperty("yRaw")
    public String getYRaw() { return yRaw; }
    public void setYRaw(String yRaw) { this.yRaw = yRaw; }

    @JsonProperty("wRaw")
    public String getWRaw() { return wRaw; }
    public void setWRaw(String wRaw) { this.wRaw = wRaw; }

    @JsonProperty("hRaw")
    public String getHRaw() { return hRaw; }
    public void setHRaw(String hRaw) { this.hRaw = hRaw; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getFlagsExpr() { return flagsExpr; }
    public void setFlagsExpr(String flagsExpr) { this.flagsExpr = flagsExpr; }

    public SourceRange getSource() { return source; }
    public void setSource(SourceRange source) { this.source = source; }
}
