package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of a designer patch request. Which fields are read depends on {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormPatchRequest {
    private String type;
    private String id;
    private Double x;
    private Double y;
    private Double w;
    private Double h;
    private String text;
    private Boolean toPbAny;
    private String variableName;
    private String enumSymbol;
    private String enumValueRaw;
    private Boolean propagateProcedureRenames;
    private Integer sourceLine;
    private String posRaw;
    private String textRaw;
    private String imageRaw;
    private String flagsRaw;
    private String colRaw;
    private String titleRaw;
    private String widthRaw;
    private String menuId;
    private String toolBarId;
    private String statusBarId;
    private String kind;
    private String idRaw;
    private String iconRaw;

    /**
     * Wire name of the {@link FormPatchType}.
     */
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    /**
     * Gadget or window key.
     */
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public Double getW() { return w; }
    public void setW(Double w) { this.w = w; }

    public Double getH() { return h; }
    public void setH(Double h) { this.h = h; }

    /**
     * Plain text for setGadgetText / setWindowTitle; quoted on write.
     */
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Boolean getToPbAny() { return toPbAny; }
    public void setToPbAny(Boolean toPbAny) { this.toPbAny = toPbAny; }

    public String getVariableName() { return variableName; }
    public void setVariableName(String variableName) { this.variableName = variableName; }

    public String getEnumSymbol() { return enumSymbol; }
    public void setEnumSymbol(String enumSymbol) { this.enumSymbol = enumSymbol; }

    public String getEnumValueRaw() { return enumValueRaw; }
    public void setEnumValueRaw(String enumValueRaw) { this.enumValueRaw = enumValueRaw; }

    /**
     * Overrides the configured default when set.
     */
    public Boolean getPropagateProcedureRenames() { return propagateProcedureRenames; }
    public void setPropagateProcedureRenames(Boolean propagateProcedureRenames) { this.propagateProcedureRenames = propagateProcedureRenames; }

    /**
     * Zero-based line of the entry statement to update or delete.
     */
    public Integer getSourceLine() { return sourceLine; }
    public void setSourceLine(Integer sourceLine) { this.sourceLine = sourceLine; }

    public String getPosRaw() { return posRaw; }
    public void setPosRaw(String posRaw) { this.posRaw = posRaw; }

    public String getTextRaw() { return textRaw; }
    public void setTextRaw(String textRaw) { this.textRaw = textRaw; }

    public String getImageRaw() { return imageRaw; }
    public void setImageRaw(String imageRaw) { this.imageRaw = imageRaw; }

    public String getFlagsRaw() { return flagsRaw; }
    public void setFlagsRaw(String flagsRaw) { this.flagsRaw = flagsRaw; }

    public String getColRaw() { return colRaw; }
    public void setColRaw(String colRaw) { this.colRaw = colRaw; }

    public String getTitleRaw() { return titleRaw; }
    public void setTitleRaw(String titleRaw) { this.titleRaw = titleRaw; }

    public String getWidthRaw() { return widthRaw; }
    public void setWidthRaw(String widthRaw) { this.widthRaw = widthRaw; }

    public String getMenuId() { return menuId; }
    public void setMenuId(String menuId) { this.menuId = menuId; }

    public String getToolBarId() { return toolBarId; }
    public void setToolBarId(String toolBarId) { this.toolBarId = toolBarId; }

    public String getStatusBarId() { return statusBarId; }
    public void setStatusBarId(String statusBarId) { this.statusBarId = statusBarId; }

    /**
     * Call name of a menu or toolbar entry kind, e.g. {@code MenuItem}.
     */
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getIdRaw() { return idRaw; }
    public void setIdRaw(String idRaw) { this.idRaw = idRaw; }

    public String getIconRaw() { return iconRaw; }
    public void setIconRaw(String iconRaw) { this.iconRaw = iconRaw; }
}
