package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Gadget {
    private String id;
    private GadgetKind kind;
    private boolean pbAny;
    private boolean patchable = true;
    private String firstParam;
    private String variable;
    private String parentId;
    private Integer parentItem;
    private int x;
    private int y;
    private int w;
    private int h;
    private String text;
    private String flagsExpr;
    private List<GadgetItem> items;
    private List<GadgetColumn> columns;
    private SourceRange source;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public GadgetKind getKind() {
        return kind;
    }

    public void setKind(GadgetKind kind) {
        this.kind = kind;
    }

    public boolean isPbAny() {
        return pbAny;
    }

    public void setPbAny(boolean pbAny) {
        this.pbAny = pbAny;
    }

    public boolean isPatchable() {
        return patchable;
    }

    public void setPatchable(boolean patchable) {
        this.patchable = patchable;
    }

    public String getFirstParam() {
        return firstParam;
    }

    public void setFirstParam(String firstParam) {
        this.firstParam = firstParam;
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public Integer getParentItem() {
        return parentItem;
    }

    public void setParentItem(Integer parentItem) {
        this.parentItem = parentItem;
    }

    public int getX() {
        return x;
    }

    public void setX(int x) {
        this.x = x;
    }

    public int getY() {
        return y;
    }

    public void setY(int y) {
        this.y = y;
    }

    public int getW() {
        return w;
    }

    public void setW(int w) {
        this.w = w;
    }

    public int getH() {
        return h;
    }

    public void setH(int h) {
        this.h = h;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getFlagsExpr() {
        return flagsExpr;
    }

    public void setFlagsExpr(String flagsExpr) {
        this.flagsExpr = flagsExpr;
    }

    public List<GadgetItem> getItems() {
        return items;
    }

    public void setItems(List<GadgetItem> items) {
        this.items = items;
    }

    public List<GadgetColumn> getColumns() {
        return columns;
    }

    public void setColumns(List<GadgetColumn> columns) {
        this.columns = columns;
    }

    public SourceRange getSource() {
        return source;
    }

    public void setSource(SourceRange source) {
        this.source = source;
    }

    public int itemCount() {
        return items != null ? items.size() : 0;
    }

    public int columnCount() {
        return columns != null ? columns.size() : 0;
    }

    public void addItem(GadgetItem item) {
        if (items == null) {
            items = new ArrayList<>();
        }
        items.add(item);
    }

    public void addColumn(GadgetColumn column) {
        if (columns == null) {
            columns = new ArrayList<>();
        }
        columns.add(column);
    }
}
