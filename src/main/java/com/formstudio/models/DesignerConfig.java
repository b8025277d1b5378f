package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Persisted designer settings. Size floors are applied to geometry patches before they are
 * written; the canvas settings are only stored for the UI.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignerConfig {
    private String expectedPbVersion = "";
    private boolean propagateProcedureRenames;
    private int minGadgetWidth = 8;
    private int minGadgetHeight = 8;
    private int minWindowWidth = 40;
    private int minWindowHeight = 40;

    private boolean showGrid = true;
    private int gridSize = 10;
    private boolean snapToGrid;
    private int titleBarHeight = 26;

    public String getExpectedPbVersion() {
        return expectedPbVersion;
    }

    public void setExpectedPbVersion(String expectedPbVersion) {
        this.expectedPbVersion = expectedPbVersion != null ? expectedPbVersion.trim() : "";
    }

    public boolean isPropagateProcedureRenames() {
        return propagateProcedureRenames;
    }

    public void setPropagateProcedureRenames(boolean propagateProcedureRenames) {
        this.propagateProcedureRenames = propagateProcedureRenames;
    }

    public int getMinGadgetWidth() {
        return minGadgetWidth;
    }

    public void setMinGadgetWidth(int minGadgetWidth) {
        this.minGadgetWidth = minGadgetWidth;
    }

    public int getMinGadgetHeight() {
        return minGadgetHeight;
    }

    public void setMinGadgetHeight(int minGadgetHeight) {
        this.minGadgetHeight = minGadgetHeight;
    }

    public int getMinWindowWidth() {
        return minWindowWidth;
    }

    public void setMinWindowWidth(int minWindowWidth) {
        this.minWindowWidth = minWindowWidth;
    }

    public int getMinWindowHeight() {
        return minWindowHeight;
    }

    public void setMinWindowHeight(int minWindowHeight) {
        this.minWindowHeight = minWindowHeight;
    }

    public boolean isShowGrid() {
        return showGrid;
    }

    public void setShowGrid(boolean showGrid) {
        this.showGrid = showGrid;
    }

    public int getGridSize() {
        return gridSize;
    }

    public void setGridSize(int gridSize) {
        this.gridSize = gridSize;
    }

    public boolean isSnapToGrid() {
        return snapToGrid;
    }

    public void setSnapToGrid(boolean snapToGrid) {
        this.snapToGrid = snapToGrid;
    }

    public int getTitleBarHeight() {
        return titleBarHeight;
    }

    public void setTitleBarHeight(int titleBarHeight) {
        this.titleBarHeight = titleBarHeight;
    }

    /**
     * Brings out-of-range values back into their allowed ranges.
     */
    public DesignerConfig normalized() {
        minGadgetWidth = clamp(minGadgetWidth, 1, 1000);
        minGadgetHeight = clamp(minGadgetHeight, 1, 1000);
        minWindowWidth = clamp(minWindowWidth, 1, 4000);
        minWindowHeight = clamp(minWindowHeight, 1, 4000);
        gridSize = clamp(gridSize, 2, 100);
        titleBarHeight = clamp(titleBarHeight, 0, 60);
        return this;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
