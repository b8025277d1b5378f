package com.formstudio.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Gadget constructors known to the form designer.
 * Each kind records which positional argument carries its text and which carries its
 * flags ({@code -1} when the constructor has none).
 */
public enum GadgetKind {
    BUTTON("ButtonGadget", 5, 6),
    BUTTON_IMAGE("ButtonImageGadget", -1, 6),
    STRING("StringGadget", 5, 6),
    TEXT("TextGadget", 5, 6),
    CHECK_BOX("CheckBoxGadget", 5, 6),
    OPTION("OptionGadget", 5, -1),
    FRAME("FrameGadget", 5, 6),
    COMBO_BOX("ComboBoxGadget", -1, 5),
    LIST_VIEW("ListViewGadget", -1, 5),
    LIST_ICON("ListIconGadget", 5, 7),
    TREE("TreeGadget", -1, 5),
    EDITOR("EditorGadget", -1, 5),
    SPIN("SpinGadget", -1, 7),
    TRACK_BAR("TrackBarGadget", -1, 7),
    PROGRESS_BAR("ProgressBarGadget", -1, 7),
    IMAGE("ImageGadget", -1, 6),
    HYPER_LINK("HyperLinkGadget", 5, 7),
    CALENDAR("CalendarGadget", -1, 6),
    DATE("DateGadget", 5, 7),
    CONTAINER("ContainerGadget", -1, 5),
    PANEL("PanelGadget", -1, -1),
    SCROLL_AREA("ScrollAreaGadget", -1, 8),
    SPLITTER("SplitterGadget", -1, 7),
    WEB_VIEW("WebViewGadget", -1, 5),
    WEB("WebGadget", 5, 6),
    OPEN_GL("OpenGLGadget", -1, 5),
    CANVAS("CanvasGadget", -1, 5),
    EXPLORER_TREE("ExplorerTreeGadget", 5, 6),
    EXPLORER_LIST("ExplorerListGadget", 5, 6),
    EXPLORER_COMBO("ExplorerComboGadget", 5, 6),
    IP_ADDRESS("IPAddressGadget", -1, -1),
    SCROLL_BAR("ScrollBarGadget", -1, 8),
    SCINTILLA("ScintillaGadget", -1, -1);

    private static final Map<String, GadgetKind> BY_CALL_NAME = new HashMap<>();

    static {
        for (GadgetKind kind : values()) {
            BY_CALL_NAME.put(kind.callName, kind);
        }
    }

    private final String callName;
    private final int textIndex;
    private final int flagsIndex;

    GadgetKind(String callName, int textIndex, int flagsIndex) {
        this.callName = callName;
        this.textIndex = textIndex;
        this.flagsIndex = flagsIndex;
    }

    @JsonValue
    public String getCallName() {
        return callName;
    }

    public int getTextIndex() {
        return textIndex;
    }

    public int getFlagsIndex() {
        return flagsIndex;
    }

    public boolean hasText() {
        return textIndex >= 0;
    }

    /**
     * Container kinds open an implicit gadget list for the statements that follow them.
     */
    public boolean isContainer() {
        return this == CONTAINER || this == PANEL || this == SCROLL_AREA;
    }

    /**
     * Returns the kind for an exact (case-sensitive) constructor name, or null.
     */
    public static GadgetKind fromCallName(String name) {
        if (name == null) {
            return null;
        }
        return BY_CALL_NAME.get(name);
    }
}
