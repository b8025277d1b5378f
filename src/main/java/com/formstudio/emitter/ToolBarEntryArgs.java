package com.formstudio.emitter;

import com.formstudio.models.ToolBarEntryKind;

public record ToolBarEntryArgs(ToolBarEntryKind kind, String idRaw, String iconRaw, String textRaw) {
}
