package com.formstudio.emitter;

import com.formstudio.models.MenuEntryKind;

public record MenuEntryArgs(MenuEntryKind kind, String idRaw, String textRaw) {
}
