package com.formstudio.emitter;

public record GadgetColumnArgs(String colRaw, String titleRaw, String widthRaw) {
}
