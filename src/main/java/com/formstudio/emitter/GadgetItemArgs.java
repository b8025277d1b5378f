package com.formstudio.emitter;

/**
 * Raw argument tokens of an {@code AddGadgetItem} statement after the gadget key.
 * {@code imageRaw} and {@code flagsRaw} may be null.
 */
public record GadgetItemArgs(String posRaw, String textRaw, String imageRaw, String flagsRaw) {
}
