package com.formstudio.emitter;

import com.formstudio.models.TextEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchResultTest {

    @Test
    void editsAreSortedAndAppliedFromTheEnd() {
        PatchResult result = PatchResult.of(List.of(
            new TextEdit(8, 9, "Z"),
            TextEdit.insert(0, ">"),
            new TextEdit(4, 5, "xx")));
        assertEquals(0, result.getEdits().get(0).getStart());
        assertEquals(">abcdxxfghZj", result.applyTo("abcdefghij"));
    }

    @Test
    void overlappingEditIsDropped() {
        PatchResult result = PatchResult.of(List.of(
            new TextEdit(2, 6, "X"),
            new TextEdit(4, 8, "Y")));
        assertEquals(1, result.getEdits().size());
        assertEquals("abXghij", result.applyTo("abcdefghij"));
    }

    @Test
    void emptyEditListMeansNoEdit() {
        PatchResult result = PatchResult.of(List.of());
        assertFalse(result.hasEdits());
        assertNotNull(result.getReason());
        assertEquals("same", result.applyTo("same"));
    }
}
