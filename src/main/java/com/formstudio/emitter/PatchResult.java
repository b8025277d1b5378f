package com.formstudio.emitter;

import com.formstudio.models.TextEdit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one patch computation: an ordered, non-overlapping list of edits over the text
 * snapshot it was computed from, or "no edit" with a reason.
 */
public class PatchResult {
    private final List<TextEdit> edits;
    private final String reason;

    private PatchResult(List<TextEdit> edits, String reason) {
        this.edits = edits;
        this.reason = reason;
    }

    /**
     * Sorts the edits by position. An edit overlapping one already kept is dropped.
     */
    public static PatchResult of(List<TextEdit> edits) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(TextEdit::getStart).thenComparingInt(TextEdit::getEnd));
        List<TextEdit> kept = new ArrayList<>();
        int lastEnd = -1;
        for (TextEdit edit : sorted) {
            if (edit.getStart() < lastEnd) {
                continue;
            }
            kept.add(edit);
            lastEnd = edit.getEnd();
        }
        if (kept.isEmpty()) {
            return noEdit("Nothing to change.");
        }
        return new PatchResult(Collections.unmodifiableList(kept), null);
    }

    public static PatchResult of(TextEdit edit) {
        return of(List.of(edit));
    }

    public static PatchResult noEdit(String reason) {
        return new PatchResult(Collections.emptyList(), reason);
    }

    public boolean hasEdits() {
        return !edits.isEmpty();
    }

    public List<TextEdit> getEdits() {
        return edits;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Applies the edits to the snapshot they were computed from, last edit first.
     */
    public String applyTo(String text) {
        StringBuilder sb = new StringBuilder(text);
        for (int i = edits.size() - 1; i >= 0; i--) {
            TextEdit edit = edits.get(i);
            sb.replace(edit.getStart(), edit.getEnd(), edit.getNewText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return hasEdits() ? "PatchResult" + edits : "PatchResult[no edit: " + reason + "]";
    }
}
