package com.formstudio.parser;

import java.util.Collection;
import java.util.List;

/**
 * Section boundaries over a call stream. A section runs from its opener to the next
 * {@link SectionKind} call of any kind.
 */
public final class SectionResolver {

    private SectionResolver() {
    }

    /**
     * Index of the first opener of {@code kind} whose key equals {@code id}, or -1.
     */
    public static int findOpener(List<Call> calls, SectionKind kind, String id) {
        if (id == null) {
            return -1;
        }
        String wanted = id.trim();
        for (int i = 0; i < calls.size(); i++) {
            Call call = calls.get(i);
            if (kind.getOpenerName().equals(call.getName()) && wanted.equals(StableKey.of(call).key())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the next boundary call after the opener, or {@code calls.size()}.
     */
    public static int sectionEnd(List<Call> calls, int openerIndex) {
        for (int i = openerIndex + 1; i < calls.size(); i++) {
            if (SectionKind.isBoundary(calls.get(i).getName())) {
                return i;
            }
        }
        return calls.size();
    }

    /**
     * True when the nearest boundary call starting at or before {@code line} opens a section of
     * {@code kind} keyed {@code id}.
     */
    public static boolean isInsideSection(List<Call> calls, int line, SectionKind kind, String id) {
        Call nearest = null;
        for (Call call : calls) {
            if (call.getLine() > line) {
                break;
            }
            if (SectionKind.isBoundary(call.getName())) {
                nearest = call;
            }
        }
        if (nearest == null || !kind.getOpenerName().equals(nearest.getName())) {
            return false;
        }
        return id != null && id.trim().equals(StableKey.of(nearest).key());
    }

    /**
     * The last call in the opener's section whose name is in {@code entryNames}, else the opener.
     */
    public static Call lastEntry(List<Call> calls, int openerIndex, Collection<String> entryNames) {
        int end = sectionEnd(calls, openerIndex);
        Call last = calls.get(openerIndex);
        for (int i = openerIndex + 1; i < end; i++) {
            if (entryNames.contains(calls.get(i).getName())) {
                last = calls.get(i);
            }
        }
        return last;
    }

    /**
     * Line after which a new entry of the section is inserted.
     */
    public static int lastEntryLine(List<Call> calls, int openerIndex, Collection<String> entryNames) {
        return lastEntry(calls, openerIndex, entryNames).getEndLine();
    }
}
