package com.formstudio.parser;

import com.formstudio.TestForms;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SectionResolverTest {

    private final List<Call> calls = CallScanner.scanCalls(TestForms.sample(),
        FormParser.detectScanRange(TestForms.sample()));

    @Test
    void findsOpenersByKindAndKey() {
        int menu = SectionResolver.findOpener(calls, SectionKind.MENU, "0");
        int toolBar = SectionResolver.findOpener(calls, SectionKind.TOOLBAR, " 0 ");
        assertEquals("CreateMenu", calls.get(menu).getName());
        assertEquals("CreateToolBar", calls.get(toolBar).getName());
        assertEquals(-1, SectionResolver.findOpener(calls, SectionKind.MENU, "1"));
        assertEquals(-1, SectionResolver.findOpener(calls, SectionKind.MENU, null));
    }

    @Test
    void sectionEndsAtNextBoundaryOfAnyKind() {
        int menu = SectionResolver.findOpener(calls, SectionKind.MENU, "0");
        int end = SectionResolver.sectionEnd(calls, menu);
        assertEquals("CreateToolBar", calls.get(end).getName());

        int statusBar = SectionResolver.findOpener(calls, SectionKind.STATUSBAR, "0");
        assertEquals(calls.size(), SectionResolver.sectionEnd(calls, statusBar));
    }

    @Test
    void insideSectionUsesNearestBoundary() {
        assertTrue(SectionResolver.isInsideSection(calls, 31, SectionKind.MENU, "0"));
        assertFalse(SectionResolver.isInsideSection(calls, 31, SectionKind.TOOLBAR, "0"));
        assertTrue(SectionResolver.isInsideSection(calls, 36, SectionKind.TOOLBAR, "0"));
        assertFalse(SectionResolver.isInsideSection(calls, 36, SectionKind.MENU, "0"));
        assertFalse(SectionResolver.isInsideSection(calls, 0, SectionKind.MENU, "0"));
    }

    @Test
    void lastEntryFallsBackToOpener() {
        int menu = SectionResolver.findOpener(calls, SectionKind.MENU, "0");
        assertEquals("MenuBar", SectionResolver.lastEntry(calls, menu, Set.of("MenuItem", "MenuBar")).getName());
        assertEquals(33, SectionResolver.lastEntryLine(calls, menu, Set.of("MenuItem", "MenuBar")));
        assertSame(calls.get(menu), SectionResolver.lastEntry(calls, menu, Set.of("ToolBarSeparator")));
    }

    @Test
    void pbAnySectionIsKeyedByVariable() {
        List<Call> own = CallScanner.scanCalls("Menu_0 = CreateMenu(#PB_Any, WindowID(0))\nMenuItem(1, \"A\")\n");
        assertEquals(0, SectionResolver.findOpener(own, SectionKind.MENU, "Menu_0"));
        assertTrue(SectionResolver.isInsideSection(own, 1, SectionKind.MENU, "Menu_0"));
    }
}
