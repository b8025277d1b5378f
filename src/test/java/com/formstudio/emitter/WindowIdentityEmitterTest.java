package com.formstudio.emitter;

import com.formstudio.TestForms;
import com.formstudio.models.FormDocument;
import com.formstudio.models.ScanRange;
import com.formstudio.parser.FormParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowIdentityEmitterTest {

    private final FormParser parser = new FormParser();

    private static ScanRange range(String text) {
        return FormParser.detectScanRange(text);
    }

    @Test
    void switchesNamedWindowToPbAny() {
        String text = TestForms.sample();
        PatchResult result = WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "Window_0",
            null, null, false, range(text));
        assertTrue(result.hasEdits());
        String patched = result.applyTo(text);

        assertTrue(patched.contains("  Window_0 = OpenWindow(#PB_Any, x, y, width, height, \"Demo\""));
        assertTrue(patched.contains("Global Button_0\nGlobal Window_0\n"));
        assertTrue(patched.contains("CreateMenu(0, WindowID(Window_0))"));
        assertFalse(patched.contains("#Window_0"));

        FormDocument doc = parser.parse(patched);
        assertTrue(doc.getWindow().isPbAny());
        assertEquals("Window_0", doc.getWindow().getId());
        assertTrue(doc.getMeta().getEnums().getWindows().isEmpty());
        assertTrue(doc.getMeta().getIssues().isEmpty());
    }

    @Test
    void switchesBackToNamedConstant() {
        String text = TestForms.sample();
        String pbAny = WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "Window_0",
            null, null, false, range(text)).applyTo(text);

        String named = WindowIdentityEmitter.toggleWindowPbAny(pbAny, "Window_0", false, null,
            "Window_0", null, false, range(pbAny)).applyTo(pbAny);

        assertFalse(named.contains("Global Window_0"));
        assertTrue(named.contains("  OpenWindow(#Window_0, x, y, width, height"));
        assertTrue(named.contains("CreateMenu(0, WindowID(#Window_0))"));

        FormDocument doc = parser.parse(named);
        assertFalse(doc.getWindow().isPbAny());
        assertEquals("#Window_0", doc.getWindow().getId());
        assertEquals(List.of("#Window_0"), doc.getMeta().getEnums().getWindows());
    }

    @Test
    void namedModeCreatesWindowEnumerationWhenMissing() {
        String text = TestForms.withHeader(
            "Global Win",
            "",
            "Procedure OpenWin()",
            "  Win = OpenWindow(#PB_Any, 0, 0, 100, 100, \"T\")",
            "EndProcedure");
        String patched = WindowIdentityEmitter.toggleWindowPbAny(text, "Win", false, null, "#Win", "2",
            false, range(text)).applyTo(text);

        assertFalse(patched.contains("Global Win"));
        assertTrue(patched.contains("Enumeration FormWindow\n\t#Win = 2\nEndEnumeration\n\nProcedure OpenWin()"));
        FormDocument doc = parser.parse(patched);
        assertEquals("#Win", doc.getWindow().getId());
        assertEquals("2", doc.getWindow().getEnumValueRaw());
    }

    @Test
    void procedureNamesFollowWhenAsked() {
        String text = TestForms.sample();
        String patched = WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "Main",
            null, null, true, range(text)).applyTo(text);
        assertTrue(patched.contains("Procedure OpenMain(x = 0"));
        assertTrue(patched.contains("Main = OpenWindow(#PB_Any"));

        String untouched = WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "Main",
            null, null, false, range(text)).applyTo(text);
        assertTrue(untouched.contains("Procedure OpenWindow_0(x = 0"));
    }

    @Test
    void pbAnyReplacesAnExistingAssignment() {
        String text = TestForms.withHeader(
            "Procedure OpenWindow_0()",
            "  Result = OpenWindow(#Window_0, 0, 0, 100, 100, \"T\")",
            "EndProcedure");

        String patched = WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "Win",
            null, null, false, range(text)).applyTo(text);

        assertTrue(patched.contains("  Win = OpenWindow(#PB_Any, 0, 0, 100, 100, \"T\")\n"));
        assertFalse(patched.contains("Result"));
        FormDocument doc = parser.parse(patched);
        assertTrue(doc.getWindow().isPbAny());
        assertEquals("Win", doc.getWindow().getId());
    }

    @Test
    void toggleRejectsNoOpsAndBadNames() {
        String text = TestForms.sample();
        assertFalse(WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", false, null, "#Window_0",
            null, false, range(text)).hasEdits());
        assertFalse(WindowIdentityEmitter.toggleWindowPbAny(text, "#Window_0", true, "1bad",
            null, null, false, range(text)).hasEdits());
        assertFalse(WindowIdentityEmitter.toggleWindowPbAny(text, "#Missing", true, "Win",
            null, null, false, range(text)).hasEdits());
    }

    @Test
    void enumValueIsUpdatedOrAdded() {
        String text = TestForms.sample();
        String updated = WindowIdentityEmitter.setWindowEnumValue(text, "Window_0", "3", range(text)).applyTo(text);
        assertTrue(updated.contains("\n  #Window_0 = 3\nEndEnumeration"));

        String added = WindowIdentityEmitter.setWindowEnumValue(text, "#Dialog", null, range(text)).applyTo(text);
        assertTrue(added.contains("  #Window_0\n  #Dialog\nEndEnumeration"));

        assertFalse(WindowIdentityEmitter.setWindowEnumValue(text, "#PB_Any", null, range(text)).hasEdits());
    }

    @Test
    void renamesNamedWindowEverywhereInItsProcedure() {
        String text = TestForms.sample();
        String patched = WindowIdentityEmitter.renameWindow(text, "Main", false, range(text)).applyTo(text);

        assertTrue(patched.contains("  OpenWindow(#Main, x, y"));
        assertTrue(patched.contains("CreateStatusBar(0, WindowID(#Main))"));
        FormDocument doc = parser.parse(patched);
        assertEquals("#Main", doc.getWindow().getId());
        assertEquals(List.of("#Main"), doc.getMeta().getEnums().getWindows());
    }

    @Test
    void renamesPbAnyVariableAndItsGlobal() {
        String text = TestForms.withHeader(
            "Global Window_0, Other",
            "Procedure OpenWindow_0()",
            "  Window_0 = OpenWindow(#PB_Any, 0, 0, 100, 100, \"T\")",
            "  CreateMenu(0, WindowID(Window_0))",
            "EndProcedure");
        String patched = WindowIdentityEmitter.renameWindow(text, "Main", true, range(text)).applyTo(text);

        assertTrue(patched.contains("Global Main, Other"));
        assertTrue(patched.contains("Procedure OpenMain()"));
        assertTrue(patched.contains("  Main = OpenWindow(#PB_Any"));
        assertTrue(patched.contains("WindowID(Main)"));
    }

    @Test
    void renameRejectsEmptyAndUnchangedNames() {
        String text = TestForms.sample();
        assertFalse(WindowIdentityEmitter.renameWindow(text, "  ", false, range(text)).hasEdits());
        assertFalse(WindowIdentityEmitter.renameWindow(text, "#Window_0", false, range(text)).hasEdits());
    }

    @Test
    void derivedProcedureNames() {
        assertEquals("OpenMain", WindowIdentityEmitter.derivedName("OpenWindow_0", "Window_0", "Main"));
        assertEquals("Main_Events", WindowIdentityEmitter.derivedName("Window_0_Events", "Window_0", "Main"));
        assertEquals("ResizeGadgetsMain", WindowIdentityEmitter.derivedName("ResizeGadgetsWindow_0", "Window_0", "Main"));
        assertNull(WindowIdentityEmitter.derivedName("Helper", "Window_0", "Main"));
    }
}
