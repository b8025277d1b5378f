package com.formstudio.parser;

import com.formstudio.TestForms;
import com.formstudio.models.FormDocument;
import com.formstudio.models.FormIssue;
import com.formstudio.models.FormMenu;
import com.formstudio.models.FormMenuEntry;
import com.formstudio.models.FormStatusBarField;
import com.formstudio.models.FormWindow;
import com.formstudio.models.Gadget;
import com.formstudio.models.GadgetKind;
import com.formstudio.models.MenuEntryKind;
import com.formstudio.models.ToolBarEntryKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FormParserTest {

    private final FormParser parser = new FormParser();

    @Test
    void pbAnyGadgetIsKeyedByItsVariable() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "Button_0 = ButtonGadget(#PB_Any, 10, 20, 80, 24, \"OK\")"));

        assertEquals(1, doc.getGadgets().size());
        Gadget g = doc.getGadgets().get(0);
        assertEquals(GadgetKind.BUTTON, g.getKind());
        assertEquals("Button_0", g.getId());
        assertTrue(g.isPbAny());
        assertTrue(g.isPatchable());
        assertEquals(10, g.getX());
        assertEquals(20, g.getY());
        assertEquals(80, g.getW());
        assertEquals(24, g.getH());
        assertEquals("OK", g.getText());
        assertTrue(doc.getMeta().getIssues().isEmpty());
    }

    @Test
    void unrecognizedConstructorIsNotAGadget() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "FancyGadget(#F, 0, 0, 10, 10, \"x\")",
            "ButtonGadget(#B, 0, 0, 10, 10, \"y\")"));

        assertEquals(1, doc.getGadgets().size());
        assertEquals("#B", doc.getGadgets().get(0).getId());
        assertNull(GadgetKind.fromCallName("FancyGadget"));
        assertNull(GadgetKind.fromCallName("Unknown"));
    }

    @Test
    void pbAnyGadgetWithoutAssignmentIsReported() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "ButtonGadget(#PB_Any, 10,20,80,24,\"OK\")"));

        assertEquals(1, doc.getGadgets().size());
        Gadget g = doc.getGadgets().get(0);
        assertFalse(g.isPatchable());
        assertEquals("#PB_Any", g.getId());

        List<FormIssue> errors = doc.getMeta().getIssues().stream()
            .filter(i -> i.getSeverity() == FormIssue.Severity.ERROR)
            .collect(Collectors.toList());
        assertEquals(1, errors.size());
        assertEquals(2, errors.get(0).getLine());
        assertTrue(errors.get(0).getMessage().contains("ButtonGadget(#PB_Any, ...)"));
    }

    @Test
    void pbAnyIsMatchedCaseInsensitively() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "Str_0 = StringGadget(#pb_any, 0, 0, 100, 20, \"\")"));
        assertTrue(doc.getGadgets().get(0).isPbAny());
        assertEquals("Str_0", doc.getGadgets().get(0).getId());
    }

    @Test
    void menuLevelsFollowSubMenus() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "CreateMenu(0, WindowID(#Window_0))",
            "MenuItem(1, \"A\")",
            "OpenSubMenu(\"B\")",
            "MenuItem(2, \"C\")",
            "CloseSubMenu()"));

        assertEquals(1, doc.getMenus().size());
        FormMenu menu = doc.getMenus().get(0);
        assertEquals("0", menu.getId());
        List<Integer> levels = menu.getEntries().stream().map(FormMenuEntry::getLevel).collect(Collectors.toList());
        assertEquals(List.of(0, 0, 1, 0), levels);
        assertEquals("C", menu.getEntries().get(2).getText());
    }

    @Test
    void unbalancedCloseSubMenuNeverGoesBelowZero() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "CreateMenu(0, WindowID(0))",
            "CloseSubMenu()",
            "CloseSubMenu()",
            "MenuItem(1, \"A\")"));
        for (FormMenuEntry entry : doc.getMenus().get(0).getEntries()) {
            assertEquals(0, entry.getLevel());
        }
    }

    @Test
    void menuEntriesOutsideAMenuAreIgnored() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "CreateMenu(0, WindowID(0))",
            "MenuItem(1, \"A\")",
            "OpenWindow(#Window_1, 0, 0, 100, 100, \"Other\")",
            "MenuItem(2, \"B\")"));
        assertEquals(1, doc.getMenus().get(0).getEntries().size());
    }

    @Test
    void parsesCompleteSample() {
        FormDocument doc = parser.parse(TestForms.sample());

        FormWindow window = doc.getWindow();
        assertNotNull(window);
        assertEquals("#Window_0", window.getId());
        assertFalse(window.isPbAny());
        assertEquals(0, window.getX());
        assertEquals(0, window.getY());
        assertEquals(600, window.getW());
        assertEquals(400, window.getH());
        assertEquals("width", window.getWRaw());
        assertEquals("Demo", window.getTitle());
        assertEquals("#PB_Window_SystemMenu", window.getFlagsExpr());
        assertEquals(26, window.getSource().getLine());

        assertEquals(List.of("#Window_0"), doc.getMeta().getEnums().getWindows());
        assertEquals(List.of("#Panel_0", "#List_0", "#Button_1"), doc.getMeta().getEnums().getGadgets());
        assertTrue(doc.getMeta().getIssues().isEmpty());
        assertEquals("6.10", doc.getMeta().getHeader().getVersion());
    }

    @Test
    void sampleSectionsAreCollected() {
        FormDocument doc = parser.parse(TestForms.sample());

        FormMenu menu = doc.getMenus().get(0);
        assertEquals(List.of(MenuEntryKind.MENU_TITLE, MenuEntryKind.MENU_ITEM, MenuEntryKind.OPEN_SUB_MENU,
                MenuEntryKind.MENU_ITEM, MenuEntryKind.CLOSE_SUB_MENU, MenuEntryKind.MENU_BAR),
            menu.getEntries().stream().map(FormMenuEntry::getKind).collect(Collectors.toList()));
        assertEquals("#MenuItem_Open", menu.getEntries().get(1).getIdRaw());

        assertEquals(1, doc.getToolbars().size());
        assertEquals(ToolBarEntryKind.STANDARD_BUTTON, doc.getToolbars().get(0).getEntries().get(0).getKind());
        assertEquals("#PB_ToolBarIcon_New", doc.getToolbars().get(0).getEntries().get(0).getIconRaw());
        assertEquals(ToolBarEntryKind.SEPARATOR, doc.getToolbars().get(0).getEntries().get(1).getKind());

        List<String> widths = doc.getStatusbars().get(0).getFields().stream()
            .map(FormStatusBarField::getWidthRaw).collect(Collectors.toList());
        assertEquals(List.of("120", "#PB_Ignore"), widths);
    }

    @Test
    void panelChildrenRecordTheirTab() {
        FormDocument doc = parser.parse(TestForms.sample());

        Gadget button = doc.findGadget("Button_0");
        assertNull(button.getParentId());

        Gadget panel = doc.findGadget("#Panel_0");
        assertEquals(2, panel.itemCount());
        assertEquals("Second", panel.getItems().get(1).getText());

        Gadget list = doc.findGadget("#List_0");
        assertEquals("#Panel_0", list.getParentId());
        assertEquals(0, list.getParentItem());
        assertEquals("Name", list.getText());
        assertEquals("#PB_ListIcon_GridLines", list.getFlagsExpr());
        assertEquals(2, list.itemCount());
        assertEquals(1, list.getItems().get(1).getIndex());
        assertEquals(1, list.columnCount());
        assertEquals("Size", list.getColumns().get(0).getTitle());
        assertEquals(1, list.getColumns().get(0).getIndex());

        Gadget inside = doc.findGadget("#Button_1");
        assertEquals("#Panel_0", inside.getParentId());
        assertEquals(1, inside.getParentItem());
    }

    @Test
    void containerGadgetListIsClosedExplicitly() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "ContainerGadget(#Container_0, 0, 0, 200, 200)",
            "ButtonGadget(#Inner, 5, 5, 50, 20, \"In\")",
            "CloseGadgetList()",
            "ButtonGadget(#Outer, 5, 5, 50, 20, \"Out\")"));
        assertEquals("#Container_0", doc.findGadget("#Inner").getParentId());
        assertNull(doc.findGadget("#Outer").getParentId());
    }

    @Test
    void openGadgetListSelectsPanelTab() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "PanelGadget(#Panel_0, 0, 0, 200, 200)",
            "AddGadgetItem(#Panel_0, -1, \"A\")",
            "AddGadgetItem(#Panel_0, -1, \"B\")",
            "CloseGadgetList()",
            "OpenGadgetList(#Panel_0, 0)",
            "ButtonGadget(#Late, 5, 5, 50, 20, \"Late\")",
            "CloseGadgetList()"));
        Gadget late = doc.findGadget("#Late");
        assertEquals("#Panel_0", late.getParentId());
        assertEquals(0, late.getParentItem());
    }

    @Test
    void shortItemAndColumnCallsAreSkipped() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "ListIconGadget(#L, 0, 0, 100, 100, \"A\", 50)",
            "AddGadgetItem(#L, -1)",
            "AddGadgetColumn(#L, 1, \"B\")"));
        Gadget list = doc.findGadget("#L");
        assertEquals(0, list.itemCount());
        assertEquals(0, list.columnCount());
    }

    @Test
    void missingHeaderIsAWarning() {
        FormDocument doc = parser.parse("ButtonGadget(#B, 0, 0, 10, 10, \"x\")\n");
        assertEquals(1, doc.getMeta().getIssues().size());
        FormIssue issue = doc.getMeta().getIssues().get(0);
        assertEquals(FormIssue.Severity.WARNING, issue.getSeverity());
        assertEquals(0, issue.getLine());
        assertEquals(1, doc.getGadgets().size());
    }

    @Test
    void missingStrictSyntaxLineIsInfo() {
        FormDocument doc = parser.parse("; Form Designer for PureBasic - 6.00\nButtonGadget(#B, 0, 0, 10, 10, \"x\")\n");
        assertEquals(1, doc.getMeta().getIssues().size());
        assertEquals(FormIssue.Severity.INFO, doc.getMeta().getIssues().get(0).getSeverity());
        assertFalse(doc.getMeta().getHeader().isHasStrictSyntaxWarning());
    }

    @Test
    void codeAfterIdeOptionsIsOutsideTheScanRange() {
        String text = TestForms.withHeader(
            "ButtonGadget(#In, 0, 0, 10, 10, \"x\")",
            "; IDE Options = PureBasic 6.10",
            "ButtonGadget(#Out, 0, 0, 10, 10, \"y\")");
        FormDocument doc = parser.parse(text);
        assertEquals(1, doc.getGadgets().size());
        assertEquals(text.indexOf("; IDE Options"), doc.getMeta().getScanRange().getEnd());
    }

    @Test
    void pbAnyWindowWithoutAssignmentIsReported() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "OpenWindow(#PB_Any, 0, 0, 300, 200, \"Title\")"));
        assertNotNull(doc.getWindow());
        assertFalse(doc.getWindow().isPatchable());
        assertEquals(1, doc.getMeta().getIssues().size());
        assertEquals(FormIssue.Severity.ERROR, doc.getMeta().getIssues().get(0).getSeverity());
    }

    @Test
    void windowEnumValueIsTaken() {
        FormDocument doc = parser.parse(TestForms.withHeader(
            "Enumeration FormWindow",
            "  #Main = 5",
            "EndEnumeration",
            "OpenWindow(#Main, 0, 0, 300, 200, \"Title\")"));
        assertEquals("5", doc.getWindow().getEnumValueRaw());
    }

    @Test
    void nullTextParsesToEmptyDocument() {
        FormDocument doc = parser.parse(null);
        assertNull(doc.getWindow());
        assertTrue(doc.getGadgets().isEmpty());
    }
}
