package com.formstudio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formstudio.FormDesignerService.PatchOutcome;
import com.formstudio.models.DesignerConfig;
import com.formstudio.models.FormDocument;
import com.formstudio.models.FormIssue;
import com.formstudio.models.FormPatchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormDesignerServiceTest {

    private static final String FORM = "dialogs/main.pbf";

    @TempDir
    Path root;

    private WorkspaceService workspace;
    private DesignerConfigStore configStore;
    private FormDesignerService service;

    @BeforeEach
    void setUp() throws Exception {
        workspace = new WorkspaceService(root);
        configStore = new DesignerConfigStore(root, new ObjectMapper());
        service = new FormDesignerService(workspace, configStore);
        workspace.writeFile(FORM, TestForms.sample());
    }

    private static FormPatchRequest request(String type) {
        FormPatchRequest request = new FormPatchRequest();
        request.setType(type);
        return request;
    }

    @Test
    void listsAndParsesForms() throws Exception {
        assertEquals(List.of(FORM), service.listForms());
        FormDocument doc = service.parse(FORM);
        assertEquals("#Window_0", doc.getWindow().getId());
        assertEquals(4, doc.getGadgets().size());
    }

    @Test
    void applyWritesTheFileAndReturnsTheNewDocument() throws Exception {
        FormPatchRequest request = request("moveGadget");
        request.setId("Button_0");
        request.setX(100.0);
        request.setY(120.0);

        PatchOutcome outcome = service.apply(FORM, request);

        assertTrue(outcome.isApplied());
        assertEquals(2, outcome.getEdits().size());
        assertTrue(outcome.getDiff().contains("+  Button_0 = ButtonGadget(#PB_Any, 100, 120, 80, 24, \"OK\")"));
        assertEquals(100, outcome.getDocument().findGadget("Button_0").getX());
        assertTrue(Files.readString(root.resolve(FORM)).contains("ButtonGadget(#PB_Any, 100, 120, 80, 24"));
    }

    @Test
    void previewLeavesTheFileAlone() throws Exception {
        FormPatchRequest request = request("setWindowTitle");
        request.setId("#Window_0");
        request.setText("Preview");

        PatchOutcome outcome = service.preview(FORM, request);

        assertFalse(outcome.isApplied());
        assertTrue(outcome.hasEdits());
        assertEquals("Preview", outcome.getDocument().getWindow().getTitle());
        assertEquals(TestForms.sample(), Files.readString(root.resolve(FORM)));
    }

    @Test
    void sizeFloorsAreApplied() throws Exception {
        FormPatchRequest gadget = request("setGadgetRect");
        gadget.setId("#Button_1");
        gadget.setX(0.0);
        gadget.setY(0.0);
        gadget.setW(2.0);
        gadget.setH(3.0);
        FormDocument doc = service.apply(FORM, gadget).getDocument();
        assertEquals(8, doc.findGadget("#Button_1").getW());
        assertEquals(8, doc.findGadget("#Button_1").getH());

        FormPatchRequest window = request("setWindowRect");
        window.setId("#Window_0");
        window.setX(0.0);
        window.setY(0.0);
        window.setW(10.0);
        window.setH(500.0);
        doc = service.apply(FORM, window).getDocument();
        assertEquals(40, doc.getWindow().getW());
        assertEquals(500, doc.getWindow().getH());
    }

    @Test
    void noEditExplainsTargetAndScanRange() throws Exception {
        FormPatchRequest request = request("moveGadget");
        request.setId("#Missing");
        request.setX(1.0);
        request.setY(1.0);

        PatchOutcome outcome = service.apply(FORM, request);

        assertFalse(outcome.isApplied());
        assertFalse(outcome.hasEdits());
        assertTrue(outcome.getMessage().startsWith("Could not patch gadget '#Missing'. No matching gadget call found"));
        assertTrue(outcome.getMessage().matches(".*\\(scanRange: \\d+-\\d+\\)\\.$"));
        assertEquals(TestForms.sample(), workspace.readFile(FORM));
    }

    @Test
    void invalidRequestsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.apply(FORM, request("explode")));
        assertThrows(IllegalArgumentException.class, () -> service.apply(FORM, request("moveGadget")));

        FormPatchRequest toPbAny = request("toggleWindowPbAny");
        toPbAny.setId("#Window_0");
        toPbAny.setToPbAny(true);
        toPbAny.setEnumSymbol("#Ignored");
        IllegalArgumentException missingVariable = assertThrows(IllegalArgumentException.class,
            () -> service.apply(FORM, toPbAny));
        assertEquals("variableName is required", missingVariable.getMessage());

        FormPatchRequest toNamed = request("toggleWindowPbAny");
        toNamed.setId("#Window_0");
        toNamed.setToPbAny(false);
        toNamed.setVariableName("Ignored");
        IllegalArgumentException missingSymbol = assertThrows(IllegalArgumentException.class,
            () -> service.apply(FORM, toNamed));
        assertEquals("enumSymbol is required", missingSymbol.getMessage());

        FormPatchRequest badKind = request("insertMenuEntry");
        badKind.setMenuId("0");
        badKind.setKind("MenuSeparator");
        assertThrows(IllegalArgumentException.class, () -> service.apply(FORM, badKind));
    }

    @Test
    void structuralPatchesGoThroughTheService() throws Exception {
        FormPatchRequest item = request("insertGadgetItem");
        item.setId("#List_0");
        item.setTextRaw("\"c.txt\"");
        assertEquals(3, service.apply(FORM, item).getDocument().findGadget("#List_0").itemCount());

        FormPatchRequest field = request("deleteStatusBarField");
        field.setStatusBarId("0");
        field.setSourceLine(39);
        FormDocument doc = service.apply(FORM, field).getDocument();
        assertEquals(1, doc.getStatusbars().get(0).getFields().size());

        FormPatchRequest entry = request("insertToolBarEntry");
        entry.setToolBarId("0");
        entry.setKind("ToolBarSeparator");
        assertEquals(3, service.apply(FORM, entry).getDocument().getToolbars().get(0).getEntries().size());
    }

    @Test
    void propagationFollowsConfigUnlessRequested() throws Exception {
        DesignerConfig config = new DesignerConfig();
        config.setPropagateProcedureRenames(true);
        service.saveConfig(config);

        FormPatchRequest request = request("setWindowVariableName");
        request.setVariableName("Main");
        service.apply(FORM, request);
        assertTrue(workspace.readFile(FORM).contains("Procedure OpenMain("));

        FormPatchRequest back = request("setWindowVariableName");
        back.setVariableName("Window_0");
        back.setPropagateProcedureRenames(false);
        service.apply(FORM, back);
        String text = workspace.readFile(FORM);
        assertTrue(text.contains("OpenWindow(#Window_0"));
        assertTrue(text.contains("Procedure OpenMain("));
    }

    @Test
    void expectedVersionMismatchIsWarned() throws Exception {
        DesignerConfig config = new DesignerConfig();
        config.setExpectedPbVersion("6.20");
        service.saveConfig(config);

        List<FormIssue> issues = service.parse(FORM).getMeta().getIssues();
        assertEquals(1, issues.size());
        assertEquals(FormIssue.Severity.WARNING, issues.get(0).getSeverity());
        assertTrue(issues.get(0).getMessage().contains("'6.10'"));
        assertEquals(0, issues.get(0).getLine());
    }

    @Test
    void expectedVersionWithoutHeaderIsWarned() {
        FormDocument doc = service.parseText("ButtonGadget(#B, 0, 0, 10, 10, \"x\")\n");
        FormDesignerService.checkExpectedVersion(doc, "6.10");
        List<FormIssue> issues = doc.getMeta().getIssues();
        assertEquals(2, issues.size());
        assertTrue(issues.get(1).getMessage().contains("header has no version"));
        assertNull(issues.get(1).getLine());
    }
}
