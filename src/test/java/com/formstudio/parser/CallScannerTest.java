package com.formstudio.parser;

import com.formstudio.models.ScanRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallScannerTest {

    @Test
    void findsPlainAndAssignedCalls() {
        String text = "  ButtonGadget(#Button_0, 10, 20, 80, 24, \"OK\")\n"
            + "Text_1 = TextGadget(#PB_Any, 0, 0, 50, 20, \"Label\")\n";
        List<Call> calls = CallScanner.scanCalls(text);
        assertEquals(2, calls.size());

        Call first = calls.get(0);
        assertEquals("ButtonGadget", first.getName());
        assertNull(first.getAssignedVar());
        assertEquals("  ", first.getIndent());
        assertEquals(0, first.getLine());
        assertEquals("#Button_0", first.firstParam());
        assertEquals(')', text.charAt(first.getArgsEnd()));
        assertEquals("ButtonGadget(#Button_0, 10, 20, 80, 24, \"OK\")",
            text.substring(first.getRange().getStart(), first.getRange().getEnd()));

        Call second = calls.get(1);
        assertEquals("TextGadget", second.getName());
        assertEquals("Text_1", second.getAssignedVar());
        assertEquals(1, second.getLine());
    }

    @Test
    void splitsStatementsJoinedWithColon() {
        List<Call> calls = CallScanner.scanCalls("MenuItem(1, \"A\") : MenuItem(2, \"B:C\")\n");
        assertEquals(2, calls.size());
        assertEquals("\"B:C\"", calls.get(1).params().get(1));
    }

    @Test
    void ignoresCommentsAndKeywords() {
        String text = "; ButtonGadget(#Ignored, 0, 0, 1, 1, \"x\")\n"
            + "If Something(1)\n"
            + "  Debug(\"x\")\n"
            + "EndIf\n";
        List<Call> calls = CallScanner.scanCalls(text);
        assertTrue(calls.stream().noneMatch(c -> c.getName().equals("ButtonGadget")));
        assertTrue(calls.stream().noneMatch(c -> c.getName().equals("Debug")));
    }

    @Test
    void callSpanningLinesRecordsEndLine() {
        String text = "ComboBoxGadget(#Combo_0,\n    10, 20,\n    100, 24)\nNext(1)\n";
        List<Call> calls = CallScanner.scanCalls(text);
        assertEquals("ComboBoxGadget", calls.get(0).getName());
        assertEquals(0, calls.get(0).getLine());
        assertEquals(2, calls.get(0).getEndLine());
        assertEquals(5, calls.get(0).params().size());
    }

    @Test
    void respectsScanRange() {
        String text = "A(1)\nB(2)\nC(3)\n";
        int start = text.indexOf("B(");
        int end = text.indexOf("C(");
        List<Call> calls = CallScanner.scanCalls(text, new ScanRange(start, end));
        assertEquals(1, calls.size());
        assertEquals("B", calls.get(0).getName());
        assertEquals(1, calls.get(0).getLine());
    }

    @Test
    void parenthesisInsideStringDoesNotCloseCall() {
        List<Call> calls = CallScanner.scanCalls("SetTitle(\"a) b\", 2)\n");
        assertEquals(1, calls.size());
        assertEquals(2, calls.get(0).params().size());
    }

    @Test
    void keywordLookupIsCaseInsensitive() {
        assertTrue(CallScanner.isKeyword("PROCEDURE"));
        assertFalse(CallScanner.isKeyword("ButtonGadget"));
    }
}
