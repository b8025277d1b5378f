package com.formstudio.emitter;

import com.formstudio.models.ScanRange;
import com.formstudio.models.TextEdit;
import com.formstudio.parser.Call;
import com.formstudio.parser.CallScanner;
import com.formstudio.parser.EnumerationScanner;
import com.formstudio.parser.FormStatement;
import com.formstudio.parser.ParamTokenizer;
import com.formstudio.parser.ProcedureScanner;
import com.formstudio.parser.SourceText;
import com.formstudio.parser.StableKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Patches that change how the window is identified: {@code #PB_Any} with a global variable,
 * or a named constant from {@code Enumeration FormWindow}. These touch several places in
 * the file, so each returns a compound edit list. A step whose target does not exist is
 * skipped.
 */
public final class WindowIdentityEmitter {

    private WindowIdentityEmitter() {
    }

    /**
     * Switches the window identified by {@code windowKey} between the two identity modes.
     *
     * @param variableName            variable to assign when switching to {@code #PB_Any}
     * @param enumSymbol              constant to use when switching to a named window
     * @param enumValueRaw            optional explicit enumeration value for {@code enumSymbol}
     * @param propagateProcedureNames also rename {@code Open<Base>}, {@code <Base>_Events} and
     *                                {@code ResizeGadgets<Base>}
     */
    public static PatchResult toggleWindowPbAny(String text, String windowKey, boolean toPbAny, String variableName,
                                                String enumSymbol, String enumValueRaw,
                                                boolean propagateProcedureNames, ScanRange scanRange) {
        List<Call> calls = CallScanner.scanCalls(text, scanRange);
        Call window = PatchEmitter.findWindowCall(calls, windowKey);
        if (window == null) {
            return PatchResult.noEdit("No matching OpenWindow call found.");
        }
        StableKey.Identity identity = StableKey.of(window);
        if (identity.pbAny() == toPbAny) {
            return PatchResult.noEdit(toPbAny
                ? "The window already uses #PB_Any."
                : "The window already uses a named constant.");
        }

        List<TextEdit> edits = new ArrayList<>();
        GlobalDeclarations globals = GlobalDeclarations.scan(text, scanRange);
        List<EnumerationScanner.EnumerationBlock> enums = EnumerationScanner.scan(text, scanRange);
        EnumerationScanner.EnumerationBlock windowEnum = EnumerationScanner.find(enums, EnumerationScanner.FORM_WINDOW);
        ParamTokenizer.ParamSpan first = window.paramSpans().get(0);
        int firstStart = window.getArgsStart() + first.start();
        int firstEnd = window.getArgsStart() + first.end();
        String newBase;

        if (toPbAny) {
            String variable = variableName != null ? variableName.trim() : "";
            if (!IdentifierRewriter.isIdentifier(variable)) {
                return PatchResult.noEdit("'" + variable + "' is not a valid variable name.");
            }
            addIfPresent(edits, ensureGlobal(text, globals, windowEnum, enums, variable, scanRange));
            if (windowEnum != null) {
                EnumerationScanner.EnumerationEntry entry = windowEnum.findEntry(identity.key());
                if (entry != null) {
                    edits.add(deleteLine(text, entry.getLineStart()));
                }
            }
            // Replaces an assignment the named window already had.
            edits.add(new TextEdit(window.getRange().getStart(), window.getNameStart(), variable + " = "));
            edits.add(new TextEdit(firstStart, firstEnd, StableKey.PB_ANY));
            edits.addAll(rewriteSiblings(text, calls, window, identity.key(), variable, scanRange));
            newBase = variable;
        } else {
            String symbol = normalizeSymbol(enumSymbol);
            if (symbol == null) {
                return PatchResult.noEdit("'" + enumSymbol + "' is not a valid constant name.");
            }
            GlobalDeclarations.Declared declared = globals.find(identity.key());
            if (declared != null) {
                edits.add(globals.remove(declared));
            }
            addIfPresent(edits, upsertEnumEntry(text, windowEnum, enums, symbol, enumValueRaw, scanRange));
            edits.add(TextEdit.delete(window.getRange().getStart(), window.getNameStart()));
            edits.add(new TextEdit(firstStart, firstEnd, symbol));
            edits.addAll(rewriteSiblings(text, calls, window, identity.key(), symbol, scanRange));
            newBase = symbol.substring(1);
        }

        if (propagateProcedureNames) {
            edits.addAll(renameProcedures(text, calls, baseOf(identity.key()), newBase, scanRange));
        }
        return PatchResult.of(edits);
    }

    /**
     * Updates or inserts {@code #Symbol[ = value]} in {@code Enumeration FormWindow}.
     */
    public static PatchResult setWindowEnumValue(String text, String enumSymbol, String enumValueRaw,
                                                 ScanRange scanRange) {
        String symbol = normalizeSymbol(enumSymbol);
        if (symbol == null) {
            return PatchResult.noEdit("'" + enumSymbol + "' is not a valid constant name.");
        }
        List<EnumerationScanner.EnumerationBlock> enums = EnumerationScanner.scan(text, scanRange);
        EnumerationScanner.EnumerationBlock block = EnumerationScanner.find(enums, EnumerationScanner.FORM_WINDOW);
        if (block == null) {
            return PatchResult.noEdit("No Enumeration FormWindow block found.");
        }
        EnumerationScanner.EnumerationEntry entry = block.findEntry(symbol);
        if (entry == null && !block.isClosed()) {
            return PatchResult.noEdit("The Enumeration FormWindow block has no EndEnumeration.");
        }
        return PatchResult.of(entry != null
            ? new TextEdit(entry.getContentStart(), entry.getContentEnd(), enumEntry(entry.getSymbol(), enumValueRaw))
            : insertEnumEntry(text, block, symbol, enumValueRaw));
    }

    /**
     * Renames the window: its variable in {@code #PB_Any} mode, its constant otherwise.
     */
    public static PatchResult renameWindow(String text, String newName, boolean propagateProcedureNames,
                                           ScanRange scanRange) {
        String name = newName != null ? newName.trim() : "";
        if (name.isEmpty()) {
            return PatchResult.noEdit("Empty window name is not allowed.");
        }
        List<Call> calls = CallScanner.scanCalls(text, scanRange);
        Call window = null;
        for (Call call : calls) {
            if (FormStatement.OPEN_WINDOW_CALL.equals(call.getName()) && !call.params().isEmpty()) {
                window = call;
                break;
            }
        }
        if (window == null) {
            return PatchResult.noEdit("No matching OpenWindow call found.");
        }
        StableKey.Identity identity = StableKey.of(window);
        if (!identity.stable()) {
            return PatchResult.noEdit("The window has #PB_Any but no assigned variable to rename.");
        }

        List<TextEdit> edits = new ArrayList<>();
        String replacement;
        if (identity.pbAny()) {
            if (!IdentifierRewriter.isIdentifier(name)) {
                return PatchResult.noEdit("'" + name + "' is not a valid variable name.");
            }
            replacement = name;
            int varStart = window.getRange().getStart();
            edits.add(new TextEdit(varStart, varStart + identity.key().length(), name));
            GlobalDeclarations globals = GlobalDeclarations.scan(text, scanRange);
            GlobalDeclarations.Declared declared = globals.find(identity.key());
            if (declared != null) {
                edits.add(globals.rename(declared, name));
            }
        } else {
            replacement = normalizeSymbol(name);
            if (replacement == null) {
                return PatchResult.noEdit("'" + name + "' is not a valid constant name.");
            }
            ParamTokenizer.ParamSpan first = window.paramSpans().get(0);
            edits.add(new TextEdit(window.getArgsStart() + first.start(), window.getArgsStart() + first.end(),
                replacement));
            EnumerationScanner.EnumerationBlock block = EnumerationScanner.find(
                EnumerationScanner.scan(text, scanRange), EnumerationScanner.FORM_WINDOW);
            EnumerationScanner.EnumerationEntry entry = block != null ? block.findEntry(identity.key()) : null;
            if (entry != null) {
                edits.add(new TextEdit(entry.getContentStart(), entry.getContentStart() + entry.getSymbol().length(),
                    replacement));
            }
        }
        if (replacement.equals(identity.key())) {
            return PatchResult.noEdit("The window is already named '" + replacement + "'.");
        }
        edits.addAll(rewriteSiblings(text, calls, window, identity.key(), replacement, scanRange));
        if (propagateProcedureNames) {
            edits.addAll(renameProcedures(text, calls, baseOf(identity.key()), baseOf(replacement), scanRange));
        }
        return PatchResult.of(edits);
    }

    // Global declaration

    /**
     * After the last Global line, else before the window enumeration (or the gadget
     * enumeration, or the first procedure) followed by a blank line.
     */
    private static TextEdit ensureGlobal(String text, GlobalDeclarations globals,
                                         EnumerationScanner.EnumerationBlock windowEnum,
                                         List<EnumerationScanner.EnumerationBlock> enums, String variable,
                                         ScanRange scanRange) {
        if (globals.find(variable) != null) {
            return null;
        }
        if (!globals.isEmpty()) {
            return globals.insertAfterLast(variable);
        }
        int anchor = firstBlockStart(text, windowEnum, enums, scanRange);
        if (anchor < 0) {
            return null;
        }
        String separator = SourceText.lineSeparator(text);
        return TextEdit.insert(anchor, "Global " + variable + separator + separator);
    }

    private static int firstBlockStart(String text, EnumerationScanner.EnumerationBlock windowEnum,
                                       List<EnumerationScanner.EnumerationBlock> enums, ScanRange scanRange) {
        if (windowEnum != null) {
            return windowEnum.getHeaderLineStart();
        }
        EnumerationScanner.EnumerationBlock gadgetEnum = EnumerationScanner.find(enums, EnumerationScanner.FORM_GADGET);
        if (gadgetEnum != null) {
            return gadgetEnum.getHeaderLineStart();
        }
        for (ProcedureScanner.ProcedureBlock block : ProcedureScanner.scan(text, scanRange)) {
            if (!block.isDeclaration()) {
                return block.getStartOffset();
            }
        }
        return -1;
    }

    // Enumeration entries

    private static TextEdit upsertEnumEntry(String text, EnumerationScanner.EnumerationBlock block,
                                            List<EnumerationScanner.EnumerationBlock> enums, String symbol,
                                            String valueRaw,
                                            ScanRange scanRange) {
        if (block == null) {
            return createWindowEnumeration(text, enums, symbol, valueRaw, scanRange);
        }
        EnumerationScanner.EnumerationEntry entry = block.findEntry(symbol);
        if (entry != null) {
            if (valueRaw == null || valueRaw.trim().isEmpty()) {
                return null;
            }
            return new TextEdit(entry.getContentStart(), entry.getContentEnd(), enumEntry(entry.getSymbol(), valueRaw));
        }
        return block.isClosed() ? insertEnumEntry(text, block, symbol, valueRaw) : null;
    }

    private static TextEdit insertEnumEntry(String text, EnumerationScanner.EnumerationBlock block, String symbol,
                                            String valueRaw) {
        String separator = SourceText.lineSeparator(text);
        return TextEdit.insert(block.getEndLineStart(), block.bodyIndent(text) + enumEntry(symbol, valueRaw) + separator);
    }

    /**
     * A new {@code Enumeration FormWindow} block ahead of the gadget enumeration or the first
     * procedure.
     */
    private static TextEdit createWindowEnumeration(String text, List<EnumerationScanner.EnumerationBlock> enums,
                                                    String symbol, String valueRaw, ScanRange scanRange) {
        int anchor = firstBlockStart(text, null, enums, scanRange);
        if (anchor < 0) {
            return null;
        }
        String separator = SourceText.lineSeparator(text);
        return TextEdit.insert(anchor, "Enumeration " + EnumerationScanner.FORM_WINDOW + separator
            + "\t" + enumEntry(symbol, valueRaw) + separator
            + "EndEnumeration" + separator + separator);
    }

    private static String enumEntry(String symbol, String valueRaw) {
        if (valueRaw == null || valueRaw.trim().isEmpty()) {
            return symbol;
        }
        return symbol + " = " + valueRaw.trim();
    }

    // References

    /**
     * Replaces {@code oldToken} in the arguments of every other statement of the procedure that
     * opens the window (or of the whole scanned region when it is not inside one).
     */
    private static List<TextEdit> rewriteSiblings(String text, List<Call> calls, Call window, String oldToken,
                                                  String newToken, ScanRange scanRange) {
        ProcedureScanner.ProcedureBlock procedure = ProcedureScanner.enclosing(
            ProcedureScanner.scan(text, scanRange), window.getRange().getStart());
        List<TextEdit> edits = new ArrayList<>();
        for (Call call : calls) {
            if (call == window) {
                continue;
            }
            if (procedure != null && !procedure.contains(call.getRange().getStart())) {
                continue;
            }
            edits.addAll(IdentifierRewriter.replaceTokens(text, call.getArgsStart(), call.getArgsEnd(),
                oldToken, newToken));
        }
        return edits;
    }

    private static List<TextEdit> renameProcedures(String text, List<Call> calls, String oldBase, String newBase,
                                                   ScanRange scanRange) {
        List<TextEdit> edits = new ArrayList<>();
        if (oldBase.equalsIgnoreCase(newBase)) {
            return edits;
        }
        for (ProcedureScanner.ProcedureBlock block : ProcedureScanner.scan(text, scanRange)) {
            String renamed = derivedName(block.getName(), oldBase, newBase);
            if (renamed != null) {
                edits.add(new TextEdit(block.getNameStart(), block.getNameEnd(), renamed));
            }
        }
        for (Call call : calls) {
            if (FormStatement.OPEN_WINDOW_CALL.equals(call.getName())) {
                continue;
            }
            String renamed = derivedName(call.getName(), oldBase, newBase);
            if (renamed != null) {
                edits.add(new TextEdit(call.getNameStart(), call.getNameStart() + call.getName().length(), renamed));
            }
        }
        return edits;
    }

    /**
     * New name for {@code Open<Base>}, {@code <Base>_Events} or {@code ResizeGadgets<Base>}; null
     * for any other name.
     */
    static String derivedName(String name, String oldBase, String newBase) {
        if (name.equalsIgnoreCase("Open" + oldBase)) {
            return "Open" + newBase;
        }
        if (name.equalsIgnoreCase(oldBase + "_Events")) {
            return newBase + "_Events";
        }
        if (name.equalsIgnoreCase("ResizeGadgets" + oldBase)) {
            return "ResizeGadgets" + newBase;
        }
        return null;
    }

    private static String baseOf(String key) {
        return key.startsWith("#") ? key.substring(1) : key;
    }

    private static String normalizeSymbol(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        String bare = trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
        if (!IdentifierRewriter.isIdentifier(bare) || StableKey.isPbAny("#" + bare)) {
            return null;
        }
        return "#" + bare;
    }

    private static TextEdit deleteLine(String text, int lineStart) {
        return TextEdit.delete(lineStart, SourceText.nextLineStart(text, lineStart));
    }

    private static void addIfPresent(List<TextEdit> edits, TextEdit edit) {
        if (edit != null) {
            edits.add(edit);
        }
    }
}
