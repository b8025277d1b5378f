package com.formstudio.parser;

import com.formstudio.models.FormHeaderInfo;
import com.formstudio.models.ScanRange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the designer header comment and the region of the file that holds form statements.
 */
public final class FormHeaderScanner {

    private static final Pattern HEADER = Pattern.compile(
        "^;\\s*Form\\s+Designer\\s+for\\s+PureBasic\\s*-\\s*([0-9]+(?:\\.[0-9]+)*)\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern STRICT_SYNTAX = Pattern.compile("strict\\s+syntax", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORM_DESIGNER = Pattern.compile("Form\\s+Designer", Pattern.CASE_INSENSITIVE);
    private static final Pattern IDE_OPTIONS = Pattern.compile(
        "^;\\s*IDE\\s+Options\\b", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private FormHeaderScanner() {
    }

    /**
     * @return the header of the first matching line, or null when the file has none
     */
    public static FormHeaderInfo scanHeader(String text) {
        // $ in MULTILINE mode does not match before \r.
        Matcher m = HEADER.matcher(text.replace('\r', ' '));
        if (!m.find()) {
            return null;
        }
        int line = SourceText.lineOf(text, m.start());
        int nextLineStart = SourceText.nextLineStart(text, m.start());
        String nextLine = nextLineStart < text.length() ? SourceText.lineText(text, nextLineStart) : "";
        boolean strict = STRICT_SYNTAX.matcher(nextLine).find() && FORM_DESIGNER.matcher(nextLine).find();
        return new FormHeaderInfo(m.group(1), line, strict);
    }

    /**
     * From the start of the header line (or 0) to the start of the {@code ; IDE Options} line
     * (or the end of the text).
     */
    public static ScanRange detectScanRange(String text, FormHeaderInfo header) {
        int start = header != null ? SourceText.lineToOffset(text, header.getLine()) : 0;
        Matcher m = IDE_OPTIONS.matcher(text);
        int end = text.length();
        while (m.find()) {
            if (m.start() >= start) {
                end = m.start();
                break;
            }
        }
        return new ScanRange(start, end);
    }

    public static ScanRange detectScanRange(String text) {
        return detectScanRange(text, scanHeader(text));
    }
}
