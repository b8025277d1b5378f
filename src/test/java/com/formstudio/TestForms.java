package com.formstudio;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Form sources shared by the tests.
 */
public final class TestForms {

    public static final String HEADER = "; Form Designer for PureBasic - 6.10\n"
        + ";  Warning: this file uses a strict syntax, if you edit it, make sure to respect the Form Designer"
        + " limitation or it won't be opened again.\n";

    private TestForms() {
    }

    /**
     * A complete designer file with a menu, toolbar, status bar, panel and list icon.
     */
    public static String sample() {
        try (InputStream in = TestForms.class.getResourceAsStream("/forms/sample.pbf")) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource /forms/sample.pbf");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String withHeader(String... lines) {
        return HEADER + String.join("\n", lines) + "\n";
    }
}
