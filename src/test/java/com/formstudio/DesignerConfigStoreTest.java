package com.formstudio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formstudio.models.DesignerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DesignerConfigStoreTest {

    @TempDir
    Path root;

    @Test
    void defaultsWhenFileIsMissing() {
        DesignerConfig config = new DesignerConfigStore(root, new ObjectMapper()).loadOrDefault();
        assertEquals("", config.getExpectedPbVersion());
        assertFalse(config.isPropagateProcedureRenames());
        assertEquals(8, config.getMinGadgetWidth());
        assertEquals(40, config.getMinWindowHeight());
        assertEquals(10, config.getGridSize());
    }

    @Test
    void savesAndLoadsNormalizedSettings() throws Exception {
        DesignerConfigStore store = new DesignerConfigStore(root, new ObjectMapper());
        DesignerConfig config = new DesignerConfig();
        config.setExpectedPbVersion(" 6.10 ");
        config.setPropagateProcedureRenames(true);
        config.setMinGadgetWidth(0);
        config.setGridSize(500);

        store.save(config);
        assertTrue(Files.exists(root.resolve(".form-studio").resolve("designer-config.json")));

        DesignerConfig loaded = store.loadOrDefault();
        assertEquals("6.10", loaded.getExpectedPbVersion());
        assertTrue(loaded.isPropagateProcedureRenames());
        assertEquals(1, loaded.getMinGadgetWidth());
        assertEquals(100, loaded.getGridSize());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws Exception {
        Path file = root.resolve(".form-studio").resolve("designer-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        DesignerConfig config = new DesignerConfigStore(root, new ObjectMapper()).loadOrDefault();
        assertEquals(8, config.getMinGadgetHeight());
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        Path file = root.resolve(".form-studio").resolve("designer-config.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"minWindowWidth\": 120, \"legacy\": true}");

        assertEquals(120, new DesignerConfigStore(root, new ObjectMapper()).loadOrDefault().getMinWindowWidth());
    }
}
