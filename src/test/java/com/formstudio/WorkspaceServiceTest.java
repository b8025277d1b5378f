package com.formstudio;

import com.formstudio.models.TextEdit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceServiceTest {

    @TempDir
    Path root;

    @Test
    void rejectsPathsOutsideTheWorkspace() {
        WorkspaceService service = new WorkspaceService(root);
        assertThrows(SecurityException.class, () -> service.resolvePath("../outside.pbf"));
        assertThrows(SecurityException.class, () -> service.resolvePath("forms/../../outside.pbf"));
        assertEquals(root.toAbsolutePath().normalize().resolve("a/b.pbf"), service.resolvePath("/a\\b.pbf"));
    }

    @Test
    void readMissingFileThrowsNotFound() {
        WorkspaceService service = new WorkspaceService(root);
        assertThrows(FileNotFoundException.class, () -> service.readFile("missing.pbf"));
    }

    @Test
    void writesAndListsForms() throws Exception {
        WorkspaceService service = new WorkspaceService(root);
        service.writeFile("b/second.pbf", "x");
        service.writeFile("first.PBF", "y");
        service.writeFile("notes.txt", "z");
        service.writeFile(".form-studio/hidden.pbf", "h");

        assertEquals(List.of("b/second.pbf", "first.PBF"), service.listForms());
        assertEquals("x", service.readFile("b/second.pbf"));
        assertTrue(service.exists("notes.txt"));
    }

    @Test
    void appliesEditsToDisk() throws Exception {
        WorkspaceService service = new WorkspaceService(root);
        service.writeFile("f.pbf", "Hello World");

        String updated = service.applyEdits("f.pbf", "Hello World", List.of(
            new TextEdit(0, 5, "Goodbye"),
            TextEdit.insert(11, "!")));

        assertEquals("Goodbye World!", updated);
        assertEquals("Goodbye World!", Files.readString(root.resolve("f.pbf")));
    }

    @Test
    void staleContentIsRejected() throws Exception {
        WorkspaceService service = new WorkspaceService(root);
        service.writeFile("f.pbf", "changed");
        assertThrows(IllegalStateException.class,
            () -> service.applyEdits("f.pbf", "original", List.of(TextEdit.insert(0, "x"))));
        assertEquals("changed", service.readFile("f.pbf"));
    }

    @Test
    void invalidEditsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> WorkspaceService.applyEdits("abc", List.of(new TextEdit(2, 9, "x"))));
        assertThrows(IllegalArgumentException.class,
            () -> WorkspaceService.applyEdits("abcdef", List.of(new TextEdit(0, 3, "x"), new TextEdit(2, 4, "y"))));
    }
}
