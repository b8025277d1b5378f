package com.formstudio;

import com.formstudio.models.TextEdit;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem access for form sources. All paths are workspace-relative; anything that
 * resolves outside the workspace root is rejected.
 */
public class WorkspaceService {

    static final String FORM_EXTENSION = ".pbf";

    private final Path workspaceRoot;

    public WorkspaceService(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        log("WorkspaceService initialized with root: " + this.workspaceRoot);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a workspace-relative path. A leading slash is ignored and backslashes count as
     * separators.
     *
     * @throws SecurityException if the path escapes the workspace root
     */
    public Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return workspaceRoot;
        }
        String normalized = relativePath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return workspaceRoot;
        }
        Path resolved = workspaceRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(workspaceRoot)) {
            throw new SecurityException("Path escapes workspace root: " + relativePath);
        }
        return resolved;
    }

    public String toRelativePath(Path absolutePath) {
        return workspaceRoot.relativize(absolutePath).toString().replace('\\', '/');
    }

    public boolean exists(String relativePath) {
        return Files.exists(resolvePath(relativePath));
    }

    public String readFile(String relativePath) throws IOException {
        Path path = requireFile(relativePath);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public void writeFile(String relativePath, String content) throws IOException {
        Path path = resolvePath(relativePath);
        Files.createDirectories(path.getParent());
        writeAtomically(path, content);
        log("Wrote file: " + relativePath);
    }

    /**
     * Workspace-relative paths of all form sources, sorted.
     */
    public List<String> listForms() throws IOException {
        try (Stream<Path> stream = Files.walk(workspaceRoot)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(FORM_EXTENSION))
                .filter(p -> !isHidden(workspaceRoot.relativize(p)))
                .map(this::toRelativePath)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Applies an edit list computed against {@code expectedContent} as one write. Nothing is
     * written when the file changed since the edits were computed or an edit is out of
     * bounds or overlaps another.
     *
     * @return the new file content
     * @throws IllegalStateException    if the file no longer matches {@code expectedContent}
     * @throws IllegalArgumentException if the edits are out of bounds or overlap
     */
    public String applyEdits(String relativePath, String expectedContent, List<TextEdit> edits) throws IOException {
        Path path = requireFile(relativePath);
        String current = Files.readString(path, StandardCharsets.UTF_8);
        if (expectedContent != null && !current.equals(expectedContent)) {
            throw new IllegalStateException("File changed on disk while the patch was computed: " + relativePath);
        }
        String updated = applyEdits(current, edits);
        writeAtomically(path, updated);
        log("Applied " + edits.size() + " edit(s) to " + relativePath);
        return updated;
    }

    /**
     * Pure form of {@link #applyEdits(String, String, List)}: edits are validated against
     * {@code content} and applied from the end of the text backwards.
     */
    public static String applyEdits(String content, List<TextEdit> edits) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort((a, b) -> a.getStart() != b.getStart()
            ? Integer.compare(a.getStart(), b.getStart())
            : Integer.compare(a.getEnd(), b.getEnd()));
        int lastEnd = 0;
        for (TextEdit edit : sorted) {
            if (edit.getStart() < 0 || edit.getEnd() < edit.getStart() || edit.getEnd() > content.length()) {
                throw new IllegalArgumentException("Edit out of bounds: " + edit);
            }
            if (edit.getStart() < lastEnd) {
                throw new IllegalArgumentException("Overlapping edit: " + edit);
            }
            lastEnd = edit.getEnd();
        }
        StringBuilder sb = new StringBuilder(content);
        for (int i = sorted.size() - 1; i >= 0; i--) {
            TextEdit edit = sorted.get(i);
            sb.replace(edit.getStart(), edit.getEnd(), edit.getNewText() != null ? edit.getNewText() : "");
        }
        return sb.toString();
    }

    private Path requireFile(String relativePath) throws IOException {
        Path path = resolvePath(relativePath);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("File not found: " + relativePath);
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Path is a directory: " + relativePath);
        }
        return path;
    }

    private void writeAtomically(Path path, String content) throws IOException {
        Path temp = Files.createTempFile(path.getParent(), "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[WorkspaceService] " + message);
        }
    }
}
