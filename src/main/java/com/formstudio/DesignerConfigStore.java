package com.formstudio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formstudio.models.DesignerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists {@link DesignerConfig} as {@code .form-studio/designer-config.json} inside the workspace.
 */
public class DesignerConfigStore {
    private final ObjectMapper objectMapper;
    private Path configPath;

    public DesignerConfigStore(Path workspaceRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        configure(workspaceRoot);
    }

    public void configure(Path workspaceRoot) {
        this.configPath = workspaceRoot.resolve(".form-studio")
            .resolve("designer-config.json");
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * The stored settings, or defaults when the file is missing or unreadable.
     */
    public DesignerConfig loadOrDefault() {
        if (configPath == null || !Files.exists(configPath)) {
            return new DesignerConfig();
        }
        try {
            DesignerConfig loaded = objectMapper.readValue(configPath.toFile(), DesignerConfig.class);
            return loaded != null ? loaded.normalized() : new DesignerConfig();
        } catch (IOException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("Could not read " + configPath + ", using defaults: " + e.getMessage());
            }
            return new DesignerConfig();
        }
    }

    public DesignerConfig save(DesignerConfig config) throws IOException {
        if (config == null) {
            throw new IllegalArgumentException("Designer config is required");
        }
        DesignerConfig normalized = config.normalized();
        Files.createDirectories(configPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), normalized);
        return normalized;
    }
}
