package com.formstudio;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Startup configuration: workspace root, log location, HTTP port and dev mode.
 */
public class AppConfig {

    public static final String APP_NAME = "Form Studio";
    static final String APP_DIR = "FormStudio";
    static final int DEFAULT_PORT = 7070;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Windows and macOS: {@code ~/Documents/FormStudio/forms}; elsewhere {@code ~/FormStudio/forms}.
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String profile = System.getenv("USERPROFILE");
            return Paths.get(profile != null ? profile : userHome, "Documents", APP_DIR, "forms");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_DIR, "forms");
        }
        return Paths.get(userHome, APP_DIR, "forms");
    }

    /**
     * Windows: {@code %APPDATA%\FormStudio\logs}; macOS: {@code ~/Library/Logs/FormStudio};
     * elsewhere {@code ~/.local/share/FormStudio/logs}.
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_DIR, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_DIR);
        }
        return Paths.get(userHome, ".local", "share", APP_DIR, "logs");
    }

    /**
     * The preferred port when it is free, else any free port the OS hands out.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path workspacePath;
        private Path logDirectory;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logDirectory(Path directory) {
            this.logDirectory = directory;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --workspace <dir>}, {@code --port <n>} (both also as {@code --opt=value})
         * and {@code --dev}. Unknown arguments are ignored.
         *
         * @throws IllegalArgumentException when a port value is not a number
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    port(parsePort(arg.substring("--port=".length())));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    port(parsePort(args[++i]));
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private static int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            Files.createDirectories(workspace);
            Path logDir = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(logDir);
            return new AppConfig(workspace, logDir.resolve("form-studio.log"), findAvailablePort(preferredPort), devMode);
        }
    }
}
