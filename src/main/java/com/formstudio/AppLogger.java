package com.formstudio;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide logger writing timestamped lines to the log file and, in dev mode, the console.
 * Components call {@link #get()} and must tolerate a null result when the logger was never
 * initialized (unit tests do not initialize it).
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean verbose;

    private AppLogger(Path logFile, boolean verbose) throws IOException {
        this.consoleOutput = System.out;
        this.verbose = verbose;
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println(AppConfig.APP_NAME + " started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean verbose) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, verbose);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public void debug(String message) {
        if (verbose) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        t.printStackTrace(fileOutput);
        if (verbose) {
            t.printStackTrace(consoleOutput);
        }
    }

    private synchronized void log(String level, String message) {
        String line = String.format("[%s] [%-5s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        fileOutput.println(line);
        if (verbose) {
            consoleOutput.println(line);
        }
    }

    /**
     * Banner text: always on the console, mirrored to the file.
     */
    public void console(String message) {
        consoleOutput.println(message);
        fileOutput.println(message);
    }

    public void close() {
        fileOutput.close();
    }
}
