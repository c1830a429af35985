package com.testall.core.execution;

import com.testall.core.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one append-only log file per execution inside a private temporary directory.
 * <p>
 * Use in try-with-resources: {@link #close()} removes the directory and every sink,
 * whatever the outcome of the run. Logs must be read back before closing.
 */
public class LogCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogCollector.class);

    private final Path directory;
    private final Map<Project, Path> sinks = new LinkedHashMap<>();
    private boolean closed;

    LogCollector(Path directory) {
        this.directory = directory;
    }

    public static LogCollector create() throws IOException {
        return new LogCollector(Files.createTempDirectory("testall-logs-"));
    }

    /**
     * Creates the sink for a project. Must be called before the project's adapter is spawned.
     */
    public Path allocate(Project project) throws IOException {
        if (closed) {
            throw new IllegalStateException("Log collector already closed");
        }
        if (sinks.containsKey(project)) {
            throw new IllegalStateException("Log sink already allocated for " + project.displayName());
        }
        Path sink = Files.createTempFile(directory, sanitize(project.displayName()) + "-", ".log");
        sinks.put(project, sink);
        return sink;
    }

    /**
     * Returns the complete captured output for the project, or an empty string if
     * nothing was written.
     */
    public String read(Project project) {
        Path sink = sinks.get(project);
        if (sink == null) {
            throw new IllegalArgumentException("No log sink for " + project.displayName());
        }
        try {
            return new String(Files.readAllBytes(sink), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read log for {}: {}", project.displayName(), e.getMessage());
            return "(log unavailable: " + e.getMessage() + ")";
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.debug("Removed log directory {}", directory);
        } catch (IOException e) {
            log.warn("Failed to remove log directory {}: {}", directory, e.getMessage());
        }
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
