package com.testall.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Resolves the repository base directory that root locations are relative to.
 * <p>
 * Order: explicit override, then {@code git rev-parse --show-toplevel} run in the
 * working directory, then the working directory itself.
 */
@Service
public class ProjectRootResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectRootResolver.class);

    private static final List<String> GIT_TOPLEVEL = List.of("git", "rev-parse", "--show-toplevel");
    private static final long GIT_TIMEOUT_SECONDS = 10;

    public Path resolve(Path override) {
        Path workingDir = Path.of("").toAbsolutePath();
        if (override != null) {
            return workingDir.resolve(override).normalize();
        }
        Path gitRoot = gitToplevel(workingDir);
        return gitRoot != null ? gitRoot : workingDir;
    }

    /**
     * Runs git to find the enclosing repository root.
     *
     * @return the repository root, or {@code null} when git is missing or the directory is not a repository
     */
    Path gitToplevel(Path workDir) {
        try {
            var process = new ProcessBuilder(GIT_TOPLEVEL)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n")).trim();
            }

            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.debug("git rev-parse timed out in {}", workDir);
                return null;
            }
            if (process.exitValue() != 0 || output.isEmpty()) {
                log.debug("{} is not inside a git repository", workDir);
                return null;
            }
            Path root = Path.of(output);
            return Files.isDirectory(root) ? root : null;
        } catch (IOException e) {
            log.debug("git not available: {}", e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }
}
