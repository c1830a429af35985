package com.testall.core.runner;

import com.testall.config.TestAllProperties;
import com.testall.core.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a platform to its runner adapter.
 * <p>
 * Adapters are configured as whitespace-separated command strings under
 * {@code testall.runners.<PLATFORM>}. A relative executable that contains a path
 * separator is resolved against the repository base directory; bare names are
 * left for {@code PATH} lookup. The registry does not check that the executable
 * exists: a bad adapter surfaces as a spawn failure for that project.
 */
@Service
public class RunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunnerRegistry.class);

    private final Map<Platform, String> commands;

    @Autowired
    public RunnerRegistry(TestAllProperties properties) {
        this(properties.getRunners());
    }

    public RunnerRegistry(Map<Platform, String> commands) {
        this.commands = commands == null || commands.isEmpty()
                ? new EnumMap<>(Platform.class)
                : new EnumMap<>(commands);
    }

    /**
     * @param platform classified platform
     * @param baseDir  repository base directory used to resolve relative adapter paths
     * @return the adapter, or empty when none is registered for the platform
     */
    public Optional<RunnerAdapter> lookup(Platform platform, Path baseDir) {
        String command = commands.get(platform);
        if (command == null || command.isBlank()) {
            log.debug("No runner adapter registered for {}", platform);
            return Optional.empty();
        }
        String[] tokens = command.trim().split("\\s+");
        tokens[0] = resolveExecutable(tokens[0], baseDir);
        return Optional.of(new RunnerAdapter(platform, Arrays.asList(tokens)));
    }

    public boolean isRegistered(Platform platform) {
        String command = commands.get(platform);
        return command != null && !command.isBlank();
    }

    private static String resolveExecutable(String executable, Path baseDir) {
        if (baseDir == null || !executable.contains("/")) {
            return executable;
        }
        Path path = Path.of(executable);
        return path.isAbsolute() ? executable : baseDir.resolve(path).normalize().toString();
    }
}
