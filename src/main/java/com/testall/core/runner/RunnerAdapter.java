package com.testall.core.runner;

import com.testall.core.model.Platform;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * External, black-box executable that tests one project.
 * <p>
 * Contract: accepts the project path as its only extra argument, exits 0 on
 * success and non-zero on failure, writes diagnostics to its own streams.
 *
 * @param command executable followed by any fixed leading arguments
 */
public record RunnerAdapter(Platform platform, List<String> command) {

    public RunnerAdapter {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Runner adapter for " + platform + " has no command");
        }
        command = List.copyOf(command);
    }

    /** Full command line for the given project. */
    public List<String> commandFor(Path projectPath) {
        var full = new ArrayList<>(command);
        full.add(projectPath.toString());
        return full;
    }
}
