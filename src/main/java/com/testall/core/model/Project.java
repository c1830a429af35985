package com.testall.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A discovered, independently testable unit with one assigned platform.
 * Identity is the absolute, normalized path.
 */
public record Project(
    Path path,
    String displayName,
    Platform platform
) {

    public Project {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(platform, "platform");
        path = path.toAbsolutePath().normalize();
        if (displayName == null || displayName.isBlank()) {
            displayName = path.getFileName().toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Project other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }
}
