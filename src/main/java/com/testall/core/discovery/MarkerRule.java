package com.testall.core.discovery;

import com.testall.core.model.Platform;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * One entry of the classifier's priority list: a marker predicate and the platform it selects.
 */
public record MarkerRule(Predicate<Path> marker, Platform platform, String description) {

    /** Matches when any of the given file names exists directly inside the directory. */
    public static MarkerRule anyFile(Platform platform, String... fileNames) {
        var names = List.of(fileNames);
        return new MarkerRule(
                dir -> names.stream().anyMatch(name -> Files.isRegularFile(dir.resolve(name))),
                platform,
                String.join(" | ", names));
    }

    public boolean matches(Path dir) {
        return marker.test(dir);
    }
}
