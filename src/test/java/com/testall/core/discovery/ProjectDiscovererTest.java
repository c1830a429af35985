package com.testall.core.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectDiscovererTest {

    @TempDir
    Path tempDir;

    ProjectDiscoverer discoverer = new ProjectDiscoverer();

    private Path dirWithFile(String relative) throws IOException {
        Path dir = tempDir.resolve(relative);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("README.md"), "x");
        return dir;
    }

    @Test
    @DisplayName("returns nothing when no root exists")
    void missingRoots() {
        assertTrue(discoverer.discover(tempDir, List.of("apps", "packages")).isEmpty());
    }

    @Test
    @DisplayName("lists children one level below each root, roots in order, names sorted")
    void ordering() throws IOException {
        dirWithFile("packages/zeta");
        dirWithFile("apps/web");
        dirWithFile("apps/api");
        dirWithFile("packages/alpha");

        var result = discoverer.discover(tempDir, List.of("apps", "packages"));

        assertEquals(List.of(
                tempDir.resolve("apps/api"),
                tempDir.resolve("apps/web"),
                tempDir.resolve("packages/alpha"),
                tempDir.resolve("packages/zeta")), result);
    }

    @Test
    @DisplayName("does not descend below the first level")
    void oneLevelOnly() throws IOException {
        dirWithFile("apps/web/nested/deeper");

        var result = discoverer.discover(tempDir, List.of("apps"));

        assertEquals(List.of(tempDir.resolve("apps/web")), result);
    }

    @Test
    @DisplayName("skips files, hidden directories and empty placeholders")
    void skipsImplausibleCandidates() throws IOException {
        dirWithFile("apps/real");
        dirWithFile("apps/.cache");
        Files.createDirectories(tempDir.resolve("apps/empty"));
        Files.createDirectories(tempDir.resolve("apps/placeholder"));
        Files.writeString(tempDir.resolve("apps/placeholder/.gitkeep"), "");
        Files.writeString(tempDir.resolve("apps/notes.txt"), "not a project");

        var result = discoverer.discover(tempDir, List.of("apps"));

        assertEquals(List.of(tempDir.resolve("apps/real")), result);
    }

    @Test
    @DisplayName("discovery is idempotent over an unchanged tree")
    void idempotent() throws IOException {
        dirWithFile("apps/b");
        dirWithFile("apps/a");
        dirWithFile("services/c");

        var first = discoverer.discover(tempDir, List.of("apps", "services"));
        var second = discoverer.discover(tempDir, List.of("apps", "services"));

        assertEquals(first, second);
        assertEquals(3, first.size());
    }

    @Test
    @DisplayName("overlapping roots yield each directory once, at its first position")
    void overlappingRootsDeduplicated() throws IOException {
        dirWithFile("apps/web");
        dirWithFile("packages/core");

        var result = discoverer.discover(tempDir, List.of("apps", "packages", "./apps", "apps/."));

        assertEquals(List.of(tempDir.resolve("apps/web"), tempDir.resolve("packages/core")), result);
    }

    @Test
    @DisplayName("a root that is a file is ignored")
    void rootIsFile() throws IOException {
        Files.writeString(tempDir.resolve("apps"), "");
        assertTrue(discoverer.discover(tempDir, List.of("apps")).isEmpty());
    }
}
