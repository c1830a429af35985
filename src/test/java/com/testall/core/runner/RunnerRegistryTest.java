package com.testall.core.runner;

import com.testall.config.TestAllProperties;
import com.testall.core.model.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunnerRegistryTest {

    private final Path baseDir = Path.of("/repo");

    @Test
    @DisplayName("unregistered platform yields no adapter")
    void missingAdapter() {
        var registry = new RunnerRegistry(Map.of(Platform.NODE, "npm-test"));
        assertTrue(registry.lookup(Platform.GO, baseDir).isEmpty());
        assertFalse(registry.isRegistered(Platform.GO));
    }

    @Test
    @DisplayName("blank command counts as not registered")
    void blankCommand() {
        var registry = new RunnerRegistry(Map.of(Platform.NODE, "   "));
        assertTrue(registry.lookup(Platform.NODE, baseDir).isEmpty());
    }

    @Test
    @DisplayName("relative script path is resolved against the base directory")
    void relativeScript() {
        var registry = new RunnerRegistry(Map.of(Platform.FLUTTER, "scripts/testing/runners/flutter.sh"));
        var adapter = registry.lookup(Platform.FLUTTER, baseDir).orElseThrow();
        assertEquals(List.of("/repo/scripts/testing/runners/flutter.sh"), adapter.command());
        assertEquals(Platform.FLUTTER, adapter.platform());
    }

    @Test
    @DisplayName("bare executable names are left for PATH lookup, extra tokens kept")
    void bareExecutable() {
        var registry = new RunnerRegistry(Map.of(Platform.PYTHON, "  python3   -m pytest-runner "));
        var adapter = registry.lookup(Platform.PYTHON, baseDir).orElseThrow();
        assertEquals(List.of("python3", "-m", "pytest-runner"), adapter.command());
    }

    @Test
    @DisplayName("project path is appended as the single trailing argument")
    void commandForProject() {
        var adapter = new RunnerAdapter(Platform.GO, List.of("/bin/sh", "run.sh"));
        assertEquals(List.of("/bin/sh", "run.sh", "/repo/apps/svc"),
                adapter.commandFor(Path.of("/repo/apps/svc")));
    }

    @Test
    @DisplayName("adapter requires a command")
    void emptyCommandRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RunnerAdapter(Platform.GO, List.of()));
    }

    @Test
    @DisplayName("configured defaults register every platform")
    void defaultsFromProperties() {
        var properties = new TestAllProperties();
        properties.getRunners().put(Platform.RUST, "scripts/testing/runners/rust.sh");
        var registry = new RunnerRegistry(properties);
        assertTrue(registry.isRegistered(Platform.RUST));
        assertFalse(registry.isRegistered(Platform.NODE));
    }
}
