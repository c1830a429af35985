package com.testall.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    @Test
    void exitCodesFollowOutcome() {
        assertEquals(0, RunOutcome.SUCCESS.exitCode());
        assertEquals(0, RunOutcome.NO_PROJECTS.exitCode());
        assertEquals(1, RunOutcome.FAILURE.exitCode());
        assertEquals(1, RunOutcome.TIMEOUT.exitCode());
    }

    @Test
    void terminalStatuses() {
        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertTrue(ExecutionStatus.SUCCEEDED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());
        assertTrue(ExecutionStatus.TIMED_OUT.isTerminal());
    }

    @Test
    void projectIdentityIsTheNormalizedPath() {
        var a = new Project(Path.of("/repo/apps/./web"), "apps/web", Platform.NODE);
        var b = new Project(Path.of("/repo/apps/web"), "web", Platform.FLUTTER);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("web", new Project(Path.of("/repo/apps/web"), null, Platform.NODE).displayName());
    }

    @Test
    void withStatusFiltersExecutions() {
        var web = new Project(Path.of("/repo/apps/web"), "apps/web", Platform.NODE);
        var api = new Project(Path.of("/repo/apps/api"), "apps/api", Platform.GO);
        var result = new RunResult(RunOutcome.FAILURE, api, "log", List.of(
                new ExecutionSummary(web, ExecutionStatus.CANCELLED, null, 10),
                new ExecutionSummary(api, ExecutionStatus.FAILED, 1, 10)), Duration.ofMillis(12));

        assertEquals(List.of(web), result.withStatus(ExecutionStatus.CANCELLED).stream().map(s -> s.project()).toList());
        assertEquals(1, result.exitCode());
        assertEquals(api, result.failedProjectOpt().orElseThrow());
    }
}
