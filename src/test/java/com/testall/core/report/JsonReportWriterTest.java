package com.testall.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testall.core.model.ExecutionStatus;
import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.Platform;
import com.testall.core.model.Project;
import com.testall.core.model.RunOutcome;
import com.testall.core.model.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonReportWriter writer = new JsonReportWriter(mapper);

    @Test
    @DisplayName("timeout report has no culprit and lists timed-out executions")
    void timeoutReport() throws IOException {
        var slow = new Project(tempDir.resolve("apps/slow"), "apps/slow", Platform.GRADLE);
        var result = new RunResult(RunOutcome.TIMEOUT, null, null,
                List.of(new ExecutionSummary(slow, ExecutionStatus.TIMED_OUT, null, 3000)),
                Duration.ofMillis(3010));
        Path target = tempDir.resolve("reports/nested/run.json");

        writer.write(result, target);

        JsonNode json = mapper.readTree(target.toFile());
        assertEquals("TIMEOUT", json.get("outcome").asText());
        assertEquals(1, json.get("exitCode").asInt());
        assertEquals(3010, json.get("elapsedMs").asLong());
        assertTrue(json.get("failedProject").isNull());
        JsonNode entry = json.get("executions").get(0);
        assertEquals("apps/slow", entry.get("project").asText());
        assertEquals(slow.path().toString(), entry.get("path").asText());
        assertEquals("gradle", entry.get("platform").asText());
        assertEquals("TIMED_OUT", entry.get("status").asText());
        assertTrue(entry.get("exitCode").isNull());
    }

    @Test
    @DisplayName("no-projects report exits 0 with an empty execution list")
    void noProjectsReport() throws IOException {
        Path target = tempDir.resolve("run.json");

        writer.write(RunResult.noProjects(), target);

        JsonNode json = mapper.readTree(target.toFile());
        assertEquals("NO_PROJECTS", json.get("outcome").asText());
        assertEquals(0, json.get("exitCode").asInt());
        assertEquals(0, json.get("executions").size());
        assertTrue(Files.readString(target).contains("\n"), "report is pretty-printed");
    }

    @Test
    @DisplayName("shared mapper is not reconfigured")
    void mapperCopied() {
        assertFalse(mapper.isEnabled(com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT));
    }
}
