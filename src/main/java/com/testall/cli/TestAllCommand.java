package com.testall.cli;

import com.testall.config.TestAllProperties;
import com.testall.core.engine.OrchestrationException;
import com.testall.core.engine.TestOrchestrator;
import com.testall.core.model.RunPlan;
import com.testall.core.model.RunResult;
import com.testall.core.report.JsonReportWriter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: testall
 * <p>
 * Discovers every testable project, runs all runner adapters in parallel with
 * fail-fast cancellation and a global timeout, and exits 0 when everything passed
 * (or nothing was found) and 1 on a failure or timeout.
 */
@Command(
        name = "testall",
        mixinStandardHelpOptions = true,
        version = "testall 0.1.0",
        description = "Run the tests of every project in the repository in parallel, failing fast"
)
@Component
public class TestAllCommand implements Callable<Integer> {

    @Option(names = {"--project-dir", "-C"},
            description = "Repository base directory (default: git toplevel, else the working directory)")
    private Path projectDir;

    @Option(names = {"--root", "-r"},
            description = "Root location to search for projects; repeatable (default: configured roots)")
    private List<String> roots;

    @Option(names = {"--timeout", "-t"},
            description = "Global timeout in seconds for the whole run (default: configured timeout)")
    private Integer timeoutSeconds;

    @Option(names = "--report",
            description = "Write a JSON summary of the run to this file")
    private Path reportFile;

    private final TestOrchestrator orchestrator;
    private final TestAllProperties properties;
    private final JsonReportWriter reportWriter;

    public TestAllCommand(TestOrchestrator orchestrator, TestAllProperties properties,
                          @Autowired(required = false) JsonReportWriter reportWriter) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.reportWriter = reportWriter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            ConsoleOutput.error("Invalid timeout: " + timeoutSeconds + ". Must be a positive number of seconds");
            return 2;
        }
        if (timeoutSeconds == null && properties.getTimeoutSeconds() <= 0) {
            ConsoleOutput.error("Invalid testall.timeout-seconds: " + properties.getTimeoutSeconds()
                    + ". Must be a positive number of seconds");
            return 2;
        }
        Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : properties.getTimeout();
        var reporter = new ResultReporter();

        RunPlan plan = orchestrator.plan(projectDir, roots);
        reporter.discovered(plan);

        RunResult result;
        if (plan.isEmpty()) {
            result = RunResult.noProjects();
        } else {
            reporter.dispatching(plan.entries().size(), timeout);
            try {
                result = orchestrator.execute(plan, timeout, reporter);
            } catch (OrchestrationException e) {
                ConsoleOutput.error("Test run aborted: " + rootCauseMessage(e));
                return 1;
            }
        }

        writeReport(result);
        return reporter.report(result, timeout);
    }

    private void writeReport(RunResult result) {
        if (reportFile == null || reportWriter == null) {
            return;
        }
        try {
            reportWriter.write(result, reportFile);
        } catch (IOException e) {
            ConsoleOutput.warning("Could not write report to " + reportFile + ": " + e.getMessage());
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return cause == t ? detail : t.getMessage() + ": " + detail;
    }
}
