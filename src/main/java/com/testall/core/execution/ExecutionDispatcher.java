package com.testall.core.execution;

import com.testall.core.engine.OrchestrationException;
import com.testall.core.logging.MdcContext;
import com.testall.core.model.Project;
import com.testall.core.model.RunPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Spawns one runner adapter process per planned project.
 * <p>
 * Every spawn is issued before monitoring begins; there is no concurrency bound.
 * Each process runs in its project directory with the absolute project path as its
 * only argument, and its combined stdout/stderr is appended to a sink from the
 * {@link LogCollector}.
 * <p>
 * A spawn failure becomes a {@code FAILED} execution. Since that already decides
 * the run, the remaining projects are not spawned and are handed to the monitor
 * as not-started executions.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    public List<Execution> dispatch(List<RunPlan.Entry> entries, LogCollector logs,
                                    ExecutionListener listener) {
        var executions = new ArrayList<Execution>(entries.size());
        boolean spawnFailed = false;
        try {
            for (var entry : entries) {
                Project project = entry.project();
                if (spawnFailed) {
                    executions.add(Execution.notStarted(project));
                    continue;
                }
                MdcContext.setProject(project);
                try {
                    Path sink = logs.allocate(project);
                    Execution execution = spawn(project, entry.adapter().commandFor(project.path()), sink);
                    executions.add(execution);
                    if (execution.hasProcess()) {
                        listener.onDispatched(project);
                    } else {
                        spawnFailed = true;
                    }
                } finally {
                    MdcContext.clearProject();
                }
            }
        } catch (IOException e) {
            executions.forEach(Execution::kill);
            throw new OrchestrationException("Could not allocate log sink", e);
        } catch (RuntimeException e) {
            executions.forEach(Execution::kill);
            throw e;
        }
        return executions;
    }

    private Execution spawn(Project project, List<String> command, Path sink) {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(project.path().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(sink.toFile()))
                    .start();
        } catch (IOException e) {
            log.warn("Failed to spawn runner for {}: {}", project.displayName(), e.getMessage());
            writeSpawnFailure(sink, command, e);
            return Execution.spawnFailed(project);
        }
        closeStdin(process);
        log.info("Spawned {} (pid {}): {}", project.displayName(), process.pid(), String.join(" ", command));
        return Execution.running(project, process);
    }

    /** Adapters get no stdin. */
    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private static void writeSpawnFailure(Path sink, List<String> command, IOException cause) {
        String message = "Failed to start runner adapter: " + String.join(" ", command)
                + System.lineSeparator() + cause.getMessage() + System.lineSeparator();
        try {
            Files.writeString(sink, message, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not record spawn failure in {}: {}", sink, e.getMessage());
        }
    }
}
