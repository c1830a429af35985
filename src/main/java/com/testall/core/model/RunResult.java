package com.testall.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate result of a run.
 * <p>
 * {@code failedProject} and {@code failureLog} are set only for {@link RunOutcome#FAILURE};
 * a timeout has no single culprit.
 */
public record RunResult(
    RunOutcome outcome,
    Project failedProject,
    String failureLog,
    List<ExecutionSummary> executions,
    Duration elapsed
) {

    public RunResult {
        executions = executions != null ? List.copyOf(executions) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public static RunResult noProjects() {
        return new RunResult(RunOutcome.NO_PROJECTS, null, null, List.of(), Duration.ZERO);
    }

    public Optional<Project> failedProjectOpt() {
        return Optional.ofNullable(failedProject);
    }

    public List<ExecutionSummary> withStatus(ExecutionStatus status) {
        return executions.stream().filter(e -> e.status() == status).toList();
    }

    public int exitCode() {
        return outcome.exitCode();
    }
}
