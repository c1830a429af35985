package com.testall.core.model;

/**
 * Final state of one execution, as reported at the end of a run.
 *
 * @param exitCode  process exit code, or {@code null} when the process never exited on its own
 * @param elapsedMs wall-clock time from spawn until completion or termination
 */
public record ExecutionSummary(
    Project project,
    ExecutionStatus status,
    Integer exitCode,
    long elapsedMs
) {}
