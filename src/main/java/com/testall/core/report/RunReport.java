package com.testall.core.report;

import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.RunResult;

import java.util.List;

/**
 * JSON shape of a finished run.
 */
public record RunReport(
    String outcome,
    int exitCode,
    long elapsedMs,
    String failedProject,
    String failureLog,
    List<ExecutionEntry> executions
) {

    public record ExecutionEntry(
        String project,
        String path,
        String platform,
        String status,
        Integer exitCode,
        long elapsedMs
    ) {

        static ExecutionEntry from(ExecutionSummary summary) {
            return new ExecutionEntry(
                    summary.project().displayName(),
                    summary.project().path().toString(),
                    summary.project().platform().tag(),
                    summary.status().name(),
                    summary.exitCode(),
                    summary.elapsedMs());
        }
    }

    public static RunReport from(RunResult result) {
        return new RunReport(
                result.outcome().name(),
                result.exitCode(),
                result.elapsed().toMillis(),
                result.failedProjectOpt().map(p -> p.displayName()).orElse(null),
                result.failureLog(),
                result.executions().stream().map(ExecutionEntry::from).toList());
    }
}
