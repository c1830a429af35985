package com.testall.cli;

import com.testall.core.execution.ExecutionListener;
import com.testall.core.model.ExecutionStatus;
import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.RunPlan;
import com.testall.core.model.RunResult;
import com.testall.core.model.SkippedCandidate;

import java.time.Duration;
import java.util.List;

/**
 * Renders discovery, progress and the final report, and maps the result to an exit code.
 * <p>
 * On failure exactly one project's log is shown; every cancelled sibling is listed as
 * cancelled, never as passed or failed.
 */
public class ResultReporter implements ExecutionListener {

    public void discovered(RunPlan plan) {
        for (SkippedCandidate skipped : plan.skipped()) {
            ConsoleOutput.warning(skipped.detail() + ", skipping");
        }
        if (plan.isEmpty()) {
            return;
        }
        ConsoleOutput.info("Discovered " + plural(plan.entries().size(), "project") + ":");
        plan.projects().forEach(ConsoleOutput::project);
        System.out.println();
    }

    public void dispatching(int count, Duration timeout) {
        ConsoleOutput.info("Running " + plural(count, "test suite") + " in parallel (fail-fast, timeout "
                + ConsoleOutput.formatDuration(timeout.toMillis()) + ")...");
        System.out.println();
    }

    @Override
    public void onCompleted(ExecutionSummary summary) {
        ConsoleOutput.progress(summary);
    }

    /**
     * Prints the final block for the result.
     *
     * @return process exit code
     */
    public int report(RunResult result, Duration timeout) {
        System.out.println();
        switch (result.outcome()) {
            case NO_PROJECTS -> ConsoleOutput.info("No testable projects found. Nothing to test.");
            case SUCCESS -> {
                ConsoleOutput.rule();
                ConsoleOutput.success("All tests passed: " + plural(result.executions().size(), "project")
                        + " in " + ConsoleOutput.formatDuration(result.elapsed().toMillis()));
            }
            case FAILURE -> reportFailure(result);
            case TIMEOUT -> reportTimeout(result, timeout);
        }
        return result.exitCode();
    }

    private void reportFailure(RunResult result) {
        String name = result.failedProjectOpt().map(p -> p.displayName()).orElse("unknown project");
        ConsoleOutput.error("Tests failed in " + name);
        System.out.println();
        System.out.println("Output from " + name + ":");
        ConsoleOutput.log(result.failureLog());
        reportCancelled(result.withStatus(ExecutionStatus.CANCELLED));
    }

    private void reportTimeout(RunResult result, Duration timeout) {
        ConsoleOutput.error("Test run exceeded the global timeout of "
                + ConsoleOutput.formatDuration(timeout.toMillis()));
        for (ExecutionSummary timedOut : result.withStatus(ExecutionStatus.TIMED_OUT)) {
            ConsoleOutput.error("  " + timedOut.project().displayName() + " was still running and has been terminated");
        }
        ConsoleOutput.warning("No single project is identified as the cause.");
    }

    private void reportCancelled(List<ExecutionSummary> cancelled) {
        if (cancelled.isEmpty()) {
            ConsoleOutput.warning("No other test executions were running; nothing to cancel.");
            return;
        }
        ConsoleOutput.warning("Remaining test executions were cancelled (fail-fast): "
                + String.join(", ", cancelled.stream().map(s -> s.project().displayName()).toList()));
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
