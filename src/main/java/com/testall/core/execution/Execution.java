package com.testall.core.execution;

import com.testall.core.model.ExecutionStatus;
import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.Project;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * One spawned (or attempted) test run for a project.
 * <p>
 * Created by {@link ExecutionDispatcher}; after dispatch only {@link ProcessMonitor}
 * changes its status, always from the coordinating thread. Not thread-safe.
 */
public final class Execution {

    private final Project project;
    private final Process process;
    private final long startNanos;

    private ExecutionStatus status;
    private Integer exitCode;
    private long finishedNanos = -1;

    private Execution(Project project, Process process, ExecutionStatus status) {
        this.project = project;
        this.process = process;
        this.status = status;
        this.startNanos = System.nanoTime();
    }

    static Execution running(Project project, Process process) {
        return new Execution(project, process, ExecutionStatus.RUNNING);
    }

    /** The adapter could not be started; counts as a test failure for the project. */
    static Execution spawnFailed(Project project) {
        var execution = new Execution(project, null, ExecutionStatus.FAILED);
        execution.finishedNanos = execution.startNanos;
        return execution;
    }

    /** Never spawned because an earlier spawn already failed the run. */
    static Execution notStarted(Project project) {
        return new Execution(project, null, ExecutionStatus.PENDING);
    }

    public Project project() { return project; }
    public ExecutionStatus status() { return status; }
    public Integer exitCode() { return exitCode; }

    long startNanos() { return startNanos; }

    boolean hasProcess() {
        return process != null;
    }

    Optional<ProcessHandle> handle() {
        return process != null ? Optional.of(process.toHandle()) : Optional.empty();
    }

    boolean isAlive() {
        return process != null && process.isAlive();
    }

    CompletableFuture<Process> onExit() {
        return process.onExit();
    }

    int exitValue() {
        return process.exitValue();
    }

    void markSucceeded(int code) {
        finish(ExecutionStatus.SUCCEEDED, code);
    }

    void markFailed(int code) {
        finish(ExecutionStatus.FAILED, code);
    }

    /** Requests graceful termination of the adapter and its descendants, then marks it cancelled. */
    void cancel() {
        if (process != null) {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }
        finish(ExecutionStatus.CANCELLED, null);
    }

    /** Forcibly terminates the adapter and its descendants, then marks it timed out. */
    void timeOut() {
        if (process != null) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
        finish(ExecutionStatus.TIMED_OUT, null);
    }

    /**
     * Waits up to {@code nanos} for a terminated process to go away, then kills it.
     *
     * @return nanoseconds actually spent waiting
     */
    long reap(long nanos) throws InterruptedException {
        if (process == null || !process.isAlive()) {
            return 0;
        }
        long start = System.nanoTime();
        if (nanos <= 0 || !process.waitFor(nanos, TimeUnit.NANOSECONDS)) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
        return System.nanoTime() - start;
    }

    /** Best-effort kill used when the run is torn down abnormally. */
    void kill() {
        if (process != null && process.isAlive()) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    private void finish(ExecutionStatus terminal, Integer code) {
        this.status = terminal;
        this.exitCode = code;
        this.finishedNanos = System.nanoTime();
    }

    public long elapsedMs() {
        long end = finishedNanos >= 0 ? finishedNanos : System.nanoTime();
        return TimeUnit.NANOSECONDS.toMillis(end - startNanos);
    }

    public ExecutionSummary summary() {
        long elapsed = hasProcess() ? elapsedMs() : 0L;
        return new ExecutionSummary(project, status, exitCode, elapsed);
    }

    @Override
    public String toString() {
        return "Execution[" + project.displayName() + ", " + status + "]";
    }
}
