package com.testall.core.execution;

import com.testall.config.TestAllProperties;
import com.testall.core.logging.MdcContext;
import com.testall.core.model.ExecutionStatus;
import com.testall.core.model.Project;
import com.testall.core.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives dispatched executions to completion with fail-fast and a global deadline.
 *
 * <p>The live-execution map is created, read and mutated only by the thread calling
 * {@link #await}. Process exit notifications ({@link Process#onExit()}) arrive on other
 * threads and only hand the finished execution to a queue; the coordinator performs a
 * single wait on that queue, bounded by the time left until the deadline, so it reacts
 * to an exit or to the deadline without ever blocking on one particular child.
 *
 * <ul>
 *   <li>Exit code 0 marks an execution {@code SUCCEEDED}, anything else {@code FAILED}.</li>
 *   <li>The first {@code FAILED} execution (a spawn failure included) terminates every
 *       other live execution and marks it {@code CANCELLED}.</li>
 *   <li>The deadline runs from the first spawn. When it passes with executions still
 *       live, each is killed and marked {@code TIMED_OUT}; no single project is blamed.</li>
 *   <li>Several failures observed together: the first one taken off the queue is
 *       reported. This order is not deterministic.</li>
 * </ul>
 *
 * <p>Terminated processes get a grace period to exit before they are killed forcibly.
 */
@Service
public class ProcessMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProcessMonitor.class);

    private final Duration terminationGrace;

    @Autowired
    public ProcessMonitor(TestAllProperties properties) {
        this(properties.getTerminationGrace());
    }

    public ProcessMonitor(Duration terminationGrace) {
        this.terminationGrace = terminationGrace;
    }

    /**
     * Monitors the executions until all succeed, one fails, or the deadline passes.
     *
     * @param executions everything the dispatcher produced, in dispatch order
     * @param timeout    global deadline, measured from the first spawn
     * @param listener   notified once per execution as it reaches a terminal status
     * @throws InterruptedException if the coordinating thread is interrupted; live
     *                              executions are terminated before this propagates
     */
    public MonitorResult await(List<Execution> executions, Duration timeout,
                               ExecutionListener listener) throws InterruptedException {
        Map<Project, Execution> live = new HashMap<>();
        BlockingQueue<Execution> exited = new LinkedBlockingQueue<>();
        Execution spawnFailure = null;
        long firstStart = Long.MAX_VALUE;

        for (Execution execution : executions) {
            if (execution.status() == ExecutionStatus.RUNNING) {
                live.put(execution.project(), execution);
                execution.onExit().thenRun(() -> exited.offer(execution));
                firstStart = Math.min(firstStart, execution.startNanos());
            } else if (execution.status() == ExecutionStatus.FAILED && spawnFailure == null) {
                spawnFailure = execution;
            }
        }

        try {
            if (spawnFailure != null) {
                log.warn("Runner for {} could not be started, cancelling the run", spawnFailure.project().displayName());
                listener.onCompleted(spawnFailure.summary());
                cancelAll(live, listener);
                cancelNotStarted(executions, listener);
                return new MonitorResult(RunOutcome.FAILURE, spawnFailure, executions);
            }

            long deadline = firstStart + timeout.toNanos();
            while (!live.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Deadline of {}s exceeded with {} execution(s) still running",
                            timeout.toSeconds(), live.size());
                    timeOutAll(live, listener);
                    return new MonitorResult(RunOutcome.TIMEOUT, null, executions);
                }

                Execution done = exited.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null || live.remove(done.project()) == null) {
                    continue;
                }

                int code = done.exitValue();
                if (code == 0) {
                    done.markSucceeded(code);
                    log.debug("{} succeeded in {}ms", done.project().displayName(), done.elapsedMs());
                    listener.onCompleted(done.summary());
                } else {
                    done.markFailed(code);
                    log.warn("{} failed with exit code {}, cancelling {} sibling(s)",
                            done.project().displayName(), code, live.size());
                    listener.onCompleted(done.summary());
                    cancelAll(live, listener);
                    return new MonitorResult(RunOutcome.FAILURE, done, executions);
                }
            }
            return new MonitorResult(RunOutcome.SUCCESS, null, executions);
        } finally {
            if (!live.isEmpty()) {
                // Only reachable when interrupted or a listener threw.
                cancelAll(live, ExecutionListener.NONE);
            }
            reapTerminated(executions);
        }
    }

    private void cancelAll(Map<Project, Execution> live, ExecutionListener listener) {
        for (Execution execution : live.values()) {
            MdcContext.setProject(execution.project());
            try {
                execution.cancel();
                log.info("Cancelled {}", execution.project().displayName());
                listener.onCompleted(execution.summary());
            } finally {
                MdcContext.clearProject();
            }
        }
        live.clear();
    }

    private void timeOutAll(Map<Project, Execution> live, ExecutionListener listener) {
        for (Execution execution : live.values()) {
            execution.timeOut();
            log.info("Timed out {}", execution.project().displayName());
            listener.onCompleted(execution.summary());
        }
        live.clear();
    }

    private void cancelNotStarted(List<Execution> executions, ExecutionListener listener) {
        for (Execution execution : executions) {
            if (execution.status() == ExecutionStatus.PENDING) {
                execution.cancel();
                listener.onCompleted(execution.summary());
            }
        }
    }

    /** Gives terminated processes a shared grace period to exit, then kills the rest. */
    private void reapTerminated(List<Execution> executions) {
        long budget = terminationGrace.toNanos();
        try {
            for (Execution execution : executions) {
                ExecutionStatus status = execution.status();
                if (status == ExecutionStatus.CANCELLED || status == ExecutionStatus.TIMED_OUT) {
                    budget -= execution.reap(budget);
                }
            }
        } catch (InterruptedException e) {
            executions.forEach(Execution::kill);
            Thread.currentThread().interrupt();
        }
    }
}
