package com.testall.core.engine;

import com.testall.config.TestAllProperties;
import com.testall.core.discovery.PlatformClassifier;
import com.testall.core.discovery.ProjectDiscoverer;
import com.testall.core.discovery.ProjectRootResolver;
import com.testall.core.execution.Execution;
import com.testall.core.execution.ExecutionDispatcher;
import com.testall.core.execution.ExecutionListener;
import com.testall.core.execution.LogCollector;
import com.testall.core.execution.MonitorResult;
import com.testall.core.execution.ProcessMonitor;
import com.testall.core.logging.MdcContext;
import com.testall.core.metrics.TestAllMetrics;
import com.testall.core.model.Platform;
import com.testall.core.model.Project;
import com.testall.core.model.RunOutcome;
import com.testall.core.model.RunPlan;
import com.testall.core.model.RunResult;
import com.testall.core.model.SkipReason;
import com.testall.core.model.SkippedCandidate;
import com.testall.core.runner.RunnerAdapter;
import com.testall.core.runner.RunnerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the orchestration pipeline: discovery, classification and adapter lookup
 * ({@link #plan}), then fan-out, monitoring and log collection ({@link #execute}).
 * <p>
 * Discovery-side problems only shrink the plan. Execution-side failures end the run
 * through the monitor's cancellation, never by throwing. An
 * {@link OrchestrationException} means the run itself could not proceed.
 */
@Service
public class TestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TestOrchestrator.class);

    private final ProjectRootResolver rootResolver;
    private final ProjectDiscoverer discoverer;
    private final PlatformClassifier classifier;
    private final RunnerRegistry registry;
    private final ExecutionDispatcher dispatcher;
    private final ProcessMonitor monitor;
    private final TestAllProperties properties;
    private final TestAllMetrics metrics;

    public TestOrchestrator(ProjectRootResolver rootResolver,
                            ProjectDiscoverer discoverer,
                            PlatformClassifier classifier,
                            RunnerRegistry registry,
                            ExecutionDispatcher dispatcher,
                            ProcessMonitor monitor,
                            TestAllProperties properties,
                            @Autowired(required = false) TestAllMetrics metrics) {
        this.rootResolver = rootResolver;
        this.discoverer = discoverer;
        this.classifier = classifier;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.monitor = monitor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Builds the execution plan.
     *
     * @param projectDir base directory override, or {@code null} to resolve it
     * @param roots      root locations override, or {@code null}/empty for the configured list
     */
    public RunPlan plan(Path projectDir, List<String> roots) {
        Path baseDir = rootResolver.resolve(projectDir);
        List<String> effectiveRoots = roots != null && !roots.isEmpty() ? roots : properties.getRoots();

        var entries = new ArrayList<RunPlan.Entry>();
        var skipped = new ArrayList<SkippedCandidate>();

        for (Path candidate : discoverer.discover(baseDir, effectiveRoots)) {
            String displayName = baseDir.relativize(candidate.toAbsolutePath().normalize()).toString();

            Optional<Platform> platform = classifier.classify(candidate);
            if (platform.isEmpty()) {
                log.warn("No platform marker found in {}, skipping", displayName);
                skipped.add(new SkippedCandidate(candidate, SkipReason.UNCLASSIFIED_PLATFORM,
                        displayName + ": no platform marker found"));
                continue;
            }

            Optional<RunnerAdapter> adapter = registry.lookup(platform.get(), baseDir);
            if (adapter.isEmpty()) {
                log.warn("No runner adapter registered for {} ({}), skipping", displayName, platform.get());
                skipped.add(new SkippedCandidate(candidate, SkipReason.MISSING_RUNNER_ADAPTER,
                        displayName + ": no runner adapter for platform " + platform.get().tag()));
                continue;
            }

            entries.add(new RunPlan.Entry(new Project(candidate, displayName, platform.get()), adapter.get()));
        }

        log.info("Planned {} project(s) under {}, {} skipped", entries.size(), baseDir, skipped.size());
        return new RunPlan(baseDir, entries, skipped);
    }

    /**
     * Dispatches every planned project and monitors the run to completion.
     *
     * @param timeout global deadline, or {@code null} for the configured one
     */
    public RunResult execute(RunPlan plan, Duration timeout, ExecutionListener listener) {
        if (plan.isEmpty()) {
            recordRun(RunOutcome.NO_PROJECTS, Duration.ZERO);
            return RunResult.noProjects();
        }
        Duration deadline = timeout != null ? timeout : properties.getTimeout();
        ExecutionListener effectiveListener = listener != null ? listener : ExecutionListener.NONE;

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        long start = System.nanoTime();
        try (LogCollector logs = LogCollector.create()) {
            List<Execution> executions = dispatcher.dispatch(plan.entries(), logs, effectiveListener);
            if (metrics != null) {
                metrics.recordFanOut(executions.size());
            }

            MonitorResult observed = monitor.await(executions, deadline, effectiveListener);

            Project failedProject = null;
            String failureLog = null;
            if (observed.trigger() != null) {
                failedProject = observed.trigger().project();
                failureLog = logs.read(failedProject);
            }

            var summaries = observed.executions().stream().map(Execution::summary).toList();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (metrics != null) {
                summaries.forEach(metrics::recordExecution);
            }
            recordRun(observed.outcome(), elapsed);

            log.info("Run {} finished: {} in {}ms", runId, observed.outcome(), elapsed.toMillis());
            return new RunResult(observed.outcome(), failedProject, failureLog, summaries, elapsed);
        } catch (IOException e) {
            throw new OrchestrationException("Could not create log storage", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Run interrupted", e);
        } finally {
            MdcContext.clear();
        }
    }

    private void recordRun(RunOutcome outcome, Duration elapsed) {
        if (metrics != null) {
            metrics.recordRun(outcome, elapsed);
        }
    }
}
