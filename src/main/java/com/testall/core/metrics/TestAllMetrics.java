package com.testall.core.metrics;

import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class TestAllMetrics {

    private final MeterRegistry registry;

    public TestAllMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(ExecutionSummary summary) {
        Timer.builder("testall.execution.duration")
                .tag("platform", summary.project().platform().tag())
                .tag("status", summary.status().name())
                .register(registry)
                .record(Duration.ofMillis(summary.elapsedMs()));
    }

    public void recordRun(RunOutcome outcome, Duration elapsed) {
        Counter.builder("testall.runs.total")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
        Timer.builder("testall.run.duration")
                .register(registry)
                .record(elapsed);
    }

    /**
     * Number of executions launched together; every spawn is issued before monitoring starts.
     */
    public void recordFanOut(int executions) {
        DistributionSummary.builder("testall.run.fan_out")
                .description("Executions dispatched per run")
                .register(registry)
                .record(executions);
    }
}
