package com.testall.core.model;

import com.testall.core.runner.RunnerAdapter;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of discovery, classification and registry lookup: what will be dispatched
 * and what was skipped.
 */
public record RunPlan(
    Path baseDir,
    List<Entry> entries,
    List<SkippedCandidate> skipped
) {

    public RunPlan {
        entries = List.copyOf(entries);
        skipped = List.copyOf(skipped);
    }

    public List<Project> projects() {
        return entries.stream().map(Entry::project).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** One project paired with the adapter that will test it. */
    public record Entry(Project project, RunnerAdapter adapter) {}
}
