package com.testall.core.execution;

import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.Project;

/**
 * Progress callbacks. Always invoked from the thread driving the run.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {};

    default void onDispatched(Project project) {}

    /** Called once per execution when it reaches a terminal status. */
    default void onCompleted(ExecutionSummary summary) {}
}
