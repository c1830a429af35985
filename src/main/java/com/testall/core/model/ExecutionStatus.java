package com.testall.core.model;

/**
 * Lifecycle of a single test execution.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
