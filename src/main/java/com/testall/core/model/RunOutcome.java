package com.testall.core.model;

/**
 * Overall outcome of one orchestration run.
 */
public enum RunOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    NO_PROJECTS;

    /** Process exit status for this outcome: 0 for success or nothing to test, 1 otherwise. */
    public int exitCode() {
        return switch (this) {
            case SUCCESS, NO_PROJECTS -> 0;
            case FAILURE, TIMEOUT -> 1;
        };
    }
}
