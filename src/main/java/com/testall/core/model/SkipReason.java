package com.testall.core.model;

/**
 * Non-fatal reasons a candidate directory is left out of the run.
 */
public enum SkipReason {
    /** No platform marker matched. */
    UNCLASSIFIED_PLATFORM,
    /** Classified, but no runner adapter is registered for the platform. */
    MISSING_RUNNER_ADAPTER
}
