package com.testall.core.model;

/**
 * Closed set of platforms a project can be classified as.
 * Each platform selects exactly one runner adapter.
 */
public enum Platform {
    FLUTTER,
    NODE,
    MAVEN,
    GRADLE,
    PYTHON,
    GO,
    RUST;

    /** Lower-case tag used in console output and adapter file names. */
    public String tag() {
        return name().toLowerCase();
    }
}
