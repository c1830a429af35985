package com.testall.core.model;

import java.nio.file.Path;

/**
 * A candidate directory excluded from the run, with the warning to show for it.
 */
public record SkippedCandidate(
    Path path,
    SkipReason reason,
    String detail
) {}
