package com.testall.core.logging;

import com.testall.core.model.Project;
import org.slf4j.MDC;

/**
 * Utility for managing testall-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setProject(Project project) {
        MDC.put("project", project.displayName());
        MDC.put("platform", project.platform().tag());
    }

    public static void clearProject() {
        MDC.remove("project");
        MDC.remove("platform");
    }

    public static void clear() {
        MDC.remove("runId");
        clearProject();
    }
}
