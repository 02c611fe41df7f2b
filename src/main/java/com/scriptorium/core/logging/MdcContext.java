package com.scriptorium.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility for managing Scriptorium-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(UUID projectId) {
        MDC.put("projectId", String.valueOf(projectId));
    }

    public static void setBranch(UUID projectId, UUID branchId) {
        MDC.put("projectId", String.valueOf(projectId));
        MDC.put("branchId", String.valueOf(branchId));
    }

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("branchId");
        MDC.remove("jobId");
    }
}
