package com.parallax.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Parallax-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String JOB_ID = "jobId";
    public static final String SLOT = "slot";
    public static final String BATCH_ID = "batchId";

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void setSlot(String jobId, int slot) {
        MDC.put(JOB_ID, jobId);
        MDC.put(SLOT, String.valueOf(slot));
    }

    public static void setBatch(String jobId, int slot, int batchId) {
        setSlot(jobId, slot);
        MDC.put(BATCH_ID, String.valueOf(batchId));
    }

    public static void clear() {
        MDC.remove(JOB_ID);
        MDC.remove(SLOT);
        MDC.remove(BATCH_ID);
    }

    /** Copy of the calling thread's whole MDC, for {@link #restore}. May be null. */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    /** Puts back a context taken with {@link #capture}, dropping anything set since. */
    public static void restore(Map<String, String> previous) {
        if (previous == null || previous.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
