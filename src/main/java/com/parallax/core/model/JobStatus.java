package com.parallax.core.model;

/**
 * Terminal status of a job.
 */
public enum JobStatus {
    COMPLETED,
    PARTIALLY_FAILED,
    CANCELLED
}
