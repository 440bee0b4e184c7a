package com.parallax.core.model;

/**
 * Job-level behaviour when a task fails.
 */
public enum FailurePolicy {
    FAIL_FAST,
    COLLECT_ALL
}
