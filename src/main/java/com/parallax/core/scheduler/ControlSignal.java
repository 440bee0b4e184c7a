package com.parallax.core.scheduler;

import com.parallax.core.pool.CoordinatorMessage;

/**
 * Signals the scheduler sends to a job coordinator alongside slot completions.
 */
enum ControlSignal implements CoordinatorMessage {
    /** The submitting thread has put at least one more batch on the shared queue. */
    UNITS_AVAILABLE,
    /** The caller asked for cancellation. */
    CANCEL
}
