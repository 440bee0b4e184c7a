package com.parallax.core.pool;

/**
 * Anything delivered to a job coordinator's mailbox: slot completions from the pool, and
 * control signals from the scheduler.
 */
public interface CoordinatorMessage {
}
