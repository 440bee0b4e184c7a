package com.parallax.core.scheduler;

import com.parallax.core.model.Batch;

import java.util.List;

/**
 * Source of the next batch for an idle slot. Called only from the job's coordinator thread.
 */
interface DispatchStrategy<P> {

    /** Next batch for {@code slot}, or {@code null} if none is available right now. */
    Batch<P> next(int slot);

    /** True once every planned batch has been handed out. */
    boolean exhausted();

    /** Planned batches that were never handed out. */
    List<Batch<P>> undispatched();
}
