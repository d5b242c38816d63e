package com.ttennebkram.stickersplit.processing;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the caller and the workers.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Split cancelled");
        }
    }
}
