package com.starscape.rapidresize.common.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag owned by one session or run.
 * Workers check it between items; nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * @return true if this call flipped the flag, false if cancellation was already requested
     */
    public boolean cancel() {
        return requested.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }
}
