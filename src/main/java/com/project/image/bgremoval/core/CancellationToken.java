package com.project.image.bgremoval.core;

import com.project.image.bgremoval.exceptions.RemovalCancelledException;

/**
 * Cooperative cancellation flag shared between the caller and a running pipeline. The stages poll
 * it once per dequeued pixel or per row.
 */
public final class CancellationToken {
    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new RemovalCancelledException("Background removal was cancelled");
        }
    }
}
