package com.threatintel.auth.snapshot;

import java.util.concurrent.CancellationException;

/**
 * Cancellation flag handed to long-running backend operations, which check it
 * between units of work.
 */
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
