package de.bsommerfeld.canary.core.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for long-running batch operations. Batches
 * check the token between independent units (files, tables); a unit that has
 * started always runs to completion or rolls back as a whole.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A token that is never cancelled. Calling {@link #cancel()} on it is an error. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE)
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
