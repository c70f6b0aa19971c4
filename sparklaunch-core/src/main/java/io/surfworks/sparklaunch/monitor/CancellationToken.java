package io.surfworks.sparklaunch.monitor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal checked by the monitor once per poll.
 *
 * <p>Thread-safe: typically cancelled from a shutdown hook or another thread.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Returns a token that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation.
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Returns true once cancellation has been requested.
     */
    public boolean isCancelled() {
        return cancelled.get();
    }
}
