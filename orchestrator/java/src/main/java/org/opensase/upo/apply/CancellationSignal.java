package org.opensase.upo.apply;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for running applies. Checked between operations, so an operation
 * already sent to a target always completes.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
