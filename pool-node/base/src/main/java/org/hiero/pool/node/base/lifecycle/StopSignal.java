// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.lifecycle;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read only view of the one-shot broadcast fired when a {@link ShutdownGroup} stops. Any number of threads can wait
 * on it, and it can be combined with other wait conditions through {@link #toCompletableFuture()}.
 */
public final class StopSignal {
    /** Completed exactly once, when the owning group stops. */
    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    /** Only the owning group creates signals. */
    StopSignal() {}

    /**
     * Fire the signal. Only the owning group calls this, and only once.
     */
    void fire() {
        fired.complete(null);
    }

    /**
     * Non-blocking check of the signal.
     *
     * @return true if the signal has fired
     */
    public boolean isFired() {
        return fired.isDone();
    }

    /**
     * Block until the signal fires.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {
        try {
            fired.get();
        } catch (ExecutionException e) {
            // never completed exceptionally
            throw new IllegalStateException(e);
        }
    }

    /**
     * Block until the signal fires or the timeout elapses. This is the replacement for a plain sleep in loops that
     * must react promptly to shutdown.
     *
     * @param timeout the maximum time to wait
     * @return true if the signal fired, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(@NonNull final Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout);
        try {
            fired.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Get a future that completes when the signal fires. The returned future is a copy, completing or cancelling it
     * has no effect on the signal.
     *
     * @return a future completed when the signal fires
     */
    @NonNull
    public CompletableFuture<Void> toCompletableFuture() {
        return fired.copy();
    }
}
