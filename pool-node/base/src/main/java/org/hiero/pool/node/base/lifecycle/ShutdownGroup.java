// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.lifecycle;

import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the in-flight work of one module and coordinates its clean shutdown.
 *
 * <p>Every unit of work a module runs on its own threads (an accept loop, a dial, a request) first calls
 * {@link #acquire()} and closes the returned {@link Token} when done, on every exit path. Long-running work watches
 * {@link #stopSignal()} to exit promptly. Resources are registered with {@link #onStop(Runnable)} and are released in
 * reverse registration order, so the most dependent resource goes first.
 *
 * <pre>{@code
 * try (ShutdownGroup.Token ignored = group.acquire()) {
 *     while (!group.stopSignal().await(Duration.ofSeconds(5))) {
 *         doPeriodicWork();
 *     }
 * } catch (AlreadyStoppedException e) {
 *     return; // shutting down, do not start the work
 * }
 * }</pre>
 *
 * <h2>Stop</h2>
 * {@link #stop()} may be called once. It rejects further acquisitions, fires the stop signal, runs the cleanup hooks
 * and then blocks until every outstanding token has been released. There is no timeout and no cancellation, work must
 * observe the signal itself. A caller that wants a bounded shutdown races {@code stop()} against its own timer.
 *
 * <h2>Thread Safety</h2>
 * All methods are thread safe. A single lock guards the stopped flag and the hook list and is only held for
 * bookkeeping, never while hooks run or while waiting for the drain, so releases from other threads are never blocked
 * by a stop in progress.
 */
public final class ShutdownGroup {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ShutdownGroup.class.getName());
    /** Name used in log messages. */
    private final String name;
    /** Created on first use, see {@link #stopSignal()}. */
    private final AtomicReference<StopSignal> stopSignal = new AtomicReference<>();
    /** Guards {@link #stopped} and {@link #onStopHooks}. */
    private final ReentrantLock lock = new ReentrantLock();
    /** Cleanup hooks in registration order. Guarded by {@link #lock}. */
    private final List<Runnable> onStopHooks = new ArrayList<>();
    /** Set once, never cleared. Guarded by {@link #lock}. */
    private boolean stopped = false;
    /** Number of acquired and not yet released tokens. */
    private final AtomicInteger activeCount = new AtomicInteger();
    /** Monitor used by {@link #stop()} to wait for the active count to reach zero. */
    private final Object drainMonitor = new Object();

    /**
     * Create a new unnamed shutdown group.
     */
    public ShutdownGroup() {
        this("shutdown-group");
    }

    /**
     * Create a new shutdown group.
     *
     * @param name the name used in log messages, usually the owning module's name
     */
    public ShutdownGroup(@NonNull final String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Get the stop signal. The signal is created on first use so that it does not matter whether the first caller is
     * a waiter or {@link #stop()}.
     *
     * @return the stop signal of this group, always the same instance
     */
    @NonNull
    public StopSignal stopSignal() {
        final StopSignal existing = stopSignal.get();
        if (existing != null) {
            return existing;
        }
        stopSignal.compareAndSet(null, new StopSignal());
        return stopSignal.get();
    }

    /**
     * Non-blocking check if this group has been stopped.
     *
     * @return true once {@link #stop()} has been called
     */
    public boolean isStopped() {
        return stopSignal().isFired();
    }

    /**
     * Register one unit of in-flight work. The returned token must be released exactly once, closing it in a
     * try-with-resources block is the simplest way to guarantee that.
     *
     * @return the token to release when the work is done
     * @throws AlreadyStoppedException if the group is stopped, in which case the work must not be started
     */
    @NonNull
    public Token acquire() throws AlreadyStoppedException {
        lock.lock();
        try {
            if (stopped) {
                throw new AlreadyStoppedException(name + " already stopped");
            }
            activeCount.incrementAndGet();
            return new Token(this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release one unit of in-flight work. Releasing the same token twice has no effect.
     *
     * @param token a token returned by {@link #acquire()} on this group
     * @throws IllegalArgumentException if the token belongs to another group
     */
    public void release(@NonNull final Token token) {
        if (token.group != this) {
            throw new IllegalArgumentException("token was acquired from a different shutdown group");
        }
        if (!token.released.compareAndSet(false, true)) {
            return;
        }
        if (activeCount.decrementAndGet() == 0) {
            synchronized (drainMonitor) {
                drainMonitor.notifyAll();
            }
        }
    }

    /**
     * Get the number of acquired and not yet released tokens.
     *
     * @return the active count, never negative
     */
    public int activeCount() {
        return activeCount.get();
    }

    /**
     * Register a cleanup hook. If the group is already stopped the hook is run right away on the calling thread,
     * before this method returns.
     *
     * @param hook the hook to run when the group stops
     */
    public void onStop(@NonNull final Runnable hook) {
        Objects.requireNonNull(hook);
        lock.lock();
        try {
            if (!stopped) {
                onStopHooks.add(hook);
                return;
            }
        } finally {
            lock.unlock();
        }
        runHook(hook);
    }

    /**
     * Stop the group. Marks it stopped, fires the stop signal, runs all cleanup hooks in reverse registration order
     * and then blocks until all tokens have been released. Interrupts do not cut the wait short, the interrupt flag
     * is restored before returning.
     *
     * @throws AlreadyStoppedException if the group was already stopped, in which case nothing is done
     */
    public void stop() throws AlreadyStoppedException {
        final List<Runnable> hooks;
        lock.lock();
        try {
            if (stopped) {
                throw new AlreadyStoppedException(name + " already stopped");
            }
            stopped = true;
            stopSignal().fire();
            hooks = new ArrayList<>(onStopHooks);
            onStopHooks.clear();
        } finally {
            lock.unlock();
        }
        for (int i = hooks.size() - 1; i >= 0; i--) {
            runHook(hooks.get(i));
        }
        awaitDrained();
    }

    /**
     * Run one hook, a failing hook must not prevent the remaining ones from running.
     *
     * @param hook the hook to run
     */
    private void runHook(final Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            LOGGER.log(WARNING, "Cleanup hook of %s failed".formatted(name), e);
        }
    }

    /**
     * Wait until the active count reaches zero.
     */
    private void awaitDrained() {
        boolean interrupted = false;
        synchronized (drainMonitor) {
            while (activeCount.get() > 0) {
                try {
                    drainMonitor.wait();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "ShutdownGroup[" + name + ", stopped=" + isStopped() + ", active=" + activeCount.get() + "]";
    }

    /**
     * Proof of one acquisition on a {@link ShutdownGroup}. Closing the token releases it.
     */
    public static final class Token implements AutoCloseable {
        /** The group this token was acquired from. */
        private final ShutdownGroup group;
        /** Guards against double release. */
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Token(final ShutdownGroup group) {
            this.group = group;
        }

        /**
         * Release this token, same as {@link ShutdownGroup#release(Token)}.
         */
        @Override
        public void close() {
            group.release(this);
        }
    }
}
