// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.pool.node.spi.threading.ThreadPoolManager;

/**
 * The default implementation of the {@link ThreadPoolManager} interface. This
 * implementation is used systemwide to manage the thread pools. All threads are
 * daemon threads, the node's lifecycle is driven by shutdown groups, not by
 * thread liveness.
 */
final class DefaultThreadPoolManager implements ThreadPoolManager {
    /**
     * {@inheritDoc}
     * <p>
     * Idle threads are reused for a short while, so this behaves as thread
     * per task for the blocking work it is meant for.
     */
    @NonNull
    @Override
    public ExecutorService createThreadPerTaskExecutor(
            @NonNull final String threadName, @Nullable final UncaughtExceptionHandler uncaughtExceptionHandler) {
        requireNotBlank(threadName);
        return Executors.newCachedThreadPool(threadFactory(threadName, true, uncaughtExceptionHandler));
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public ExecutorService createSingleThreadExecutor(@NonNull final String threadName) {
        requireNotBlank(threadName);
        final ThreadFactory factory = threadFactory(threadName, false, null);
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
    }

    private static ThreadFactory threadFactory(
            final String threadName,
            final boolean numbered,
            @Nullable final UncaughtExceptionHandler uncaughtExceptionHandler) {
        final AtomicLong counter = new AtomicLong();
        return runnable -> {
            final String name = numbered ? threadName + "-" + counter.getAndIncrement() : threadName;
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            if (uncaughtExceptionHandler != null) {
                thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
            }
            return thread;
        };
    }

    private static void requireNotBlank(final String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("thread name must not be blank");
        }
    }
}
