// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi.threading;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * An interface that defines a manager for creating thread pools across the node. Modules should get their threads
 * from here rather than creating them, so the node controls all threading and tests can substitute executors that run
 * tasks in a controlled way.
 */
public interface ThreadPoolManager {
    /**
     * Factory method. Creates a new thread-per-task {@link ExecutorService}, suited to short lived or blocking tasks.
     *
     * @param threadName the thread name prefix, must not be blank
     * @return a new executor service
     */
    @NonNull
    default ExecutorService createThreadPerTaskExecutor(@NonNull final String threadName) {
        return createThreadPerTaskExecutor(Objects.requireNonNull(threadName), null);
    }

    /**
     * Factory method. Creates a new thread-per-task {@link ExecutorService} using the specified (nullable)
     * {@link Thread.UncaughtExceptionHandler}.
     *
     * @param threadName the thread name prefix, must not be blank
     * @param uncaughtExceptionHandler the uncaught exception handler, nullable
     * @return a new executor service
     */
    @NonNull
    ExecutorService createThreadPerTaskExecutor(
            @NonNull final String threadName,
            @Nullable final Thread.UncaughtExceptionHandler uncaughtExceptionHandler);

    /**
     * Factory method for a single thread executor, for long running loops.
     *
     * @param threadName the thread's name, must not be blank
     * @return a new single thread executor service
     */
    @NonNull
    ExecutorService createSingleThreadExecutor(@NonNull final String threadName);
}
