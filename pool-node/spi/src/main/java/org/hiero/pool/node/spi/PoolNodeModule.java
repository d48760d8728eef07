// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;

/**
 * Common contract of the layered pool node modules. Every module owns exactly one {@link ShutdownGroup} guarding its
 * background work and resources, and stopping that group is how the module is shut down.
 */
public interface PoolNodeModule {
    /**
     * The name of the module, used in logs and errors.
     *
     * @return the name of the module
     */
    @NonNull
    String name();

    /**
     * The shutdown group of this module.
     *
     * @return the module's shutdown group
     */
    @NonNull
    ShutdownGroup shutdownGroup();

    /**
     * Stop the module, releasing all its resources once in-flight work has drained. Blocks until that is done.
     *
     * @throws AlreadyStoppedException if the module was already stopped
     */
    default void stop() throws AlreadyStoppedException {
        shutdownGroup().stop();
    }
}
