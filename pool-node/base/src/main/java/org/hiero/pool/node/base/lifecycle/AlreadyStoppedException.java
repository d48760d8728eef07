// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.lifecycle;

/**
 * Thrown by {@link ShutdownGroup} operations once the group has been stopped. This is an idempotency guard rather than
 * a fatal error, callers are expected to catch it and branch.
 */
public class AlreadyStoppedException extends Exception {
    /**
     * {@inheritDoc}
     */
    public AlreadyStoppedException() {
        super("shutdown group already stopped");
    }

    /**
     * {@inheritDoc}
     */
    public AlreadyStoppedException(final String message) {
        super(message);
    }
}
