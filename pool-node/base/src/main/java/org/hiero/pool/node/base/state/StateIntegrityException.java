// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.state;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.Objects;

/**
 * Thrown when a module's persisted state can not be opened or fails its integrity checks. Always fatal for the owning
 * module, it is never retried.
 */
public class StateIntegrityException extends IOException {
    /**
     * Why the state was rejected.
     */
    public enum Reason {
        /** The storage could not be opened, created, read or written. */
        STORAGE_OPEN_FAILED,
        /** The state is flagged as inconsistent or could not be parsed. */
        CORRUPT_STATE,
        /** The state belongs to a different chain than the running binary. */
        GENESIS_MISMATCH
    }

    /** The reason the state was rejected. */
    private final Reason reason;

    /**
     * Create a new exception.
     *
     * @param reason the reason the state was rejected
     * @param message the detail message
     */
    public StateIntegrityException(@NonNull final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    /**
     * Create a new exception.
     *
     * @param reason the reason the state was rejected
     * @param message the detail message
     * @param cause the underlying failure
     */
    public StateIntegrityException(@NonNull final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    /**
     * @return the reason the state was rejected
     */
    @NonNull
    public Reason reason() {
        return reason;
    }
}
