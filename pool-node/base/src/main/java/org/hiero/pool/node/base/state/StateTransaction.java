// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.state;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.state.StateIntegrityException.Reason;

/**
 * A view of a {@link StateStore}'s content for the duration of one {@link StateStore#update} or
 * {@link StateStore#view} call. Changes are only persisted if the whole update completes without an exception.
 */
public final class StateTransaction {
    static final String INITIALIZED_KEY = "initialized";
    static final String INCONSISTENCY_KEY = "inconsistency";
    static final String PATH_PREFIX = "path.";

    private final Properties properties;
    private final boolean readOnly;
    private boolean dirty = false;

    StateTransaction(@NonNull final Properties properties, final boolean readOnly) {
        this.properties = properties;
        this.readOnly = readOnly;
    }

    /**
     * @return true if the state has been initialized
     */
    public boolean isInitialized() {
        return Boolean.parseBoolean(properties.getProperty(INITIALIZED_KEY));
    }

    /**
     * Mark the state as initialized. There is no way to reverse this.
     */
    public void markInitialized() {
        put(INITIALIZED_KEY, Boolean.TRUE.toString());
    }

    /**
     * @return true if an inconsistency was detected in the state at some point
     */
    public boolean isInconsistencyDetected() {
        return Boolean.parseBoolean(properties.getProperty(INCONSISTENCY_KEY));
    }

    /**
     * Flag the state as inconsistent, it will not load again.
     */
    public void markInconsistencyDetected() {
        put(INCONSISTENCY_KEY, Boolean.TRUE.toString());
    }

    /**
     * Get the id of the block at the given height of the current path.
     *
     * @param height the block height, 0 is the genesis block
     * @return the block id, empty if the path is shorter
     * @throws StateIntegrityException if the stored id can not be parsed
     */
    @NonNull
    public Optional<Hash> blockIdAt(final long height) throws StateIntegrityException {
        final String hex = properties.getProperty(PATH_PREFIX + height);
        if (hex == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Hash.fromHex(hex));
        } catch (IllegalArgumentException e) {
            throw new StateIntegrityException(Reason.CORRUPT_STATE, "malformed block id at height " + height, e);
        }
    }

    /**
     * Set the id of the block at the given height of the current path.
     *
     * @param height the block height
     * @param blockId the block id
     */
    public void putBlockId(final long height, @NonNull final Hash blockId) {
        if (height < 0) {
            throw new IllegalArgumentException("height must not be negative");
        }
        put(PATH_PREFIX + height, Objects.requireNonNull(blockId).toHex());
    }

    /**
     * @return the height of the current path, -1 if the path is empty
     */
    public long height() {
        long height = -1;
        while (properties.containsKey(PATH_PREFIX + (height + 1))) {
            height++;
        }
        return height;
    }

    boolean isDirty() {
        return dirty;
    }

    private void put(final String key, final String value) {
        if (readOnly) {
            throw new IllegalStateException("cannot modify state in a read only view");
        }
        properties.setProperty(key, value);
        dirty = true;
    }
}
