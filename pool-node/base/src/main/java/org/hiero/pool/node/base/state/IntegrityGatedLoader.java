// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.state;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.state.StateIntegrityException.Reason;

/**
 * Decides, when a module is constructed, whether its persisted state can be resumed or must be initialized fresh.
 *
 * <p>All checks run inside a single {@link StateStore#update} transaction:
 * <ol>
 *     <li>an uninitialized state is handed to the module's {@link StateInitializer} and then marked initialized</li>
 *     <li>a state flagged as inconsistent is rejected with {@link Reason#CORRUPT_STATE}</li>
 *     <li>the stored genesis block id (height 0) must equal the expected one byte for byte, otherwise
 *     {@link Reason#GENESIS_MISMATCH}. With a non strict check the mismatch is only logged.</li>
 * </ol>
 * Nothing is retried. Any failure closes the store and is thrown to the caller.
 */
public final class IntegrityGatedLoader {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(IntegrityGatedLoader.class.getName());
    /** The genesis block id the running binary expects. */
    private final Hash expectedGenesisId;
    /** If false a genesis mismatch is only logged. */
    private final boolean strictGenesisCheck;
    /** The owning module's fresh initialization routine. */
    private final StateInitializer initializer;

    /**
     * Create a new loader.
     *
     * @param expectedGenesisId the genesis block id the running binary expects
     * @param strictGenesisCheck true to reject a genesis mismatch, false to only log it
     * @param initializer the routine writing the initial state of a fresh store, including the genesis block id
     */
    public IntegrityGatedLoader(
            @NonNull final Hash expectedGenesisId,
            final boolean strictGenesisCheck,
            @NonNull final StateInitializer initializer) {
        this.expectedGenesisId = Objects.requireNonNull(expectedGenesisId);
        this.strictGenesisCheck = strictGenesisCheck;
        this.initializer = Objects.requireNonNull(initializer);
    }

    /**
     * Open the state in the given directory and validate or initialize it.
     *
     * @param directory the module's storage directory
     * @param fileName the state file name
     * @return the open store, owned by the caller from now on
     * @throws StateIntegrityException if the storage can not be used or the state fails a check
     */
    @NonNull
    public StateStore load(@NonNull final Path directory, @NonNull final String fileName)
            throws StateIntegrityException {
        final StateStore store = StateStore.open(directory, fileName);
        try {
            store.update(transaction -> {
                verifyOrInitialize(transaction);
                return null;
            });
            return store;
        } catch (StateIntegrityException e) {
            closeAfterFailure(store, e);
            throw e;
        } catch (IOException e) {
            final StateIntegrityException failure = new StateIntegrityException(
                    Reason.STORAGE_OPEN_FAILED, "could not read or write state at " + store.file(), e);
            closeAfterFailure(store, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfterFailure(store, e);
            throw e;
        }
    }

    private void verifyOrInitialize(final StateTransaction transaction) throws IOException {
        if (!transaction.isInitialized()) {
            LOGGER.log(INFO, "Initializing fresh state");
            initializer.initialize(transaction);
            transaction.markInitialized();
            return;
        }
        if (transaction.isInconsistencyDetected()) {
            throw new StateIntegrityException(Reason.CORRUPT_STATE, "state contains inconsistencies");
        }
        final Optional<Hash> storedGenesisId = transaction.blockIdAt(0);
        if (storedGenesisId.isEmpty()) {
            throw new StateIntegrityException(Reason.CORRUPT_STATE, "initialized state has no genesis block");
        }
        if (!storedGenesisId.get().equals(expectedGenesisId)) {
            final String message = "state has wrong genesis block, expected %s but found %s"
                    .formatted(expectedGenesisId, storedGenesisId.get());
            if (strictGenesisCheck) {
                throw new StateIntegrityException(Reason.GENESIS_MISMATCH, message);
            }
            LOGGER.log(WARNING, message);
        }
    }

    private static void closeAfterFailure(final StateStore store, final Exception failure) {
        try {
            store.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * A module's routine for writing the initial content of a fresh state.
     */
    @FunctionalInterface
    public interface StateInitializer {
        /**
         * Write the initial state, at least the genesis block id at height 0. The loader marks the state initialized
         * afterwards.
         *
         * @param transaction the open transaction
         * @throws IOException to abort initialization
         */
        void initialize(@NonNull StateTransaction transaction) throws IOException;
    }
}
