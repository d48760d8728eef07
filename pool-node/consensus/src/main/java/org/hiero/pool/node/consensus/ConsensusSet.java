// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.consensus;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;
import org.hiero.pool.node.base.state.IntegrityGatedLoader;
import org.hiero.pool.node.base.state.StateStore;
import org.hiero.pool.node.spi.ChainStateModule;
import org.hiero.pool.node.spi.NetworkModule;

/**
 * The chain-state module. Its state lives in {@code consensus.db} and is only usable once the
 * {@link IntegrityGatedLoader} has validated it, or initialized it with the {@link GenesisBlock} when fresh.
 */
public final class ConsensusSet implements ChainStateModule {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ConsensusSet.class.getName());
    /** State file name inside the module directory. */
    public static final String STATE_FILE = "consensus.db";

    private final ShutdownGroup shutdownGroup = new ShutdownGroup("consensus");
    private final NetworkModule gateway;
    private final StateStore store;

    /**
     * Load or initialize the chain state.
     *
     * @param gateway the network module, must not be null
     * @param storageDirectory the module directory
     * @param release selects whether a genesis mismatch is fatal
     * @throws IOException if the state can not be opened or fails an integrity check
     */
    public ConsensusSet(
            @NonNull final NetworkModule gateway,
            @NonNull final Path storageDirectory,
            @NonNull final BuildRelease release)
            throws IOException {
        this.gateway = Objects.requireNonNull(gateway, "consensus set requires a gateway");
        Objects.requireNonNull(storageDirectory);
        final IntegrityGatedLoader loader = new IntegrityGatedLoader(
                GenesisBlock.ID, release.strictGenesisCheck(), tx -> tx.putBlockId(0, GenesisBlock.ID));
        this.store = loader.load(storageDirectory, STATE_FILE);
        try {
            final long height = height();
            LOGGER.log(INFO, "Consensus set loaded from {0} at height {1}", store.file(), height);
        } catch (IOException | RuntimeException e) {
            try {
                store.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        shutdownGroup.onStop(this::closeStore);
    }

    @NonNull
    @Override
    public String name() {
        return "consensus";
    }

    @NonNull
    @Override
    public ShutdownGroup shutdownGroup() {
        return shutdownGroup;
    }

    @NonNull
    @Override
    public Hash genesisId() {
        return GenesisBlock.ID;
    }

    @Override
    public long height() throws IOException {
        try (ShutdownGroup.Token ignored = shutdownGroup.acquire()) {
            return store.view(tx -> tx.height());
        } catch (AlreadyStoppedException e) {
            throw new IOException("consensus set is stopped", e);
        }
    }

    @NonNull
    @Override
    public Optional<Hash> blockIdAt(final long height) throws IOException {
        if (height < 0) {
            return Optional.empty();
        }
        try (ShutdownGroup.Token ignored = shutdownGroup.acquire()) {
            return store.view(tx -> tx.blockIdAt(height));
        } catch (AlreadyStoppedException e) {
            throw new IOException("consensus set is stopped", e);
        }
    }

    /**
     * @return the gateway this consensus set was built on
     */
    @NonNull
    NetworkModule gateway() {
        return gateway;
    }

    private void closeStore() {
        try {
            store.close();
            LOGGER.log(DEBUG, "Consensus state closed");
        } catch (IOException e) {
            LOGGER.log(WARNING, "Failed to close consensus state " + store.file(), e);
        }
    }
}
