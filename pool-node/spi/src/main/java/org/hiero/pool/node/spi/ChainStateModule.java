// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.hiero.pool.node.base.Hash;

/**
 * The chain-state layer, called the consensus set. It only becomes available once its persisted state has passed the
 * integrity checks.
 */
public interface ChainStateModule extends PoolNodeModule {
    /**
     * @return the id of the genesis block of the chain
     */
    @NonNull
    Hash genesisId();

    /**
     * @return the height of the current path, 0 when only the genesis block is known
     * @throws IOException if the state can not be read or the module is stopped
     */
    long height() throws IOException;

    /**
     * @param height a block height
     * @return the id of the block at that height of the current path, empty if the path is shorter
     * @throws IOException if the state can not be read or the module is stopped
     */
    @NonNull
    Optional<Hash> blockIdAt(long height) throws IOException;

    /**
     * Creates the chain-state module, after the network module.
     */
    @FunctionalInterface
    interface Factory {
        /**
         * @param network the network module
         * @param storageDirectory the directory the module keeps its persisted state in
         * @return the new module with validated state
         * @throws IOException if the module can not be constructed, including failed integrity checks
         */
        @NonNull
        ChainStateModule create(@NonNull NetworkModule network, @NonNull Path storageDirectory) throws IOException;
    }
}
