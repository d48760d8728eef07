// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.consensus;

import org.hiero.pool.node.base.Hash;

/**
 * The genesis block this binary was built for. Persisted chain state whose block at height 0 has a different id
 * belongs to another chain.
 */
public final class GenesisBlock {
    /** The canonical encoding the genesis id is derived from. */
    static final String DESCRIPTOR = "pool-node genesis v1|timestamp=1433600000|target=0000000020000000|outputs=none";

    /** The id of the genesis block. */
    public static final Hash ID = Hash.sha256(DESCRIPTOR);

    private GenesisBlock() {}
}
