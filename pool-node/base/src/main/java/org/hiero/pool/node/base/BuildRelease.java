// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base;

import java.time.Duration;

/**
 * The release flavor the node runs as. It selects network timing constants and whether state integrity checks are
 * mandatory. Only {@link #STANDARD} is meant for production.
 */
public enum BuildRelease {
    /** Developer builds, short timeouts and advisory genesis checks. */
    DEV(Duration.ofSeconds(20), 20, false),
    /** Production builds. */
    STANDARD(Duration.ofMinutes(2), 128, true),
    /** Automated test builds, very short timeouts and small peer limits. */
    TESTING(Duration.ofMillis(500), 10, false);

    private final Duration dialTimeout;
    private final int maxPeers;
    private final boolean strictGenesisCheck;

    BuildRelease(final Duration dialTimeout, final int maxPeers, final boolean strictGenesisCheck) {
        this.dialTimeout = dialTimeout;
        this.maxPeers = maxPeers;
        this.strictGenesisCheck = strictGenesisCheck;
    }

    /**
     * @return how long the gateway waits for an outbound connection before giving up
     */
    public Duration dialTimeout() {
        return dialTimeout;
    }

    /**
     * @return the number of peers at which the gateway stops accepting and dialing connections
     */
    public int maxPeers() {
        return maxPeers;
    }

    /**
     * @return true if a genesis mismatch in persisted state is fatal, false if it is only logged
     */
    public boolean strictGenesisCheck() {
        return strictGenesisCheck;
    }
}
