// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.gateway;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;
import java.time.Duration;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.config.Loggable;

/**
 * Use this configuration across the gateway.
 *
 * @param dialTimeoutMillis how long to wait for an outbound connection, 0 to use the release default
 * @param maxPeers the number of peers at which no more connections are accepted or dialed, 0 to use the release
 *     default
 * @param persistNodeList whether the list of known nodes is saved on shutdown
 */
@ConfigData("gateway")
public record GatewayConfig(
        @Loggable @ConfigProperty(defaultValue = "0") @Min(0) int dialTimeoutMillis,
        @Loggable @ConfigProperty(defaultValue = "0") @Min(0) @Max(10_000) int maxPeers,
        @Loggable @ConfigProperty(defaultValue = "true") boolean persistNodeList) {

    /**
     * @param release the release the node runs as
     * @return the effective dial timeout
     */
    public Duration dialTimeout(final BuildRelease release) {
        return dialTimeoutMillis == 0 ? release.dialTimeout() : Duration.ofMillis(dialTimeoutMillis);
    }

    /**
     * @param release the release the node runs as
     * @return the effective peer limit
     */
    public int maxPeers(final BuildRelease release) {
        return maxPeers == 0 ? release.maxPeers() : maxPeers;
    }
}
