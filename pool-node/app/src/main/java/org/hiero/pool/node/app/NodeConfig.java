// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;
import java.nio.file.Path;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.config.Loggable;

/**
 * Use this configuration for node-wide settings.
 *
 * @param dataRootPath the directory holding one storage directory per module
 * @param rpcAddress the address the gateway listens on for peers
 * @param apiAddress the address the HTTP API is served on
 * @param agentId the string API clients must send in their user agent, not logged
 * @param release the release the node runs as
 * @param poolFee the pool fee in units of 0.01%, 200 is 2%
 */
@ConfigData("node")
public record NodeConfig(
        @Loggable @ConfigProperty(defaultValue = "data") Path dataRootPath,
        @Loggable @ConfigProperty(defaultValue = ":9981") String rpcAddress,
        @Loggable @ConfigProperty(defaultValue = "localhost:9980") String apiAddress,
        @ConfigProperty(defaultValue = "Pool-Agent") String agentId,
        @Loggable @ConfigProperty(defaultValue = "STANDARD") BuildRelease release,
        @Loggable @ConfigProperty(defaultValue = "200") @Min(0) @Max(10_000) int poolFee) {}
