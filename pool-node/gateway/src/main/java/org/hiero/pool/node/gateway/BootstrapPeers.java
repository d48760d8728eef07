// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.gateway;

import java.util.List;

/**
 * Well known peers used only to join the network on first contact. After that the gateway learns peers from the
 * network itself.
 */
public final class BootstrapPeers {
    /** The bootstrap peer addresses, read only. */
    public static final List<String> ADDRESSES = List.of(
            "101.200.214.115:9981",
            "109.172.42.157:9981",
            "109.206.33.225:9981",
            "109.71.42.163:9981",
            "109.71.42.164:9981",
            "113.98.98.164:9981",
            "115.28.187.2:9981",
            "120.25.198.251:9981",
            "138.201.12.100:9981",
            "139.162.152.204:9981",
            "141.105.11.208:9981",
            "162.211.163.189:9981",
            "176.9.72.2:9981",
            "178.63.11.62:9981",
            "188.166.61.155:9981",
            "213.251.158.199:9981");

    private BootstrapPeers() {}
}
