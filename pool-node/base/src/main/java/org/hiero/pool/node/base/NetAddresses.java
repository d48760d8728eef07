// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Parsing of the {@code host:port} address strings used in configuration and peer lists. An empty host, as in
 * {@code :9981}, means all local interfaces. IPv6 hosts are written in brackets, {@code [::1]:9981}.
 */
public final class NetAddresses {
    private NetAddresses() {}

    /**
     * Parse and resolve an address.
     *
     * @param address the address string
     * @return the socket address, the wildcard address if the host is empty
     * @throws IllegalArgumentException if the string is not a valid address
     */
    @NonNull
    public static InetSocketAddress parse(@NonNull final String address) {
        Objects.requireNonNull(address);
        final int separator = address.lastIndexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException("address '" + address + "' has no port");
        }
        String host = address.substring(0, separator).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        final int port;
        try {
            port = Integer.parseInt(address.substring(separator + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("address '" + address + "' has an invalid port", e);
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("address '" + address + "' has a port out of range");
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    /**
     * Format a socket address back into {@code host:port} form.
     *
     * @param address the socket address
     * @return the address string
     */
    @NonNull
    public static String format(@NonNull final InetSocketAddress address) {
        final String host = address.getHostString();
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + address.getPort();
    }
}
