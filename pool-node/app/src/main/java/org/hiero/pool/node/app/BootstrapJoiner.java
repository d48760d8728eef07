// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.hiero.pool.node.spi.NetworkModule;

/**
 * Joins the network by dialing a few bootstrap peers picked uniformly at random. Dials run in the background and are
 * never retried or awaited, the gateway learns further peers on its own.
 */
public final class BootstrapJoiner {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(BootstrapJoiner.class.getName());
    /** Number of peers dialed. */
    static final int DIAL_COUNT = 3;

    private final List<String> peers;
    private final Executor executor;
    private final Random random;

    /**
     * @param peers the bootstrap peer addresses
     * @param executor runs the dials
     * @param random the source of the permutation, a secure one in production
     */
    public BootstrapJoiner(
            @NonNull final List<String> peers, @NonNull final Executor executor, @NonNull final Random random) {
        this.peers = List.copyOf(peers);
        this.executor = Objects.requireNonNull(executor);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Submit dials to up to {@value #DIAL_COUNT} distinct random peers and return without waiting for them.
     *
     * @param network the gateway to dial through
     * @return the addresses dials were submitted for
     */
    @NonNull
    public List<String> join(@NonNull final NetworkModule network) {
        Objects.requireNonNull(network);
        final List<Integer> order =
                IntStream.range(0, peers.size()).boxed().collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(order, random);
        final List<String> chosen = order.stream()
                .limit(DIAL_COUNT)
                .map(peers::get)
                .toList();
        LOGGER.log(INFO, "Dialing bootstrap peers {0}", chosen);
        for (final String address : chosen) {
            try {
                executor.execute(() -> dial(network, address));
            } catch (RejectedExecutionException e) {
                LOGGER.log(DEBUG, "Bootstrap dial to " + address + " was not scheduled", e);
            }
        }
        return chosen;
    }

    private static void dial(final NetworkModule network, final String address) {
        try {
            network.connect(address);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(DEBUG, "Bootstrap dial to " + address + " failed", e);
        }
    }
}
