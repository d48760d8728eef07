// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.hiero.pool.node.spi.NetworkModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link BootstrapJoiner}.
 */
@DisplayName("BootstrapJoiner Tests")
class BootstrapJoinerTest {
    private static final List<String> PEERS =
            IntStream.range(0, 10).mapToObj(i -> "10.0.0." + i + ":9981").collect(Collectors.toList());

    private NetworkModule network;

    @BeforeEach
    void setUp() {
        network = mock(NetworkModule.class);
    }

    @Test
    @DisplayName("dials exactly three distinct peers from the list")
    void testDialsThreeDistinct() throws IOException {
        final List<String> chosen = new BootstrapJoiner(PEERS, Runnable::run, new SecureRandom()).join(network);
        assertThat(chosen).hasSize(3).doesNotHaveDuplicates().isSubsetOf(PEERS);
        for (String address : chosen) {
            verify(network).connect(address);
        }
    }

    @Test
    @DisplayName("with fewer peers than dials every peer is dialed once")
    void testFewPeers() {
        final List<String> peers = List.of("a:1", "b:2");
        assertThat(new BootstrapJoiner(peers, Runnable::run, new Random(1)).join(network))
                .containsExactlyInAnyOrderElementsOf(peers);
        assertThat(new BootstrapJoiner(List.of(), Runnable::run, new Random(1)).join(network))
                .isEmpty();
    }

    @Test
    @DisplayName("join only submits the dials and never waits for them")
    void testNonBlocking() {
        final List<Runnable> submitted = new ArrayList<>();
        final List<String> chosen = new BootstrapJoiner(PEERS, submitted::add, new Random(1)).join(network);
        assertThat(chosen).hasSize(3);
        assertThat(submitted).hasSize(3);
        verifyNoInteractions(network);
    }

    @Test
    @DisplayName("dial failures and rejected submissions are not surfaced")
    void testFailuresDiscarded() throws IOException {
        doThrow(new IOException("connection refused")).when(network).connect(PEERS.get(0));
        doThrow(new IOException("connection refused")).when(network).connect(PEERS.get(1));
        final List<String> all = List.of(PEERS.get(0), PEERS.get(1));
        assertThat(new BootstrapJoiner(all, Runnable::run, new Random(1)).join(network))
                .hasSize(2);
        assertThat(new BootstrapJoiner(
                                PEERS,
                                task -> {
                                    throw new RejectedExecutionException("shut down");
                                },
                                new Random(1))
                        .join(network))
                .hasSize(3);
    }

    @Test
    @DisplayName("every peer is chosen with the same probability")
    void testUniformSelection() {
        final int rounds = 30_000;
        final Random random = new Random(42);
        final Map<String, Integer> chosenCount = new HashMap<>();
        final Map<String, Integer> firstCount = new HashMap<>();
        for (int round = 0; round < rounds; round++) {
            final List<String> chosen = new BootstrapJoiner(PEERS, task -> {}, random).join(network);
            chosen.forEach(address -> chosenCount.merge(address, 1, Integer::sum));
            firstCount.merge(chosen.get(0), 1, Integer::sum);
        }
        final double expectedChosen = rounds * 3.0 / PEERS.size();
        final double expectedFirst = rounds * 1.0 / PEERS.size();
        assertThat(chosenCount).hasSize(PEERS.size());
        for (String peer : PEERS) {
            assertThat((double) chosenCount.get(peer)).isBetween(expectedChosen * 0.9, expectedChosen * 1.1);
            assertThat((double) firstCount.getOrDefault(peer, 0)).isBetween(expectedFirst * 0.85, expectedFirst * 1.15);
        }
    }
}
