// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.spi.threading.ThreadPoolManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link Gateway}.
 */
@DisplayName("Gateway Tests")
@Timeout(60)
class GatewayTest {
    private static final String LOOPBACK = "127.0.0.1";

    /** Storage directory for each test. */
    @TempDir
    private Path tempDir;
    /** Supplies accept threads. */
    private ThreadPoolManager threadPoolManager;
    /** Every gateway created by a test, stopped afterwards. */
    private final List<Gateway> gateways = new ArrayList<>();

    @BeforeEach
    void setUp() {
        threadPoolManager = mock(ThreadPoolManager.class);
        when(threadPoolManager.createSingleThreadExecutor(anyString()))
                .thenAnswer(invocation -> Executors.newSingleThreadExecutor());
        when(threadPoolManager.createThreadPerTaskExecutor(anyString()))
                .thenAnswer(invocation -> Executors.newCachedThreadPool());
    }

    @AfterEach
    void tearDown() {
        for (Gateway gateway : gateways) {
            if (!gateway.shutdownGroup().isStopped()) {
                try {
                    gateway.stop();
                } catch (AlreadyStoppedException e) {
                    throw new IllegalStateException(e);
                }
            }
        }
    }

    private Gateway newGateway(final String directory, final GatewayConfig config) throws IOException {
        final Gateway gateway = new Gateway(
                config, BuildRelease.TESTING, LOOPBACK + ":0", tempDir.resolve(directory), threadPoolManager);
        gateways.add(gateway);
        return gateway;
    }

    private Gateway newGateway(final String directory) throws IOException {
        return newGateway(directory, new GatewayConfig(0, 0, true));
    }

    private static String addressOf(final Gateway gateway) {
        return LOOPBACK + ":" + gateway.address().getPort();
    }

    private static void awaitPeers(final Gateway gateway, final int count) throws InterruptedException {
        while (gateway.peers().size() < count) {
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("Construction Tests")
    final class ConstructionTests {
        @Test
        @DisplayName("binds an ephemeral port and creates its storage directory")
        void testBind() throws IOException {
            final Gateway gateway = newGateway("gateway");
            assertThat(gateway.address().getPort()).isPositive();
            assertThat(gateway.name()).isEqualTo("gateway");
            assertThat(tempDir.resolve("gateway")).isDirectory();
            assertThat(gateway.peers()).isEmpty();
        }

        @Test
        @DisplayName("an invalid listen address fails construction")
        void testInvalidAddress() {
            assertThatThrownBy(() -> new Gateway(
                            new GatewayConfig(0, 0, true),
                            BuildRelease.TESTING,
                            "no-port",
                            tempDir.resolve("gateway"),
                            threadPoolManager))
                    .isInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("an unreadable node list fails construction")
        void testCorruptNodeList() throws IOException {
            final Path directory = tempDir.resolve("gateway");
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(Gateway.NODE_LIST_FILE), "{not a list");
            assertThatThrownBy(() -> newGateway("gateway"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("node list");
        }
    }

    @Nested
    @DisplayName("Connection Tests")
    final class ConnectionTests {
        @Test
        @DisplayName("connects to another gateway, both sides see a peer")
        void testConnect() throws Exception {
            final Gateway first = newGateway("first");
            final Gateway second = newGateway("second");
            first.connect(addressOf(second));
            assertThat(first.peers()).containsExactly(addressOf(second));
            awaitPeers(second, 1);
            assertThat(second.peers()).hasSize(1);
            assertThat(first.knownNodes()).contains(addressOf(second));
        }

        @Test
        @DisplayName("duplicate dials and dials to itself are refused")
        void testRefusedDials() throws IOException {
            final Gateway first = newGateway("first");
            final Gateway second = newGateway("second");
            first.connect(addressOf(second));
            assertThatThrownBy(() -> first.connect(addressOf(second)))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("already connected");
            assertThatThrownBy(() -> first.connect(addressOf(first)))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("own address");
        }

        @Test
        @DisplayName("dials beyond the peer limit are refused")
        void testPeerLimit() throws IOException {
            final Gateway first = newGateway("first", new GatewayConfig(0, 1, true));
            final Gateway second = newGateway("second");
            final Gateway third = newGateway("third");
            first.connect(addressOf(second));
            assertThatThrownBy(() -> first.connect(addressOf(third)))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("peer limit");
        }

        @Test
        @DisplayName("a failed dial is reported and leaves no peer behind")
        void testFailedDial() throws IOException {
            final Gateway first = newGateway("first");
            final Gateway stopped = newGateway("stopped");
            final String deadAddress = addressOf(stopped);
            try {
                stopped.stop();
            } catch (AlreadyStoppedException e) {
                throw new IllegalStateException(e);
            }
            assertThatThrownBy(() -> first.connect(deadAddress)).isInstanceOf(IOException.class);
            assertThat(first.peers()).isEmpty();
            assertThat(first.knownNodes()).doesNotContain(deadAddress);
        }

        @Test
        @DisplayName("a peer whose remote end closes frees its slot")
        void testPeerSlotFreed() throws Exception {
            final Gateway first = newGateway("first", new GatewayConfig(0, 1, true));
            final Gateway second = newGateway("second");
            final Gateway third = newGateway("third");
            first.connect(addressOf(second));
            second.stop();
            while (!first.peers().isEmpty()) {
                Thread.sleep(10);
            }
            first.connect(addressOf(third));
            assertThat(first.peers()).containsExactly(addressOf(third));
        }

        @Test
        @DisplayName("concurrent dials never exceed the peer limit")
        void testConcurrentDialsRespectLimit() throws Exception {
            final Gateway first = newGateway("first", new GatewayConfig(0, 2, true));
            final List<String> targets = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                targets.add(addressOf(newGateway("target-" + i)));
            }
            final ExecutorService dialers = Executors.newFixedThreadPool(targets.size());
            try {
                final List<Future<?>> dials = new ArrayList<>();
                for (String target : targets) {
                    dials.add(dialers.submit(() -> {
                        first.connect(target);
                        return null;
                    }));
                }
                int succeeded = 0;
                for (Future<?> dial : dials) {
                    try {
                        dial.get();
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).hasMessageContaining("peer limit");
                    }
                }
                assertThat(succeeded).isEqualTo(2);
                assertThat(first.peers()).hasSize(2);
            } finally {
                dialers.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Stop Tests")
    final class StopTests {
        @Test
        @DisplayName("a stopped gateway refuses dials and closes its listener and peers")
        void testStop() throws Exception {
            final Gateway first = newGateway("first");
            final Gateway second = newGateway("second");
            first.connect(addressOf(second));
            final InetSocketAddress listenAddress = first.address();
            first.stop();
            assertThat(first.shutdownGroup().activeCount()).isZero();
            assertThat(first.peers()).isEmpty();
            assertThatThrownBy(() -> first.connect(addressOf(second)))
                    .isInstanceOf(IOException.class)
                    .hasCauseInstanceOf(AlreadyStoppedException.class);
            assertThatThrownBy(() -> {
                        try (Socket socket = new Socket()) {
                            socket.connect(listenAddress, 1_000);
                        }
                    })
                    .isInstanceOf(IOException.class);
            assertThatThrownBy(first::stop).isInstanceOf(AlreadyStoppedException.class);
        }

        @Test
        @DisplayName("stopping ends a dial that is still connecting well before the dial timeout")
        void testStopDuringDial() throws Exception {
            final Gateway gateway = newGateway("gateway", new GatewayConfig(30_000, 0, true));
            final List<Socket> backlogFillers = new ArrayList<>();
            final ExecutorService dialer = Executors.newSingleThreadExecutor();
            try (ServerSocket unresponsive = new ServerSocket(0, 1, InetAddress.getByName(LOOPBACK))) {
                // never accepts, once its backlog is full further connects hang
                boolean backlogFull = false;
                for (int i = 0; i < 16 && !backlogFull; i++) {
                    final Socket socket = new Socket();
                    backlogFillers.add(socket);
                    try {
                        socket.connect(unresponsive.getLocalSocketAddress(), 300);
                    } catch (SocketTimeoutException e) {
                        backlogFull = true;
                    }
                }
                assumeTrue(backlogFull, "listen backlog could not be filled");
                final String target = LOOPBACK + ":" + unresponsive.getLocalPort();
                final Future<?> dial = dialer.submit(() -> {
                    gateway.connect(target);
                    return null;
                });
                // the accept loop and the dial
                while (gateway.shutdownGroup().activeCount() < 2) {
                    Thread.sleep(10);
                }
                Thread.sleep(100);
                final long start = System.nanoTime();
                gateway.stop();
                assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                        .isLessThan(5_000);
                assertThatThrownBy(dial::get)
                        .isInstanceOf(ExecutionException.class)
                        .hasCauseInstanceOf(IOException.class)
                        .hasMessageContaining("stopped");
                assertThat(gateway.peers()).isEmpty();
            } finally {
                dialer.shutdownNow();
                for (Socket socket : backlogFillers) {
                    socket.close();
                }
            }
        }

        @Test
        @DisplayName("the known node list survives a restart")
        void testNodeListPersisted() throws Exception {
            final Gateway first = newGateway("first");
            final Gateway second = newGateway("second");
            final String secondAddress = addressOf(second);
            first.connect(secondAddress);
            first.stop();
            assertThat(tempDir.resolve("first").resolve(Gateway.NODE_LIST_FILE)).exists();
            final Gateway restarted = newGateway("first");
            assertThat(restarted.knownNodes()).containsExactly(secondAddress);
        }

        @Test
        @DisplayName("the node list is not written when persistence is off")
        void testNodeListNotPersisted() throws Exception {
            final Gateway first = newGateway("first", new GatewayConfig(0, 0, false));
            final Gateway second = newGateway("second");
            first.connect(addressOf(second));
            first.stop();
            assertThat(tempDir.resolve("first").resolve(Gateway.NODE_LIST_FILE)).doesNotExist();
        }
    }

    @Test
    @DisplayName("configured limits override the release defaults")
    void testConfigDefaults() {
        assertThat(new GatewayConfig(0, 0, true).maxPeers(BuildRelease.STANDARD)).isEqualTo(128);
        assertThat(new GatewayConfig(0, 5, true).maxPeers(BuildRelease.STANDARD)).isEqualTo(5);
        assertThat(new GatewayConfig(250, 0, true).dialTimeout(BuildRelease.STANDARD).toMillis())
                .isEqualTo(250);
        assertThat(new GatewayConfig(0, 0, true).dialTimeout(BuildRelease.DEV).toSeconds())
                .isEqualTo(20);
    }
}
