// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.nio.file.Path;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.state.StateIntegrityException;
import org.hiero.pool.node.base.state.StateIntegrityException.Reason;
import org.hiero.pool.node.base.state.StateStore;
import org.hiero.pool.node.spi.NetworkModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConsensusSet}.
 */
@DisplayName("ConsensusSet Tests")
class ConsensusSetTest {
    /** Storage directory for each test. */
    @TempDir
    private Path tempDir;
    /** The gateway the consensus set is built on. */
    private NetworkModule gateway;

    @BeforeEach
    void setUp() {
        gateway = mock(NetworkModule.class);
    }

    private void writeGenesis(final Hash genesis) throws IOException {
        try (StateStore store = StateStore.open(tempDir, ConsensusSet.STATE_FILE)) {
            store.update(tx -> {
                tx.putBlockId(0, genesis);
                tx.markInitialized();
                return null;
            });
        }
    }

    @Test
    @DisplayName("a fresh consensus set starts at the genesis block")
    void testFresh() throws IOException, AlreadyStoppedException {
        final ConsensusSet consensusSet = new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD);
        assertThat(consensusSet.name()).isEqualTo("consensus");
        assertThat(consensusSet.genesisId()).isEqualTo(GenesisBlock.ID);
        assertThat(consensusSet.height()).isZero();
        assertThat(consensusSet.blockIdAt(0)).contains(GenesisBlock.ID);
        assertThat(consensusSet.blockIdAt(1)).isEmpty();
        assertThat(consensusSet.blockIdAt(-1)).isEmpty();
        assertThat(consensusSet.gateway()).isSameAs(gateway);
        consensusSet.stop();
    }

    @Test
    @DisplayName("a null gateway is rejected")
    void testNullGateway() {
        assertThatThrownBy(() -> new ConsensusSet(null, tempDir, BuildRelease.STANDARD))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("stopping releases the state for the next owner and refuses reads")
    void testStop() throws IOException, AlreadyStoppedException {
        final ConsensusSet consensusSet = new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD);
        consensusSet.stop();
        assertThatThrownBy(consensusSet::height)
                .isInstanceOf(IOException.class)
                .hasCauseInstanceOf(AlreadyStoppedException.class);
        final ConsensusSet reopened = new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD);
        assertThat(reopened.height()).isZero();
        reopened.stop();
    }

    @Test
    @DisplayName("state of another chain is rejected by a standard release")
    void testGenesisMismatchStandard() throws IOException {
        writeGenesis(Hash.sha256("another chain"));
        assertThatThrownBy(() -> new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD))
                .isInstanceOf(StateIntegrityException.class)
                .extracting(e -> ((StateIntegrityException) e).reason())
                .isEqualTo(Reason.GENESIS_MISMATCH);
    }

    @Test
    @DisplayName("state of another chain is accepted with a warning by a dev release")
    void testGenesisMismatchDev() throws IOException, AlreadyStoppedException {
        final Hash otherGenesis = Hash.sha256("another chain");
        writeGenesis(otherGenesis);
        final ConsensusSet consensusSet = new ConsensusSet(gateway, tempDir, BuildRelease.DEV);
        assertThat(consensusSet.blockIdAt(0)).contains(otherGenesis);
        consensusSet.stop();
    }

    @Test
    @DisplayName("a second consensus set on the same directory fails while the first is open")
    void testExclusive() throws IOException, AlreadyStoppedException {
        final ConsensusSet first = new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD);
        assertThatThrownBy(() -> new ConsensusSet(gateway, tempDir, BuildRelease.STANDARD))
                .isInstanceOf(StateIntegrityException.class)
                .extracting(e -> ((StateIntegrityException) e).reason())
                .isEqualTo(Reason.STORAGE_OPEN_FAILED);
        first.stop();
    }
}
