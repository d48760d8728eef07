// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.pool.node.base.Hash;

/**
 * An opaque pending transaction. Its encoding belongs to the chain and is not interpreted here.
 */
public final class Transaction {
    private final byte[] payload;
    private final Hash id;

    /**
     * @param payload the encoded transaction, copied
     */
    public Transaction(@NonNull final byte[] payload) {
        this.payload = Objects.requireNonNull(payload).clone();
        this.id = Hash.sha256(this.payload);
    }

    /**
     * @return the transaction id, the SHA-256 of the payload
     */
    @NonNull
    public Hash id() {
        return id;
    }

    /**
     * @return a copy of the encoded transaction
     */
    @NonNull
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * @return the size of the encoded transaction in bytes
     */
    public int size() {
        return payload.length;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Transaction other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Transaction[" + id + "]";
    }
}
