// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A 32 byte SHA-256 digest. Used for the genesis identity, block ids and transaction ids. Instances are immutable and
 * compare by value.
 */
public final class Hash {
    /** Length of a hash in bytes. */
    public static final int LENGTH = 32;
    /** The hex formatter, lower case without delimiters. */
    private static final HexFormat HEX = HexFormat.of();
    /** The digest bytes, never exposed directly. */
    private final byte[] bytes;

    private Hash(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap a copy of the given digest bytes.
     *
     * @param bytes exactly {@link #LENGTH} bytes
     * @return the hash
     * @throws IllegalArgumentException if the length is wrong
     */
    @NonNull
    public static Hash wrap(@NonNull final byte[] bytes) {
        Objects.requireNonNull(bytes);
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("hash must be %d bytes, was %d".formatted(LENGTH, bytes.length));
        }
        return new Hash(bytes.clone());
    }

    /**
     * Parse a hash from its hex form.
     *
     * @param hex 64 hex characters
     * @return the hash
     * @throws IllegalArgumentException if the string is not a valid hash
     */
    @NonNull
    public static Hash fromHex(@NonNull final String hex) {
        return wrap(HEX.parseHex(Objects.requireNonNull(hex)));
    }

    /**
     * Compute the SHA-256 digest of the given data.
     *
     * @param data the data to digest
     * @return the digest
     */
    @NonNull
    public static Hash sha256(@NonNull final byte[] data) {
        try {
            return new Hash(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            // every JVM is required to support SHA-256
            throw new IllegalStateException(e);
        }
    }

    /**
     * Compute the SHA-256 digest of the UTF-8 bytes of the given string.
     *
     * @param data the string to digest
     * @return the digest
     */
    @NonNull
    public static Hash sha256(@NonNull final String data) {
        return sha256(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return a copy of the digest bytes
     */
    @NonNull
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * @return the lower case hex form
     */
    @NonNull
    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Hash other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
