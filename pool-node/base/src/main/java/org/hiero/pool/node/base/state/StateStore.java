// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.base.state;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import org.hiero.pool.node.base.state.StateIntegrityException.Reason;

/**
 * A small transactional key value store kept in one properties file. Each {@link #update} reads the file, applies the
 * changes in memory and, if anything changed, writes a temporary file and atomically moves it over the original. An
 * update that throws leaves the file untouched.
 *
 * <p>The store holds an exclusive lock on a sibling lock file while it is open, so two processes (or two stores in the
 * same process) can never own the same state.
 */
public final class StateStore implements Closeable {
    /** The state file. */
    private final Path file;
    /** Temporary file used while committing. */
    private final Path tempFile;
    /** Channel holding {@link #lock}. */
    private final FileChannel lockChannel;
    /** Exclusive ownership of the state directory. */
    private final FileLock lock;
    /** Set once closed. Guarded by this. */
    private boolean closed = false;

    private StateStore(final Path file, final FileChannel lockChannel, final FileLock lock) {
        this.file = file;
        this.tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        this.lockChannel = lockChannel;
        this.lock = lock;
    }

    /**
     * Open the store in the given directory, creating the directory if needed. A missing state file is an empty,
     * uninitialized state.
     *
     * @param directory the module's storage directory
     * @param fileName the state file name inside the directory
     * @return the open store
     * @throws StateIntegrityException with {@link Reason#STORAGE_OPEN_FAILED} if the directory can not be created or
     *     the state is already open elsewhere
     */
    @NonNull
    public static StateStore open(@NonNull final Path directory, @NonNull final String fileName)
            throws StateIntegrityException {
        Objects.requireNonNull(directory);
        Objects.requireNonNull(fileName);
        final Path file = directory.resolve(fileName);
        final FileChannel channel;
        try {
            Files.createDirectories(directory);
            channel = FileChannel.open(directory.resolve(fileName + ".lock"), CREATE, WRITE);
        } catch (IOException e) {
            throw new StateIntegrityException(Reason.STORAGE_OPEN_FAILED, "could not open state at " + file, e);
        }
        FileLock lock = null;
        Exception failure = null;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException | IOException e) {
            // OverlappingFileLockException means this process already holds it
            failure = e;
        }
        if (lock == null) {
            final StateIntegrityException exception = new StateIntegrityException(
                    Reason.STORAGE_OPEN_FAILED, "state at " + file + " is in use by another owner", failure);
            try {
                channel.close();
            } catch (IOException e) {
                exception.addSuppressed(e);
            }
            throw exception;
        }
        return new StateStore(file, channel, lock);
    }

    /**
     * @return the state file path
     */
    @NonNull
    public Path file() {
        return file;
    }

    /**
     * Run a read/write transaction. The changes are committed only if {@code update} returns normally.
     *
     * @param update the transaction body
     * @param <T> the result type
     * @return the value returned by {@code update}
     * @throws IOException if the body fails or the state can not be read or written
     */
    public synchronized <T> T update(@NonNull final StateUpdate<T> update) throws IOException {
        ensureOpen();
        final Properties properties = read();
        final StateTransaction transaction = new StateTransaction(properties, false);
        final T result = update.apply(transaction);
        if (transaction.isDirty()) {
            write(properties);
        }
        return result;
    }

    /**
     * Run a read only transaction.
     *
     * @param view the transaction body, any attempt to modify the state fails
     * @param <T> the result type
     * @return the value returned by {@code view}
     * @throws IOException if the body fails or the state can not be read
     */
    public synchronized <T> T view(@NonNull final StateUpdate<T> view) throws IOException {
        ensureOpen();
        return view.apply(new StateTransaction(read(), true));
    }

    /**
     * Release the lock on the state. Further transactions fail. Closing twice has no effect.
     *
     * @throws IOException if the lock can not be released
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            lock.release();
        } finally {
            lockChannel.close();
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("state store " + file + " is closed");
        }
    }

    private Properties read() throws IOException {
        final Properties properties = new Properties();
        if (Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IllegalArgumentException e) {
                throw new StateIntegrityException(Reason.CORRUPT_STATE, "could not parse state file " + file, e);
            }
        }
        return properties;
    }

    private void write(final Properties properties) throws IOException {
        try (FileChannel channel = FileChannel.open(tempFile, CREATE, WRITE, TRUNCATE_EXISTING)) {
            final OutputStream out = Channels.newOutputStream(channel);
            properties.store(out, "pool node module state");
            out.flush();
            channel.force(true);
        }
        Files.move(tempFile, file, ATOMIC_MOVE, REPLACE_EXISTING);
    }

    /**
     * The body of a state transaction.
     *
     * @param <T> the result type
     */
    @FunctionalInterface
    public interface StateUpdate<T> {
        /**
         * Apply the transaction.
         *
         * @param transaction the state view
         * @return any result
         * @throws IOException to abort the transaction
         */
        T apply(@NonNull StateTransaction transaction) throws IOException;
    }
}
