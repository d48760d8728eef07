// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.gateway;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The set of node addresses the gateway knows about, persisted as a JSON array in the gateway's storage directory.
 */
final class NodeListFile {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path file;
    private final Set<String> nodes = ConcurrentHashMap.newKeySet();

    private NodeListFile(final Path file) {
        this.file = file;
    }

    /**
     * Load the node list, a missing file is an empty list.
     *
     * @param file the JSON file
     * @return the loaded list
     * @throws IOException if the file exists but can not be read or parsed
     */
    static NodeListFile load(@NonNull final Path file) throws IOException {
        final NodeListFile nodeList = new NodeListFile(file);
        if (Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                final String[] addresses = GSON.fromJson(reader, String[].class);
                if (addresses != null) {
                    nodeList.nodes.addAll(Arrays.asList(addresses));
                }
            } catch (JsonParseException e) {
                throw new IOException("node list " + file + " is not valid JSON", e);
            }
        }
        return nodeList;
    }

    void add(@NonNull final String address) {
        nodes.add(address);
    }

    @NonNull
    Set<String> nodes() {
        return Set.copyOf(nodes);
    }

    /**
     * Write the list, sorted, replacing the previous file atomically.
     *
     * @throws IOException if the file can not be written
     */
    void save() throws IOException {
        final Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
            GSON.toJson(new TreeSet<>(nodes), writer);
        }
        Files.move(tempFile, file, ATOMIC_MOVE, REPLACE_EXISTING);
    }
}
