package io.sessionkeeper.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Durable JSON documents in one directory, addressed through an index file.
 *
 * <p>The index ({@code <indexName>.json}) maps each logical key to the name of the document file
 * that holds its value. Documents and the index are written to a temp file and moved into place so a crash
 * never leaves a half-written file behind. The index is rewritten wholesale on each mutation.
 */
public final class KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueStore.class);
    private static final TypeReference<LinkedHashMap<String, String>> INDEX_TYPE = new TypeReference<>() {
    };

    private final Path dir;
    private final Path indexFile;
    private final Function<String, String> fileNamer;
    private final LinkedHashMap<String, String> index;

    public KeyValueStore(Path dir, String indexName, Function<String, String> fileNamer) {
        this.dir = dir;
        this.indexFile = dir.resolve(indexName + ".json");
        this.fileNamer = fileNamer;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize store directory: " + dir, e);
        }
        this.index = loadIndex();
    }

    public synchronized Optional<JsonNode> get(String key) throws IOException {
        String location = index.get(key);
        if (location == null) {
            return Optional.empty();
        }
        Path file = resolve(location);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(Jsons.mapper().readTree(file.toFile()));
    }

    /**
     * Writes the document and records it in the index.
     *
     * @return the file that now holds the value
     */
    public Path put(String key, JsonNode value) throws IOException {
        Path file = dir.resolve(fileNamer.apply(key) + ".json");
        // document I/O happens outside the index monitor; only the index swap is serialized
        writeAtomically(file, Jsons.toJson(value));
        synchronized (this) {
            index.put(key, file.getFileName().toString());
            saveIndex();
        }
        return file;
    }

    /**
     * Like {@link #put} but leaves an existing key untouched.
     *
     * @return true when the value was written
     */
    public synchronized boolean putIfAbsent(String key, JsonNode value) throws IOException {
        if (index.containsKey(key)) {
            return false;
        }
        Path file = dir.resolve(fileNamer.apply(key) + ".json");
        writeAtomically(file, Jsons.toJson(value));
        index.put(key, file.getFileName().toString());
        saveIndex();
        return true;
    }

    public synchronized boolean remove(String key) throws IOException {
        String location = index.remove(key);
        if (location == null) {
            return false;
        }
        Files.deleteIfExists(resolve(location));
        saveIndex();
        return true;
    }

    public synchronized boolean containsKey(String key) {
        return index.containsKey(key);
    }

    public synchronized List<String> keys() {
        return new ArrayList<>(index.keySet());
    }

    public synchronized int size() {
        return index.size();
    }

    /**
     * Snapshot of the index, key to document file name.
     */
    public synchronized Map<String, String> indexSnapshot() {
        return new LinkedHashMap<>(index);
    }

    /**
     * Documents are looked up by file name inside this store's directory, so the storage root can
     * be moved. Older indexes recorded absolute paths; only their file name is used.
     */
    private Path resolve(String location) {
        Path name = Path.of(location).getFileName();
        return name == null ? dir.resolve(location) : dir.resolve(name.toString());
    }

    private LinkedHashMap<String, String> loadIndex() {
        if (!Files.exists(indexFile)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, String> loaded = Jsons.mapper().readValue(indexFile.toFile(), INDEX_TYPE);
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException e) {
            log.warn("Could not load index {}, starting empty: {}", indexFile, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void saveIndex() throws IOException {
        writeAtomically(indexFile, Jsons.toJson(new LinkedHashMap<>(index)));
    }

    public static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ignored) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
