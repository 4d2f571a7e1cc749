package com.mailexchange.dedup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File backed dedup store.
 *
 * <p>The file holds one message identifier per line and is only ever appended to.
 * <p>The whole file is loaded into memory on construction.
 * <br>Each {@link #markProcessed(String)} records the identifier in memory first, then appends it
 * with {@code DSYNC}. A failed append is thrown, but the identifier stays known in memory
 * so the running process never handles that message again.
 *
 * <p>Writers are serialized on this instance, readers are lock free.
 */
public class FileDedupStore implements DedupStore {
    private static final Logger log = LogManager.getLogger(FileDedupStore.class);

    /**
     * Default file name inside the data directory.
     */
    public static final String FILE_NAME = ".forwarded-ids";

    private final Path file;
    private final Set<String> processed = ConcurrentHashMap.newKeySet();

    /**
     * Constructs a new FileDedupStore instance and loads existing entries.
     *
     * @param file Dedup record path.
     * @throws IOException Unable to read an existing file.
     */
    public FileDedupStore(Path file) throws IOException {
        this.file = file;
        load();
    }

    /**
     * Loads identifiers from disk.
     * <p>A missing file is an empty store, blank lines are ignored.
     *
     * @throws IOException Unable to read file.
     */
    private void load() throws IOException {
        if (!Files.exists(file)) {
            log.info("No dedup record at {}, starting empty", file.toAbsolutePath());
            return;
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (String line : lines) {
            String id = line.trim();
            if (!id.isEmpty()) {
                processed.add(id);
            }
        }
        log.info("Loaded {} processed message ids from {}", processed.size(), file.toAbsolutePath());
    }

    @Override
    public boolean isProcessed(String messageId) {
        return messageId != null && processed.contains(normalize(messageId));
    }

    @Override
    public synchronized void markProcessed(String messageId) throws DedupPersistenceException {
        String id = normalize(messageId);
        if (!processed.add(id)) {
            return;
        }

        String line = id + "\n";
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.DSYNC);
        } catch (IOException e) {
            log.error("Processed id {} kept in memory only: {}", id, e.getMessage());
            throw new DedupPersistenceException(messageId, e);
        }
    }

    /**
     * Normalizes an identifier to the form stored on disk.
     * <p>The line based format cannot carry line breaks or surrounding whitespace.
     *
     * @param messageId Message identifier.
     * @return Stored form.
     */
    static String normalize(String messageId) {
        return messageId.replace("\r", "").replace("\n", "").trim();
    }

    @Override
    public int size() {
        return processed.size();
    }

    public Path getFile() {
        return file;
    }
}
