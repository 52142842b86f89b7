package at.sv.boost.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A single JSON document on disk holding timers and settings of all devices. The document is loaded once and kept
 * in memory; every update is written through by replacing the file atomically.
 */
@Slf4j
public final class JsonFileStorage {

    private final Path file;
    private final ObjectMapper mapper;
    private StorageDocument document;

    public JsonFileStorage(Path file) {
        this.file = file;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    synchronized <T> T read(Function<StorageDocument, T> reader) {
        return reader.apply(getDocument());
    }

    /**
     * Applies the given change and writes the result to disk. If writing fails, the change is discarded.
     *
     * @throws UncheckedIOException if the file could not be written
     */
    synchronized void update(Consumer<StorageDocument> change) {
        StorageDocument updated = getDocument().copy();
        change.accept(updated);
        write(updated);
        document = updated;
    }

    private StorageDocument getDocument() {
        if (document == null) {
            document = load();
        }
        return document;
    }

    private StorageDocument load() {
        if (!Files.exists(file)) {
            log.debug("Storage file '{}' does not exist yet.", file);
            return new StorageDocument();
        }
        try {
            StorageDocument loaded = mapper.readValue(file.toFile(), StorageDocument.class);
            if (loaded == null) {
                return new StorageDocument();
            }
            if (loaded.getVersion() != StorageDocument.CURRENT_VERSION) {
                log.warn("Unsupported storage version {} in '{}'. Starting with empty storage.", loaded.getVersion(), file);
                return new StorageDocument();
            }
            if (loaded.getTimers() == null) {
                loaded.setTimers(new StorageDocument().getTimers());
            }
            if (loaded.getSettings() == null) {
                loaded.setSettings(new StorageDocument().getSettings());
            }
            return loaded;
        } catch (IOException e) {
            log.error("Failed to read storage file '{}', treating it as empty: {}", file, e.getLocalizedMessage());
            return new StorageDocument();
        }
    }

    private void write(StorageDocument updated) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(temp.toFile(), updated);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write storage file '" + file + "'", e);
        }
    }
}
