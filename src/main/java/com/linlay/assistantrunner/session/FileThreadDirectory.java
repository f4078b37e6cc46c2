package com.linlay.assistantrunner.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ThreadDirectory} kept in a JSON object file ({@code {"userId": "threadId", ...}}).
 * The whole file is rewritten through a temp file on every new entry.
 */
public class FileThreadDirectory implements ThreadDirectory {

    private static final Logger log = LoggerFactory.getLogger(FileThreadDirectory.class);
    private static final TypeReference<Map<String, String>> MAPPING_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> threadsByUser = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public FileThreadDirectory(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public Optional<String> find(String userId) {
        return Optional.ofNullable(userId == null ? null : threadsByUser.get(userId));
    }

    @Override
    public void record(String userId, String threadId) {
        synchronized (writeLock) {
            String previous = threadsByUser.put(userId, threadId);
            if (threadId.equals(previous)) {
                return;
            }
            persist();
        }
    }

    public int size() {
        return threadsByUser.size();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, String> stored = objectMapper.readValue(file.toFile(), MAPPING_TYPE);
            if (stored != null) {
                stored.forEach((userId, threadId) -> {
                    if (userId != null && threadId != null) {
                        threadsByUser.put(userId, threadId);
                    }
                });
            }
            log.info("Loaded {} thread mappings from {}", threadsByUser.size(), file);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read thread directory file=" + file, ex);
        }
    }

    private void persist() {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new TreeMap<>(threadsByUser));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot write thread directory file=" + file, ex);
        }
    }
}
