package com.threadpilot.orchestrator.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.threadpilot.orchestrator.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON file backing the in-memory session store.
 *
 * Timestamps are written as ISO-8601 strings at full precision and parsed
 * back into {@link Instant}s on load. Writes go to a sibling temp file that
 * is then moved over the target, so a crash mid-write leaves the previous
 * file intact. Safe to call from several threads.
 */
public class SessionFileRepository {

    private static final Logger log = LoggerFactory.getLogger(SessionFileRepository.class);

    private final Path         file;
    private final ObjectMapper json;

    public SessionFileRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.json = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Read every persisted session, keyed by thread id.
     *
     * @return an empty map when the file does not exist yet
     * @throws PersistenceException if the file exists but cannot be read or parsed
     */
    public Map<String, Session> load() {
        if (!Files.exists(file)) {
            log.info("Session store {} does not exist yet, starting empty", file);
            return new LinkedHashMap<>();
        }
        try {
            PersistedSessions data = json.readValue(file.toFile(), PersistedSessions.class);
            log.info("Loaded {} session(s) from {} (version={}, lastUpdated={})",
                    data.sessions().size(), file, data.version(), data.lastUpdated());
            return new LinkedHashMap<>(data.sessions());
        } catch (IOException e) {
            throw new PersistenceException("Failed to read session store " + file, e);
        }
    }

    /**
     * Overwrite the store with {@code sessions}. Writers are serialized and
     * each write uses its own temp file.
     */
    public synchronized void save(Map<String, Session> sessions, Instant savedAt) {
        PersistedSessions data = new PersistedSessions(sessions, savedAt, PersistedSessions.CURRENT_VERSION);
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);

            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            json.writeValue(tmp.toFile(), data);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("Saved {} session(s) to {}", sessions.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write session store " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
