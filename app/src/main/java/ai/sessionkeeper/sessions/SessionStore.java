package ai.sessionkeeper.sessions;

import ai.sessionkeeper.util.AtomicWrites;
import ai.sessionkeeper.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Durable storage of one session per JSON file ({@code <id>.json}) with a verbatim backup of the previous version
 * ({@code <id>.json.backup}).
 *
 * <p>Saves never truncate the primary file in place: the new content goes to a temp file in the same directory that
 * is flushed and then renamed over the primary, so a concurrent reader (or a process restarted after a crash) sees
 * either the old complete file or the new complete file. Saves and deletes of the same id are serialized; different
 * ids never contend.
 */
public class SessionStore {
    private static final Logger logger = LogManager.getLogger(SessionStore.class);

    public static final String SESSION_SUFFIX = ".json";
    public static final String BACKUP_SUFFIX = ".backup";
    /** Reserved by {@link SessionIndex}; never treated as a session file. */
    public static final String INDEX_FILE_NAME = "sessions-index.json";

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");

    /** Steps of a single save; reported in failure messages. */
    enum SaveStage {
        READY,
        BACKING_UP,
        WRITING_TEMP,
        ATOMIC_RENAME
    }

    private final Path sessionsDir;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private volatile AtomicWrites.MoveBarrier moveBarrier = AtomicWrites.MoveBarrier.NONE;
    private volatile TempWriter tempWriter = AtomicWrites::writeTemp;

    /** Writes the new session bytes next to the target and returns the temporary file. */
    @FunctionalInterface
    interface TempWriter {
        Path write(Path target, byte[] content) throws IOException;
    }

    public SessionStore(Path sessionsDir) {
        this.sessionsDir = Objects.requireNonNull(sessionsDir);
    }

    public Path getSessionsDir() {
        return sessionsDir;
    }

    public Path getSessionPath(String sessionId) {
        return sessionsDir.resolve(validateId(sessionId) + SESSION_SUFFIX);
    }

    public Path getBackupPath(String sessionId) {
        return sessionsDir.resolve(validateId(sessionId) + SESSION_SUFFIX + BACKUP_SUFFIX);
    }

    /** For tests: runs between writing the temp file and renaming it into place. */
    void setMoveBarrier(AtomicWrites.MoveBarrier barrier) {
        this.moveBarrier = Objects.requireNonNull(barrier);
    }

    /** For tests: replaces the step that writes the temp file. */
    void setTempWriter(TempWriter writer) {
        this.tempWriter = Objects.requireNonNull(writer);
    }

    private Object lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, k -> new Object());
    }

    private static String validateId(String sessionId) {
        if (sessionId == null || !VALID_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return sessionId;
    }

    /* ───────────────────────── write path ─────────────────────────── */

    /**
     * Persists the session: backup the existing file (best effort), write a temp file, rename it over the primary
     * and restrict it to the owner.
     *
     * @throws SessionException.StorageFailure if serialization, writing or renaming fails; the primary file is left
     *     untouched in that case
     */
    @Blocking
    public void save(Session session) throws SessionException.StorageFailure {
        String id = session.getId();
        Path path = getSessionPath(id);
        synchronized (lockFor(id)) {
            var stage = SaveStage.READY;
            try {
                Files.createDirectories(sessionsDir);

                stage = SaveStage.BACKING_UP;
                backupExisting(id, path);

                stage = SaveStage.WRITING_TEMP;
                byte[] json = Json.mapper().writeValueAsBytes(session.toDto());
                Path temp = tempWriter.write(path, json);

                stage = SaveStage.ATOMIC_RENAME;
                AtomicWrites.moveIntoPlace(temp, path, moveBarrier);
                AtomicWrites.restrictToOwner(path);
                logger.debug("Saved session {} ({} bytes)", id, json.length);
            } catch (IOException e) {
                logger.error("Failed to save session {} during {}: {}", id, stage, e.getMessage());
                throw new SessionException.StorageFailure(
                        id, "Failed to save session %s during %s".formatted(id, stage), e);
            }
        }
    }

    private void backupExisting(String id, Path path) {
        if (!Files.exists(path)) {
            return;
        }
        Path backup = getBackupPath(id);
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            AtomicWrites.restrictToOwner(backup);
        } catch (IOException e) {
            logger.warn("Could not back up session {} before overwrite: {}", id, e.getMessage());
        }
    }

    /* ───────────────────────── read path ─────────────────────────── */

    /**
     * Loads a session.
     *
     * @throws SessionException.NotFound if no file exists for the id
     * @throws SessionException.Corrupted if the file exists but cannot be parsed
     * @throws SessionException.StorageFailure if the file cannot be read
     */
    @Blocking
    public Session load(String sessionId) throws SessionException {
        return readSessionFile(sessionId, getSessionPath(sessionId));
    }

    /** Like {@link #load(String)} but never throws; failures are logged and yield {@code null}. */
    @Blocking
    public @Nullable Session loadOrNull(String sessionId) {
        try {
            return load(sessionId);
        } catch (SessionException.NotFound e) {
            return null;
        } catch (SessionException | IllegalArgumentException e) {
            logger.warn("Could not load session {}: {}", sessionId, e.getMessage());
            return null;
        }
    }

    private Session readSessionFile(String sessionId, Path path) throws SessionException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new SessionException.NotFound(sessionId);
        } catch (IOException e) {
            throw new SessionException.StorageFailure(sessionId, "Failed to read " + path, e);
        }

        try {
            var dto = Json.mapper().readValue(bytes, SessionDto.class);
            if (dto == null) {
                throw new SessionException.Corrupted(sessionId, path, new IOException("empty document"));
            }
            if (!sessionId.equals(dto.id())) {
                throw new SessionException.Corrupted(
                        sessionId, path, new IOException("file contains session " + dto.id()));
            }
            return Session.fromDto(dto);
        } catch (JsonProcessingException | NullPointerException | IllegalArgumentException e) {
            throw new SessionException.Corrupted(sessionId, path, e);
        } catch (IOException e) {
            throw new SessionException.StorageFailure(sessionId, "Failed to parse " + path, e);
        }
    }

    public boolean exists(String sessionId) {
        return Files.exists(getSessionPath(sessionId));
    }

    /** Ids of every session file in the directory, sorted. Temp, backup and index files are skipped. */
    @Blocking
    public List<String> listIds() {
        if (!Files.isDirectory(sessionsDir)) {
            return List.of();
        }
        try (var stream = Files.list(sessionsDir)) {
            return stream.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SESSION_SUFFIX) && !name.equals(INDEX_FILE_NAME))
                    .map(name -> name.substring(0, name.length() - SESSION_SUFFIX.length()))
                    .filter(id -> VALID_ID.matcher(id).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            logger.error("Error listing session files in {}: {}", sessionsDir, e.getMessage());
            return List.of();
        }
    }

    /* ───────────────────────── maintenance ─────────────────────────── */

    /** Deletes the session file and its backup. Returns whether the primary file existed. */
    @Blocking
    public boolean delete(String sessionId) throws SessionException.StorageFailure {
        synchronized (lockFor(sessionId)) {
            try {
                boolean existed = Files.deleteIfExists(getSessionPath(sessionId));
                Files.deleteIfExists(getBackupPath(sessionId));
                if (existed) {
                    logger.info("Deleted session {}", sessionId);
                }
                return existed;
            } catch (IOException e) {
                throw new SessionException.StorageFailure(sessionId, "Failed to delete session " + sessionId, e);
            } finally {
                locks.remove(sessionId);
            }
        }
    }

    /**
     * Restores the primary file from its backup, provided the backup itself parses. Returns {@code false} when
     * there is no usable backup.
     */
    @Blocking
    public boolean recoverFromBackup(String sessionId) {
        Path backup = getBackupPath(sessionId);
        if (!Files.exists(backup)) {
            logger.warn("No backup available for session {}", sessionId);
            return false;
        }
        synchronized (lockFor(sessionId)) {
            try {
                readSessionFile(sessionId, backup);
                AtomicWrites.atomicOverwrite(getSessionPath(sessionId), Files.readAllBytes(backup), moveBarrier);
                AtomicWrites.restrictToOwner(getSessionPath(sessionId));
                logger.info("Recovered session {} from backup", sessionId);
                return true;
            } catch (SessionException e) {
                logger.warn("Backup for session {} is not usable: {}", sessionId, e.getMessage());
                return false;
            } catch (IOException e) {
                logger.error("Failed to restore session {} from backup: {}", sessionId, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Deletes sessions last updated before {@code now - maxAge}, always keeping the {@code keepMinimum} most recently
     * updated ones. Unreadable sessions are left alone.
     *
     * @return ids of the deleted sessions
     */
    @Blocking
    public List<String> cleanupOlderThan(Duration maxAge, int keepMinimum) {
        return cleanupOlderThan(maxAge, keepMinimum, Set.of());
    }

    /** As {@link #cleanupOlderThan(Duration, int)}, never deleting the sessions in {@code keepIds}. */
    @Blocking
    public List<String> cleanupOlderThan(Duration maxAge, int keepMinimum, Set<String> keepIds) {
        if (keepMinimum < 0) {
            throw new IllegalArgumentException("keepMinimum must be >= 0");
        }
        var cutoff = Instant.now().minus(maxAge);
        var readable = new ArrayList<Session>();
        for (String id : listIds()) {
            var session = loadOrNull(id);
            if (session != null) {
                readable.add(session);
            }
        }
        readable.sort(Comparator.comparing(Session::getUpdatedAt).reversed());

        var deleted = new ArrayList<String>();
        for (int i = keepMinimum; i < readable.size(); i++) {
            var session = readable.get(i);
            if (keepIds.contains(session.getId()) || !session.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                if (delete(session.getId())) {
                    deleted.add(session.getId());
                }
            } catch (SessionException.StorageFailure e) {
                logger.warn("Failed to delete old session {}: {}", session.getId(), e.getMessage());
            }
        }
        if (!deleted.isEmpty()) {
            logger.info("Cleaned up {} sessions older than {}", deleted.size(), maxAge);
        }
        return List.copyOf(deleted);
    }
}
