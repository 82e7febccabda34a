package ai.sessionkeeper.sessions;

import java.nio.file.Path;

/**
 * Recoverable session persistence failures. Callers decide how to react: create a new session on
 * {@link NotFound}, attempt {@link SessionStore#recoverFromBackup(String)} on {@link Corrupted}, report
 * {@link StorageFailure} to the user.
 */
public abstract sealed class SessionException extends Exception {
    private final String sessionId;

    protected SessionException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    protected SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /** No session file exists for the id. */
    public static final class NotFound extends SessionException {
        public NotFound(String sessionId) {
            super(sessionId, "Session not found: " + sessionId);
        }
    }

    /** The session file exists but cannot be parsed. */
    public static final class Corrupted extends SessionException {
        private final Path path;

        public Corrupted(String sessionId, Path path, Throwable cause) {
            super(sessionId, "Session file is corrupted: " + path, cause);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /** Disk full, permission denied, rename failure and the like. Nothing partial was written. */
    public static final class StorageFailure extends SessionException {
        public StorageFailure(String sessionId, String message, Throwable cause) {
            super(sessionId, message, cause);
        }
    }
}
