package ai.sessionkeeper.sessions;

/** A session mutation was attempted while no session is current. Indicates a caller bug. */
public final class NoActiveSessionException extends IllegalStateException {
    public NoActiveSessionException(String operation) {
        super("No active session: cannot " + operation);
    }
}
