package ai.sessionkeeper.sessions;

/** Lifecycle points at which {@link SessionHooks} listeners run. */
public enum SessionEvent {
    SESSION_START("session:start"),
    SESSION_END("session:end"),
    SESSION_MESSAGE("session:message"),
    SESSION_SAVE("session:save");

    private final String eventName;

    SessionEvent(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }

    @Override
    public String toString() {
        return eventName;
    }
}
