package ai.sessionkeeper.sessions;

import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface SessionListener {
    /**
     * @param message the message that triggered {@link SessionEvent#SESSION_MESSAGE}; null for other events
     */
    void onEvent(SessionEvent event, Session session, @Nullable Message message) throws Exception;
}
