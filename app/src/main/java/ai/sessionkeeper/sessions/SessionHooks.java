package ai.sessionkeeper.sessions;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Listener registry keyed by {@link SessionEvent}. Listeners run synchronously on the firing thread in
 * registration order; a listener that throws is logged and skipped, the remaining listeners still run.
 */
public class SessionHooks {
    private static final Logger logger = LogManager.getLogger(SessionHooks.class);

    private final Map<SessionEvent, List<SessionListener>> listeners = new EnumMap<>(SessionEvent.class);

    public SessionHooks() {
        for (var event : SessionEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public void register(SessionEvent event, SessionListener listener) {
        listeners.get(event).add(listener);
    }

    public boolean unregister(SessionEvent event, SessionListener listener) {
        return listeners.get(event).remove(listener);
    }

    public int listenerCount(SessionEvent event) {
        return listeners.get(event).size();
    }

    public void fire(SessionEvent event, Session session) {
        fire(event, session, null);
    }

    public void fire(SessionEvent event, Session session, @Nullable Message message) {
        for (var listener : listeners.get(event)) {
            try {
                listener.onEvent(event, session, message);
            } catch (Exception e) {
                logger.warn("Listener for {} failed on session {}: {}", event, session.getId(), e.getMessage(), e);
            }
        }
    }
}
