package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.List;

/**
 * Strategy that bounds a conversation before it is sent to a model.
 *
 * <p>Implementations are pure: they never reorder or rewrite messages, the only content they add is the omission
 * marker from {@link Message#omissionMarker(int)}, and they return {@code messages} itself when nothing changes.
 */
public interface TruncationPolicy {
    /**
     * @param budget tokens available to the messages, as counted by {@link TokenEstimator#countMessages(List)}
     */
    List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator);

    default String name() {
        return getClass().getSimpleName();
    }
}
