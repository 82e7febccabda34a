package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.List;

/** Drops the oldest messages until the conversation fits. System messages are kept unless told otherwise. */
public final class TokenBudgetPolicy implements TruncationPolicy {
    private final boolean preserveSystem;

    public TokenBudgetPolicy() {
        this(true);
    }

    public TokenBudgetPolicy(boolean preserveSystem) {
        this.preserveSystem = preserveSystem;
    }

    @Override
    public List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator) {
        return MessageGroups.evictOldest(messages, budget, estimator, m -> preserveSystem && m.isSystem());
    }

    @Override
    public String name() {
        return "token_budget";
    }
}
