package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.Role;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps messages whose role is in {@code preserveRoles} or that are pinned, wherever they sit; everything else is
 * evicted oldest-first until the conversation fits.
 */
public final class SelectivePolicy implements TruncationPolicy {
    private final Set<Role> preserveRoles;
    private final boolean preservePinned;

    public SelectivePolicy() {
        this(EnumSet.of(Role.SYSTEM), true);
    }

    public SelectivePolicy(Set<Role> preserveRoles, boolean preservePinned) {
        this.preserveRoles = preserveRoles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(preserveRoles);
        this.preservePinned = preservePinned;
    }

    @Override
    public List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator) {
        return MessageGroups.evictOldest(
                messages, budget, estimator, m -> preserveRoles.contains(m.role()) || (preservePinned && m.pinned()));
    }

    @Override
    public String name() {
        return "selective";
    }
}
