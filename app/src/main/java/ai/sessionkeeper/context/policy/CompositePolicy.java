package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.List;

/**
 * Chains policies left to right. The first stage always runs; later stages run only while the output still exceeds
 * the budget.
 */
public final class CompositePolicy implements TruncationPolicy {
    private final List<TruncationPolicy> stages;

    public CompositePolicy(List<TruncationPolicy> stages) {
        this.stages = List.copyOf(stages);
    }

    public static CompositePolicy of(TruncationPolicy... stages) {
        return new CompositePolicy(List.of(stages));
    }

    public List<TruncationPolicy> stages() {
        return stages;
    }

    @Override
    public List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator) {
        var current = messages;
        for (int i = 0; i < stages.size(); i++) {
            if (i > 0 && MessageGroups.fits(current, budget, estimator)) {
                break;
            }
            current = stages.get(i).truncate(current, budget, estimator);
        }
        return current;
    }

    @Override
    public String name() {
        return "composite" + stages.stream().map(TruncationPolicy::name).toList();
    }
}
