package ai.sessionkeeper.context;

import ai.sessionkeeper.context.policy.TruncationMode;

/** Point-in-time view of a {@link ContextWindow}. */
public record ContextStats(
        int messageCount, int tokenCount, int maxTokens, int availableTokens, double utilization, TruncationMode mode) {

    public double utilizationPercent() {
        return utilization * 100.0;
    }
}
