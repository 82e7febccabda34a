package ai.sessionkeeper.context;

/** Token allocation for one request. {@link #available()} is what is left for conversation messages. */
public record ContextBudget(int totalTokens, int reservedOutput, int systemOverhead, int toolOverhead) {
    public ContextBudget {
        if (totalTokens <= 0) {
            throw new IllegalArgumentException("totalTokens must be > 0");
        }
        if (reservedOutput < 0 || systemOverhead < 0 || toolOverhead < 0) {
            throw new IllegalArgumentException("overheads must be >= 0");
        }
    }

    public static ContextBudget of(ModelLimits limits) {
        return new ContextBudget(limits.contextWindow(), limits.reservedOutput(), 0, 0);
    }

    public int available() {
        return Math.max(0, totalTokens - reservedOutput - systemOverhead - toolOverhead);
    }

    /** Tokens usable for input: the window minus the output reservation. */
    public int inputLimit() {
        return Math.max(0, totalTokens - reservedOutput);
    }

    public ContextBudget withSystemOverhead(int tokens) {
        return new ContextBudget(totalTokens, reservedOutput, tokens, toolOverhead);
    }

    public ContextBudget withToolOverhead(int tokens) {
        return new ContextBudget(totalTokens, reservedOutput, systemOverhead, tokens);
    }
}
