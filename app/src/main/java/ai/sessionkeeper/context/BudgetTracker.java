package ai.sessionkeeper.context;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Running token account for one model request: system prompt, tool schemas and conversation messages.
 *
 * <p>{@code currentTokens() == systemTokens + toolTokens + messageTokens()} always holds. Thread-safe.
 */
public class BudgetTracker {
    private final ModelLimits limits;
    private final TokenEstimator estimator;

    private int systemTokens;
    private int toolTokens;
    private final List<Message> messages = new ArrayList<>();
    private int messageTokens;

    public BudgetTracker(String modelId, TokenEstimator estimator) {
        this(ModelLimits.forModel(modelId), estimator);
    }

    public BudgetTracker(ModelLimits limits, TokenEstimator estimator) {
        this.limits = Objects.requireNonNull(limits);
        this.estimator = Objects.requireNonNull(estimator);
    }

    public ModelLimits limits() {
        return limits;
    }

    public TokenEstimator estimator() {
        return estimator;
    }

    public synchronized void setSystemPrompt(String systemPrompt) {
        systemTokens = systemPrompt == null || systemPrompt.isEmpty()
                ? 0
                : estimator.countMessage(Message.system(systemPrompt));
    }

    /** @param schemas tool definitions as serialized JSON */
    public synchronized void setToolSchemas(List<String> schemas) {
        int total = 0;
        for (var schema : schemas) {
            total += estimator.count(schema);
        }
        toolTokens = total;
    }

    public synchronized void add(Message message) {
        messages.add(message);
        messageTokens += estimator.countMessage(message);
    }

    public synchronized void addAll(List<Message> newMessages) {
        for (var message : newMessages) {
            add(message);
        }
    }

    public synchronized void setMessages(List<Message> replacement) {
        messages.clear();
        messageTokens = 0;
        addAll(replacement);
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    /** Drops tracked messages; system prompt and tool overhead are kept. */
    public synchronized void reset() {
        messages.clear();
        messageTokens = 0;
    }

    public synchronized int systemTokens() {
        return systemTokens;
    }

    public synchronized int toolTokens() {
        return toolTokens;
    }

    public synchronized int messageTokens() {
        return messageTokens;
    }

    public synchronized int currentTokens() {
        return systemTokens + toolTokens + messageTokens;
    }

    public synchronized ContextBudget budget() {
        return ContextBudget.of(limits).withSystemOverhead(systemTokens).withToolOverhead(toolTokens);
    }

    /** Tokens the conversation messages may use in total, after system prompt and tool overhead. */
    public synchronized int messageBudget() {
        return budget().available();
    }

    public synchronized boolean exceedsLimit() {
        return currentTokens() > budget().inputLimit();
    }

    public synchronized int available() {
        return Math.max(0, budget().inputLimit() - currentTokens());
    }

    /** Fraction of the input limit in use; may exceed 1.0 when over budget. */
    public synchronized double utilization() {
        int limit = budget().inputLimit();
        return limit == 0 ? 1.0 : (double) currentTokens() / limit;
    }
}
