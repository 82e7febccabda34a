package ai.sessionkeeper.context;

import ai.sessionkeeper.context.policy.TokenBudgetPolicy;
import ai.sessionkeeper.context.policy.TruncationMode;
import ai.sessionkeeper.context.policy.TruncationPolicy;
import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The working conversation for one model: tracks its token cost and bounds it before each request with the policy
 * of the current {@link TruncationMode}. In {@link TruncationMode#SUMMARIZE} mode a {@link ContextCompactor}, when
 * present, is tried before truncating.
 */
public class ContextWindow {
    private static final Logger logger = LogManager.getLogger(ContextWindow.class);

    public static final double DEFAULT_COMPACTION_THRESHOLD = 0.8;

    private final BudgetTracker tracker;
    private final TokenEstimator estimator;
    private final @Nullable ContextCompactor compactor;
    private final List<Message> messages = new ArrayList<>();
    private final TruncationPolicy finalPass = new TokenBudgetPolicy(true);
    private TruncationMode mode;
    private TruncationPolicy policy;

    public ContextWindow(
            String modelId, TokenEstimator estimator, TruncationMode mode, @Nullable ContextCompactor compactor) {
        this(new BudgetTracker(modelId, estimator), mode, compactor);
    }

    public ContextWindow(BudgetTracker tracker, TruncationMode mode, @Nullable ContextCompactor compactor) {
        this.tracker = Objects.requireNonNull(tracker);
        this.estimator = tracker.estimator();
        this.compactor = compactor;
        this.mode = mode;
        this.policy = mode.policy();
    }

    public BudgetTracker tracker() {
        return tracker;
    }

    public synchronized TruncationMode mode() {
        return mode;
    }

    public synchronized void setMode(TruncationMode newMode) {
        mode = newMode;
        policy = newMode.policy();
        logger.debug("Context mode set to {}", newMode.wireName());
    }

    /** Overrides the default policy of the current mode. */
    public synchronized void setPolicy(TruncationPolicy newPolicy) {
        policy = Objects.requireNonNull(newPolicy);
    }

    public void setSystemPrompt(String systemPrompt) {
        tracker.setSystemPrompt(systemPrompt);
    }

    public void setToolSchemas(List<String> schemas) {
        tracker.setToolSchemas(schemas);
    }

    public synchronized void addMessage(Message message) {
        messages.add(message);
        tracker.add(message);
    }

    public synchronized void setMessages(List<Message> replacement) {
        messages.clear();
        messages.addAll(replacement);
        tracker.setMessages(replacement);
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    /**
     * Messages to send with the next request, bounded by the mode's policy and then by a final token-budget pass,
     * so the result always fits the space left after system prompt and tool schemas (system messages excepted).
     */
    public synchronized List<Message> prepareForRequest() {
        var current = List.copyOf(messages);
        int budget = tracker.messageBudget();
        var bounded = policy.truncate(current, budget, estimator);
        return finalPass.truncate(bounded, budget, estimator);
    }

    /**
     * When utilization reaches {@code threshold}, shrinks the stored conversation: summarizing in
     * {@link TruncationMode#SUMMARIZE} mode with truncation as the fallback, truncating otherwise. Messages added
     * while a summary is in flight are kept after the compacted ones.
     */
    public CompletableFuture<List<Message>> compactIfNeeded(double threshold) {
        List<Message> snapshot;
        int budget;
        TruncationPolicy activePolicy;
        boolean summarize;
        synchronized (this) {
            snapshot = List.copyOf(messages);
            if (tracker.utilization() < threshold) {
                return CompletableFuture.completedFuture(snapshot);
            }
            budget = tracker.messageBudget();
            activePolicy = policy;
            summarize = mode == TruncationMode.SUMMARIZE && compactor != null;
        }
        logger.info(
                "Context at {}% of limit; {}",
                Math.round(tracker.utilization() * 100),
                summarize ? "summarizing" : "truncating");

        CompletableFuture<List<Message>> shrunk = summarize
                ? compactor.compact(snapshot, budget, estimator).thenApply(result -> result == snapshot
                        ? activePolicy.truncate(snapshot, budget, estimator)
                        : result)
                : CompletableFuture.completedFuture(activePolicy.truncate(snapshot, budget, estimator));
        return shrunk.thenApply(result -> applyCompaction(snapshot, result));
    }

    private synchronized List<Message> applyCompaction(List<Message> snapshot, List<Message> result) {
        if (result == snapshot) {
            return List.copyOf(messages);
        }
        if (messages.size() < snapshot.size() || !messages.subList(0, snapshot.size()).equals(snapshot)) {
            logger.debug("Conversation changed during compaction; discarding result");
            return List.copyOf(messages);
        }
        var merged = new ArrayList<>(result);
        merged.addAll(messages.subList(snapshot.size(), messages.size()));
        setMessages(merged);
        return List.copyOf(merged);
    }

    /** Clears the conversation; system prompt and tool schemas stay. */
    public synchronized void reset() {
        messages.clear();
        tracker.reset();
    }

    public synchronized ContextStats stats() {
        return new ContextStats(
                messages.size(),
                tracker.currentTokens(),
                tracker.budget().inputLimit(),
                tracker.available(),
                tracker.utilization(),
                mode);
    }
}
