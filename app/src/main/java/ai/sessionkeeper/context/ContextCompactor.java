package ai.sessionkeeper.context;

import ai.sessionkeeper.config.SessionKeeperConfig;
import ai.sessionkeeper.context.policy.MessageGroups;
import ai.sessionkeeper.llm.SummaryModel;
import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Replaces the oldest stretch of conversation with a model-written summary.
 *
 * <p>Compaction never fails from the caller's point of view: a model error, a timeout, a blank reply or a summary
 * that does not shrink the conversation enough all yield the original list, with a warning in the log.
 */
public class ContextCompactor implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ContextCompactor.class);

    public static final String SUMMARY_PREFIX = "[Previous conversation summary]\n";
    static final int MAX_CHARS_PER_MESSAGE = 500;
    static final String SUMMARY_PROMPT =
            """
            Summarize the following conversation concisely.
            Preserve key decisions, code changes, and important context.
            The summary will be used to continue the conversation.

            Conversation:
            %s

            Provide a brief summary (max %d tokens):""";

    public record Settings(int minMessagesToSummarize, int preserveLast, int maxSummaryTokens, Duration timeout) {
        public Settings {
            if (minMessagesToSummarize < 1 || preserveLast < 0 || maxSummaryTokens <= 0) {
                throw new IllegalArgumentException("invalid compaction settings");
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be > 0");
            }
        }

        public static Settings defaults() {
            return from(SessionKeeperConfig.defaults());
        }

        public static Settings from(SessionKeeperConfig config) {
            return new Settings(
                    config.compactionMinMessages(),
                    config.compactionPreserveLast(),
                    config.compactionMaxSummaryTokens(),
                    config.compactionTimeout());
        }
    }

    private final SummaryModel model;
    private final Settings settings;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public ContextCompactor(SummaryModel model, Settings settings) {
        this(model, settings, Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "ContextCompactor");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public ContextCompactor(SummaryModel model, Settings settings, ExecutorService executor) {
        this(model, settings, executor, false);
    }

    private ContextCompactor(SummaryModel model, Settings settings, ExecutorService executor, boolean ownsExecutor) {
        this.model = Objects.requireNonNull(model);
        this.settings = Objects.requireNonNull(settings);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public Settings settings() {
        return settings;
    }

    public CompletableFuture<List<Message>> compact(List<Message> messages) {
        return compact(messages, -1, null);
    }

    /**
     * @param targetTokens when positive, a result whose cost exceeds it is discarded in favour of the original
     */
    public CompletableFuture<List<Message>> compact(
            List<Message> messages, int targetTokens, @Nullable TokenEstimator estimator) {
        var run = selectRun(messages);
        if (run == null) {
            return CompletableFuture.completedFuture(messages);
        }
        var toSummarize = messages.subList(run.start(), run.end());
        var prompt = SUMMARY_PROMPT.formatted(formatForSummary(toSummarize), settings.maxSummaryTokens());

        return model.completeAsync(List.of(), prompt, executor, settings.timeout())
                .handle((summary, error) -> {
                    if (error != null) {
                        var cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        if (cause instanceof TimeoutException) {
                            logger.warn("Summarization timed out after {}; keeping full history", settings.timeout());
                        } else {
                            logger.warn("Summarization failed; keeping full history: {}", cause.getMessage());
                        }
                        return messages;
                    }
                    if (summary == null || summary.isBlank()) {
                        logger.warn("Summarization returned nothing; keeping full history");
                        return messages;
                    }
                    var result = replaceRun(messages, run, summary.strip());
                    if (targetTokens > 0
                            && estimator != null
                            && estimator.countMessages(result) > targetTokens) {
                        logger.warn("Summary still exceeds {} tokens; keeping full history", targetTokens);
                        return messages;
                    }
                    logger.info("Compacted {} messages into a summary", run.size());
                    return result;
                });
    }

    /** Blocking variant of {@link #compact(List)}. */
    public List<Message> compactNow(List<Message> messages) {
        return compact(messages).join();
    }

    /**
     * The oldest contiguous run of non-system, non-pinned messages ahead of the preserved tail, or null when
     * compaction should not happen. The run never ends inside a tool-call group.
     */
    @Nullable
    MessageGroups.Group selectRun(List<Message> messages) {
        var nonSystem = new ArrayList<Integer>();
        for (int i = 0; i < messages.size(); i++) {
            if (!messages.get(i).isSystem()) {
                nonSystem.add(i);
            }
        }
        if (nonSystem.size() <= settings.minMessagesToSummarize() + settings.preserveLast()) {
            return null;
        }
        int boundary = nonSystem.get(nonSystem.size() - settings.preserveLast() - 1) + 1;

        int start = -1;
        for (int i = 0; i < boundary; i++) {
            var message = messages.get(i);
            if (!message.isSystem() && !message.pinned()) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return null;
        }
        int end = start;
        while (end < boundary && !messages.get(end).isSystem() && !messages.get(end).pinned()) {
            end++;
        }
        for (var group : MessageGroups.partition(messages)) {
            if (group.start() < start && start < group.end()) {
                start = Math.min(group.end(), end);
            }
            if (group.start() < end && end < group.end()) {
                end = Math.max(start, group.start());
            }
        }
        if (end - start < settings.minMessagesToSummarize()) {
            return null;
        }
        return new MessageGroups.Group(start, end);
    }

    private static List<Message> replaceRun(List<Message> messages, MessageGroups.Group run, String summary) {
        var result = new ArrayList<Message>(messages.size() - run.size() + 1);
        result.addAll(messages.subList(0, run.start()));
        result.add(Message.system(SUMMARY_PREFIX + summary).withMetadata(Message.SUMMARY_KEY, true));
        result.addAll(messages.subList(run.end(), messages.size()));
        return List.copyOf(result);
    }

    static String formatForSummary(List<Message> messages) {
        var lines = new ArrayList<String>(messages.size());
        for (var message : messages) {
            var content = message.content();
            if (content.length() > MAX_CHARS_PER_MESSAGE) {
                content = content.substring(0, MAX_CHARS_PER_MESSAGE) + "...";
            }
            lines.add(message.role().wireName() + ": " + content);
        }
        return String.join("\n", lines);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}
