package ai.sessionkeeper.context;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.Role;
import ai.sessionkeeper.tokens.TokenEstimator;

/**
 * Caps the size of a single tool result. Oversized output is cut at a line or word break and a notice with the
 * number of removed tokens is appended.
 */
public class ToolResultCompactor {
    public static final int DEFAULT_MAX_RESULT_TOKENS = 1000;
    static final int NOTICE_RESERVE = 50;
    static final int BREAK_SEARCH_CHARS = 100;
    static final String NOTICE = "\n[Output truncated - %d tokens removed]";

    private final int maxResultTokens;

    public ToolResultCompactor() {
        this(DEFAULT_MAX_RESULT_TOKENS);
    }

    public ToolResultCompactor(int maxResultTokens) {
        if (maxResultTokens <= 0) {
            throw new IllegalArgumentException("maxResultTokens must be > 0, got " + maxResultTokens);
        }
        this.maxResultTokens = maxResultTokens;
    }

    public int maxResultTokens() {
        return maxResultTokens;
    }

    public String compactResult(String result, TokenEstimator estimator) {
        if (result == null || result.isEmpty()) {
            return result;
        }
        int tokens = estimator.count(result);
        if (tokens <= maxResultTokens) {
            return result;
        }

        double charsPerToken = (double) result.length() / tokens;
        int target = Math.max(1, maxResultTokens - NOTICE_RESERVE);
        int cut = Math.min(result.length(), (int) (target * charsPerToken));
        for (int i = 0; i < Math.min(BREAK_SEARCH_CHARS, cut); i++) {
            int pos = cut - i;
            if (pos > 0 && pos < result.length() && isBreak(result.charAt(pos))) {
                cut = pos;
                break;
            }
        }
        var truncated = result.substring(0, cut);
        int removed = tokens - estimator.count(truncated);
        return truncated + NOTICE.formatted(removed);
    }

    private static boolean isBreak(char c) {
        return c == '\n' || c == ' ';
    }

    /** Returns {@code message} unchanged unless it is an oversized tool result. */
    public Message compactMessage(Message message, TokenEstimator estimator) {
        if (message.role() != Role.TOOL) {
            return message;
        }
        var compacted = compactResult(message.content(), estimator);
        return compacted.equals(message.content()) ? message : message.withContent(compacted);
    }
}
