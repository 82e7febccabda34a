package ai.sessionkeeper.context.policy;

import java.util.Locale;

/** Named context-management strategies, as selected in settings or by the {@code /context} command. */
public enum TruncationMode {
    SLIDING_WINDOW,
    TOKEN_BUDGET,
    SMART,
    SELECTIVE,
    /** Summarize with the compactor; falls back to token-budget truncation. */
    SUMMARIZE;

    public static final int DEFAULT_WINDOW_SIZE = 20;
    public static final int DEFAULT_PRESERVE_FIRST = 2;
    public static final int DEFAULT_PRESERVE_LAST = 10;

    /** Accepts {@code sliding_window}, {@code sliding-window}, {@code SMART} and the like. */
    public static TruncationMode parse(String value) {
        var normalized = value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown truncation mode: " + value, e);
        }
    }

    /** Truncation policy with default parameters for this mode. */
    public TruncationPolicy policy() {
        return switch (this) {
            case SLIDING_WINDOW -> new SlidingWindowPolicy(DEFAULT_WINDOW_SIZE, true);
            case TOKEN_BUDGET, SUMMARIZE -> new TokenBudgetPolicy(true);
            case SMART -> new SmartTruncationPolicy(DEFAULT_PRESERVE_FIRST, DEFAULT_PRESERVE_LAST, true);
            case SELECTIVE -> new SelectivePolicy();
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
