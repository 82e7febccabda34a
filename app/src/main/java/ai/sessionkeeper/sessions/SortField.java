package ai.sessionkeeper.sessions;

import java.util.Comparator;

/** Sort keys supported by {@link SessionIndex#list(ListQuery)}. */
public enum SortField {
    UPDATED_AT(Comparator.comparing(SessionSummary::updatedAt)),
    CREATED_AT(Comparator.comparing(SessionSummary::createdAt)),
    TITLE(Comparator.comparing(SessionSummary::title, String.CASE_INSENSITIVE_ORDER)),
    MESSAGE_COUNT(Comparator.comparingInt(SessionSummary::messageCount)),
    TOTAL_TOKENS(Comparator.comparingLong(SessionSummary::totalTokens));

    private final Comparator<SessionSummary> comparator;

    SortField(Comparator<SessionSummary> comparator) {
        this.comparator = comparator;
    }

    /** Comparator for this field with the id as a stable tie-break. */
    public Comparator<SessionSummary> comparator(boolean descending) {
        var primary = descending ? comparator.reversed() : comparator;
        return primary.thenComparing(SessionSummary::id);
    }
}
