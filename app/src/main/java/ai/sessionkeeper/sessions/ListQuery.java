package ai.sessionkeeper.sessions;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Filtering, sorting and paging options for {@link SessionIndex#list(ListQuery)}.
 *
 * @param limit maximum number of results; {@code <= 0} means unlimited
 * @param offset number of filtered, sorted results to skip
 * @param tags every tag must be present on a session for it to match
 * @param search case-insensitive substring matched against the title
 * @param workingDir exact working directory match
 */
public record ListQuery(
        int limit,
        int offset,
        SortField sortField,
        boolean descending,
        Set<String> tags,
        @Nullable String search,
        @Nullable String workingDir) {

    public ListQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        sortField = sortField == null ? SortField.UPDATED_AT : sortField;
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /** Everything, most recently updated first. */
    public static ListQuery all() {
        return new ListQuery(0, 0, SortField.UPDATED_AT, true, Set.of(), null, null);
    }

    public ListQuery withLimit(int newLimit, int newOffset) {
        return new ListQuery(newLimit, newOffset, sortField, descending, tags, search, workingDir);
    }

    public ListQuery withSort(SortField field, boolean desc) {
        return new ListQuery(limit, offset, field, desc, tags, search, workingDir);
    }

    public ListQuery withTags(Set<String> newTags) {
        return new ListQuery(limit, offset, sortField, descending, newTags, search, workingDir);
    }

    public ListQuery withSearch(@Nullable String text) {
        return new ListQuery(limit, offset, sortField, descending, tags, text, workingDir);
    }

    public ListQuery withWorkingDir(@Nullable String dir) {
        return new ListQuery(limit, offset, sortField, descending, tags, search, dir);
    }
}
