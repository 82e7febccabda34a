package ai.sessionkeeper.sessions;

import ai.sessionkeeper.util.AtomicWrites;
import ai.sessionkeeper.util.Json;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Denormalized summary table over every session in a {@link SessionStore}, used for listing and search without
 * loading message bodies.
 *
 * <p>The store is the source of truth. The index is a write-through cache persisted opportunistically to
 * {@value SessionStore#INDEX_FILE_NAME}; a missing, version-mismatched or unparsable index file is rebuilt from the
 * session files. All public methods are {@code synchronized}.
 */
public class SessionIndex {
    private static final Logger logger = LogManager.getLogger(SessionIndex.class);

    public static final int VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexFile(int version, Map<String, SessionSummary> sessions) {}

    private final SessionStore store;
    private final Path indexPath;
    private final Map<String, SessionSummary> summaries = new LinkedHashMap<>();
    private boolean dirty;

    public SessionIndex(SessionStore store) {
        this.store = Objects.requireNonNull(store);
        this.indexPath = store.getSessionsDir().resolve(SessionStore.INDEX_FILE_NAME);
        initialize();
    }

    public Path getIndexPath() {
        return indexPath;
    }

    private synchronized void initialize() {
        if (!Files.exists(indexPath)) {
            logger.info("No session index at {}, rebuilding", indexPath);
            rebuild();
            return;
        }
        try {
            var file = Json.mapper().readValue(indexPath.toFile(), IndexFile.class);
            if (file == null || file.version() != VERSION || file.sessions() == null) {
                logger.warn(
                        "Session index {} has version {} (expected {}), rebuilding",
                        indexPath,
                        file == null ? "none" : file.version(),
                        VERSION);
                rebuild();
                return;
            }
            summaries.clear();
            file.sessions().forEach((id, summary) -> {
                if (summary != null && id.equals(summary.id())) {
                    summaries.put(id, summary);
                }
            });
            dirty = false;
            logger.debug("Loaded session index with {} entries", summaries.size());
        } catch (IOException | RuntimeException e) {
            logger.warn("Session index {} is unreadable ({}), rebuilding", indexPath, e.getMessage());
            rebuild();
        }
    }

    /* ───────────────────────── mutation ─────────────────────────── */

    public synchronized void add(Session session) {
        summaries.put(session.getId(), SessionSummary.from(session));
        dirty = true;
    }

    public synchronized void update(Session session) {
        add(session);
    }

    public synchronized boolean remove(String sessionId) {
        boolean removed = summaries.remove(sessionId) != null;
        if (removed) {
            dirty = true;
        }
        return removed;
    }

    /**
     * Re-derives every summary from the session files on disk and persists the result. Sessions that cannot be
     * loaded are left out.
     */
    @Blocking
    public synchronized void rebuild() {
        summaries.clear();
        int skipped = 0;
        for (String id : store.listIds()) {
            var session = store.loadOrNull(id);
            if (session == null) {
                skipped++;
                continue;
            }
            summaries.put(id, SessionSummary.from(session));
        }
        dirty = true;
        logger.info("Rebuilt session index: {} sessions, {} skipped", summaries.size(), skipped);
        saveIfDirty();
    }

    /* ───────────────────────── queries ─────────────────────────── */

    public synchronized @Nullable SessionSummary get(String sessionId) {
        return summaries.get(sessionId);
    }

    public synchronized int count() {
        return summaries.size();
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized List<SessionSummary> list(ListQuery query) {
        String needle = query.search() == null || query.search().isBlank()
                ? null
                : query.search().toLowerCase(Locale.ROOT);

        var matches = new ArrayList<SessionSummary>();
        for (var summary : summaries.values()) {
            if (!summary.tags().containsAll(query.tags())) {
                continue;
            }
            if (needle != null && !summary.title().toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            if (query.workingDir() != null && !query.workingDir().equals(summary.workingDir())) {
                continue;
            }
            matches.add(summary);
        }
        matches.sort(query.sortField().comparator(query.descending()));

        int from = Math.min(query.offset(), matches.size());
        int to = query.limit() <= 0
                ? matches.size()
                : (int) Math.min((long) from + query.limit(), matches.size());
        return List.copyOf(matches.subList(from, to));
    }

    public List<SessionSummary> list(
            int limit,
            int offset,
            SortField sortField,
            boolean descending,
            @Nullable Set<String> tags,
            @Nullable String search,
            @Nullable String workingDir) {
        return list(new ListQuery(limit, offset, sortField, descending, tags, search, workingDir));
    }

    /** All summaries, most recently updated first. */
    public List<SessionSummary> list() {
        return list(ListQuery.all());
    }

    /* ───────────────────────── persistence ─────────────────────────── */

    /** Writes the index file unconditionally. */
    @Blocking
    public synchronized void save() throws IOException {
        var file = new IndexFile(VERSION, new LinkedHashMap<>(summaries));
        AtomicWrites.atomicOverwrite(indexPath, Json.mapper().writeValueAsString(file));
        AtomicWrites.restrictToOwner(indexPath);
        dirty = false;
    }

    /**
     * Writes the index file if anything changed since the last write. Failures are logged and leave the index
     * dirty; the next call retries, and a lost index is rebuilt on the next start.
     */
    @Blocking
    public synchronized boolean saveIfDirty() {
        if (!dirty) {
            return false;
        }
        try {
            save();
            return true;
        } catch (IOException e) {
            logger.warn("Failed to write session index {}: {}", indexPath, e.getMessage());
            return false;
        }
    }
}
