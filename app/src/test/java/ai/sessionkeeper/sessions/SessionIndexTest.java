package ai.sessionkeeper.sessions;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SessionIndexTest {
    @TempDir
    Path tempDir;

    private SessionStore store;

    private Session saved(String id, String title, String workingDir, Instant created, String... tags)
            throws Exception {
        if (store == null) {
            store = new SessionStore(tempDir);
        }
        var session = new Session(id, title, workingDir, "gpt-4o", created);
        for (var tag : tags) {
            session.addTag(tag);
        }
        store.save(session);
        return session;
    }

    private void threeSessions() throws Exception {
        var base = Instant.parse("2024-01-01T00:00:00Z");
        saved("s1", "Fix login bug", "/a", base, "bug");
        saved("s2", "Add dark mode", "/b", base.plusSeconds(10), "feature", "ui");
        saved("s3", "Login page styling", "/a", base.plusSeconds(20), "ui");
    }

    @Test
    public void missingIndexFileIsRebuilt() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);

        assertEquals(3, index.count());
        assertTrue(Files.exists(index.getIndexPath()));

        Files.delete(index.getIndexPath());
        assertEquals(3, new SessionIndex(store).count());
    }

    @Test
    public void rebuiltIndexMatchesStore() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);

        index.rebuild();

        assertEquals(store.listIds().size(), index.count());
        for (var id : store.listIds()) {
            assertEquals(SessionSummary.from(store.load(id)), index.get(id));
        }
    }

    @Test
    public void unreadableOrOutdatedIndexIsRebuilt() throws Exception {
        threeSessions();
        var indexPath = tempDir.resolve(SessionStore.INDEX_FILE_NAME);

        Files.writeString(indexPath, "this is not json");
        assertEquals(3, new SessionIndex(store).count());

        Files.writeString(indexPath, "{\"version\": 99, \"sessions\": {}}");
        assertEquals(3, new SessionIndex(store).count());
    }

    @Test
    public void persistedIndexIsReusedWithoutRebuild() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);
        index.remove("s2");
        index.save();

        // s2 is still on disk, but the saved index is trusted as-is
        assertEquals(2, new SessionIndex(store).count());
    }

    @Test
    public void corruptSessionFilesAreSkippedDuringRebuild() throws Exception {
        threeSessions();
        Files.writeString(tempDir.resolve("bad.json"), "{");

        var index = new SessionIndex(store);

        assertEquals(3, index.count());
        assertNull(index.get("bad"));
    }

    @Test
    public void listFiltersSortsAndPages() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);

        assertEquals(
                List.of("s3", "s2", "s1"),
                index.list(ListQuery.all().withSort(SortField.CREATED_AT, true)).stream()
                        .map(SessionSummary::id)
                        .toList());
        assertEquals(
                List.of("s2", "s3"),
                index.list(ListQuery.all().withTags(Set.of("ui")).withSort(SortField.TITLE, false)).stream()
                        .map(SessionSummary::id)
                        .toList());
        assertEquals(
                List.of("s1", "s3"),
                index.list(0, 0, SortField.CREATED_AT, false, null, "LOGIN", null).stream()
                        .map(SessionSummary::id)
                        .toList());
        assertEquals(
                List.of("s1"),
                index.list(0, 0, SortField.CREATED_AT, false, Set.of("bug"), null, "/a").stream()
                        .map(SessionSummary::id)
                        .toList());
        assertEquals(
                List.of("s2"),
                index.list(ListQuery.all().withSort(SortField.CREATED_AT, true).withLimit(1, 1)).stream()
                        .map(SessionSummary::id)
                        .toList());
        assertTrue(index.list(ListQuery.all().withLimit(5, 10)).isEmpty());
        assertEquals(3, index.list().size());
    }

    @Test
    public void hugeLimitDoesNotOverflow() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);

        var page = index.list(Integer.MAX_VALUE, 1, SortField.CREATED_AT, true, Set.of(), null, null);

        assertEquals(List.of("s2", "s1"), page.stream().map(SessionSummary::id).toList());
    }

    @Test
    public void mutationsMarkDirtyUntilSaved() throws Exception {
        threeSessions();
        var index = new SessionIndex(store);
        assertFalse(index.isDirty());

        var session = store.load("s1");
        session.setTitle("Renamed");
        index.update(session);
        assertTrue(index.isDirty());
        assertEquals("Renamed", index.get("s1").title());

        assertTrue(index.saveIfDirty());
        assertFalse(index.isDirty());
        assertFalse(index.saveIfDirty());
        assertEquals("Renamed", new SessionIndex(store).get("s1").title());

        assertTrue(index.remove("s1"));
        assertFalse(index.remove("s1"));
    }
}
