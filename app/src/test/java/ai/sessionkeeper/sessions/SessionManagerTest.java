package ai.sessionkeeper.sessions;

import static org.junit.jupiter.api.Assertions.*;

import ai.sessionkeeper.config.SessionKeeperConfig;
import ai.sessionkeeper.config.SessionKeeperPaths;
import ai.sessionkeeper.llm.SummaryModel;
import ai.sessionkeeper.llm.SummaryModelException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SessionManagerTest {
    private static final String MODEL = "test-model";

    @TempDir
    Path tempDir;

    private SessionKeeperConfig config;
    private SessionManager manager;

    @BeforeEach
    void setUp() throws Exception {
        config = SessionKeeperConfig.defaults().withSessionsDir(tempDir.resolve("sessions"));
        manager = open(config);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static SessionManager open(SessionKeeperConfig cfg) throws Exception {
        return SessionManager.open(cfg, SessionKeeperPaths.forBaseDir(Path.of("unused")));
    }

    @Test
    public void createAddSaveAndResumeInNewManager() throws Exception {
        var session = manager.create("Test", "/work", MODEL);
        manager.addMessage(Role.USER, "Hello");
        manager.save();
        manager.close();

        manager = open(config);
        var resumed = manager.resume(session.getId());

        assertEquals("Test", resumed.getTitle());
        assertEquals(1, resumed.messageCount());
        assertEquals("Hello", resumed.getMessages().get(0).content());
        assertSame(resumed, manager.getCurrentSession());
        assertEquals(1, manager.listSessions().size());
        assertEquals(1, manager.listSessions().get(0).messageCount());
    }

    @Test
    public void mutationsRequireAnActiveSession() {
        assertFalse(manager.hasCurrentSession());
        var e = assertThrows(NoActiveSessionException.class, () -> manager.addMessage(Role.USER, "hi"));
        assertTrue(e.getMessage().contains("add message"));
        assertThrows(NoActiveSessionException.class, () -> manager.save());
        assertThrows(NoActiveSessionException.class, () -> manager.updateUsage(1, 1));
    }

    @Test
    public void hooksSeeLifecycleEventsInOrder() throws Exception {
        var events = Collections.synchronizedList(new ArrayList<SessionEvent>());
        for (var event : SessionEvent.values()) {
            manager.getHooks().register(event, (ev, session, message) -> events.add(ev));
        }

        manager.create("Hooks", "/work", MODEL);
        manager.addMessage(Role.USER, "ping");
        manager.save();
        manager.closeSession();

        assertEquals(
                List.of(
                        SessionEvent.SESSION_START,
                        SessionEvent.SESSION_MESSAGE,
                        SessionEvent.SESSION_SAVE,
                        SessionEvent.SESSION_END),
                events);
        assertFalse(manager.hasCurrentSession());
    }

    @Test
    public void failingListenerDoesNotBreakTheOperation() throws Exception {
        manager.getHooks().register(SessionEvent.SESSION_MESSAGE, (ev, session, message) -> {
            throw new IllegalStateException("listener bug");
        });
        manager.create("Hooks", "/work", MODEL);

        var stored = manager.addMessage(Role.USER, "still stored");

        assertEquals("still stored", stored.content());
        assertEquals(1, manager.getCurrentSession().messageCount());
    }

    @Test
    public void oversizedToolResultsAreTruncated() throws Exception {
        manager.close();
        manager = open(config.withToolResultMaxTokens(100));
        manager.create("Tools", "/work", MODEL);
        var big = String.join(" ", Collections.nCopies(2000, "word"));

        var stored = manager.addMessage(Message.tool("call_1", "grep", big));
        var invocation = manager.recordToolCall(
                "grep", Map.of("pattern", "x"), big, Duration.ofMillis(1500), true, null);

        assertTrue(stored.content().length() < big.length());
        assertTrue(stored.content().contains("[Output truncated - "));
        assertTrue(invocation.result().contains("[Output truncated - "));
        assertEquals(1.5, invocation.duration(), 1e-9);

        var small = manager.addMessage(Message.tool("call_2", "grep", "two matches"));
        assertEquals("two matches", small.content());
    }

    @Test
    public void resumeRecoversCorruptedSessionFromBackup() throws Exception {
        var session = manager.create("Recover me", "/work", MODEL);
        manager.addMessage(Role.USER, "important");
        manager.save();
        manager.save();
        manager.closeSession();
        Files.writeString(manager.getStore().getSessionPath(session.getId()), "{ truncated");

        var resumed = manager.resume(session.getId());

        assertEquals("Recover me", resumed.getTitle());
        assertEquals(1, resumed.messageCount());
    }

    @Test
    public void resumeUnknownSessionFails() {
        assertThrows(SessionException.NotFound.class, () -> manager.resume("does-not-exist"));
    }

    @Test
    public void resumeLatestPicksMostRecentlyUpdated() throws Exception {
        assertNull(manager.resumeLatest());

        var first = manager.create("First", "/work", MODEL);
        Thread.sleep(5);
        var second = manager.create("Second", "/work", MODEL);
        manager.resume(first.getId());
        Thread.sleep(5);
        manager.addMessage(Role.USER, "newer activity");
        manager.closeSession();

        assertEquals(first.getId(), manager.resumeLatest().getId());
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    public void resumeLatestSkipsSessionsDeletedBehindTheIndex() throws Exception {
        var older = manager.create("Older", "/work", MODEL);
        Thread.sleep(5);
        var newer = manager.create("Newer", "/work", MODEL);
        manager.closeSession();
        Files.delete(manager.getStore().getSessionPath(newer.getId()));

        assertEquals(older.getId(), manager.resumeLatest().getId());
        assertNull(manager.getIndex().get(newer.getId()));
    }

    @Test
    public void resumeOrCreateFallsBackToCreate() throws Exception {
        var created = manager.resumeOrCreate("missing-id", "Fresh", "/work", MODEL, List.of("new"));

        assertEquals("Fresh", created.getTitle());
        assertTrue(created.getTags().contains("new"));
        assertSame(created, manager.resumeOrCreate(created.getId(), null, "/work", MODEL, List.of()));
    }

    @Test
    public void deletingCurrentSessionDeactivatesIt() throws Exception {
        var session = manager.create("Doomed", "/work", MODEL);

        assertTrue(manager.delete(session.getId()));

        assertFalse(manager.hasCurrentSession());
        assertFalse(manager.isCheckpointing());
        assertFalse(manager.getStore().exists(session.getId()));
        assertNull(manager.getIndex().get(session.getId()));
        assertFalse(manager.delete(session.getId()));
    }

    @Test
    public void checkpointPersistsInBackgroundUntilClosed() throws Exception {
        manager.close();
        manager = open(config.withCheckpointInterval(Duration.ofMillis(50)));
        var session = manager.create("Checkpointed", "/work", MODEL);
        assertTrue(manager.isCheckpointing());

        manager.addMessage(Role.USER, "unsaved work");

        var path = manager.getStore().getSessionPath(session.getId());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!Files.readString(path).contains("unsaved work") && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(Files.readString(path).contains("unsaved work"));

        manager.closeSession();
        assertFalse(manager.isCheckpointing());
    }

    @Test
    public void metadataChangesReachTheIndex() throws Exception {
        var session = manager.create("Before", "/work", MODEL, List.of("a"));

        manager.setTitle("After");
        assertTrue(manager.addTag("b"));
        assertFalse(manager.addTag("b"));
        assertTrue(manager.removeTag("a"));
        manager.updateUsage(100, 20);

        var summary = manager.getIndex().get(session.getId());
        assertEquals("After", summary.title());
        assertEquals(List.of("b"), summary.tags());
        assertEquals(120, session.totalTokens());
    }

    @Test
    public void blankTitleGetsFallback() throws Exception {
        var session = manager.create("  ", "/work", MODEL);
        assertEquals(TitleGenerator.fallback(session.getCreatedAt()), session.getTitle());
    }

    @Test
    public void generateTitleUsesFirstUserLine() throws Exception {
        var session = manager.create("Draft", "/work", MODEL);
        manager.addMessage(Role.USER, "Fix the login bug\nIt fails on empty passwords");

        assertEquals("Fix the login bug", manager.generateTitle(session));
    }

    @Test
    public void generateTitleAsyncCleansModelReply() throws Exception {
        var sessionsDir = tempDir.resolve("titled");
        var store = new SessionStore(sessionsDir);
        try (var titled = new SessionManager(
                store, new SessionIndex(store), new SessionHooks(), config, (context, instruction) -> {
                    assertTrue(instruction.contains("login fails"));
                    return "\"Fix login bug\"";
                })) {
            var session = titled.create("Draft", "/work", MODEL);
            titled.addMessage(Role.USER, "login fails for users with empty passwords");

            assertEquals("Fix login bug", titled.generateTitleAsync(session).get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    public void generateTitleAsyncFallsBackWhenModelFails() throws Exception {
        var store = new SessionStore(tempDir.resolve("failing"));
        try (var titled = new SessionManager(
                store, new SessionIndex(store), new SessionHooks(), config, (context, instruction) -> {
                    throw new SummaryModelException("rate limited");
                })) {
            var session = titled.create("Draft", "/work", MODEL);
            titled.addMessage(Role.USER, "Refactor the parser");

            assertEquals("Refactor the parser", titled.generateTitleAsync(session).get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    public void hungTitleCallDoesNotBlockLaterOnes() throws Exception {
        var calls = new AtomicInteger();
        var interrupted = new CountDownLatch(1);
        var store = new SessionStore(tempDir.resolve("hung"));
        SummaryModel model = (context, instruction) -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new SummaryModelException("interrupted", e);
                }
            }
            return "Parser cleanup";
        };
        try (var titled = new SessionManager(
                store,
                new SessionIndex(store),
                new SessionHooks(),
                config.withCompactionTimeout(Duration.ofMillis(200)),
                model)) {
            var session = titled.create("Draft", "/work", MODEL);
            titled.addMessage(Role.USER, "fix the parser");

            assertEquals("fix the parser", titled.generateTitleAsync(session).get(5, TimeUnit.SECONDS));
            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
            assertEquals("Parser cleanup", titled.generateTitleAsync(session).get(5, TimeUnit.SECONDS));
            assertEquals(2, calls.get());
        }
    }

    @Test
    public void cleanupKeepsCurrentSession() throws Exception {
        manager.close();
        var strict = new SessionKeeperConfig(
                tempDir.resolve("sessions"),
                Duration.ofSeconds(60),
                50,
                5,
                10,
                500,
                Duration.ofSeconds(30),
                1000,
                1.3,
                Duration.ofDays(1),
                0);
        var store = new SessionStore(tempDir.resolve("sessions"));
        var old = Instant.now().minus(Duration.ofDays(10));
        store.save(new Session("ancient-a", "old", "/work", MODEL, old));
        store.save(new Session("ancient-b", "old", "/work", MODEL, old));

        manager = open(strict);
        manager.resume("ancient-a");

        assertEquals(List.of("ancient-b"), manager.cleanupOldSessions());
        assertTrue(manager.getStore().exists("ancient-a"));
        assertNull(manager.getIndex().get("ancient-b"));
    }
}
