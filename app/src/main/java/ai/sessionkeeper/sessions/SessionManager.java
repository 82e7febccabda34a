package ai.sessionkeeper.sessions;

import ai.sessionkeeper.config.SessionKeeperConfig;
import ai.sessionkeeper.config.SessionKeeperPaths;
import ai.sessionkeeper.context.ToolResultCompactor;
import ai.sessionkeeper.llm.SummaryModel;
import ai.sessionkeeper.tokens.ApproximateTokenEstimator;
import ai.sessionkeeper.tokens.CachingTokenEstimator;
import ai.sessionkeeper.tokens.TokenEstimator;
import ai.sessionkeeper.tokens.TokenEstimators;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the current session: creates, resumes, saves and closes it, keeps the {@link SessionIndex} in step with the
 * {@link SessionStore}, checkpoints in the background and notifies {@link SessionHooks}.
 *
 * <p>Lifecycle and mutation methods are {@code synchronized}. The checkpoint thread persists through
 * {@link #persist(Session)}, which takes only the store and index locks, so a foreground call waiting on
 * {@link AutoCheckpoint#stop()} cannot deadlock with it.
 */
public class SessionManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionManager.class);

    static final int TITLE_PROMPT_CHARS = 500;
    static final String TITLE_PROMPT =
            """
            Write a short title (at most %d characters) for a coding session that begins with the request below.
            Reply with the title only.

            Request:
            %s""";

    private final SessionStore store;
    private final SessionIndex index;
    private final SessionHooks hooks;
    private final SessionKeeperConfig config;
    private final @Nullable SummaryModel titleModel;
    private final AutoCheckpoint checkpoint;
    private final ToolResultCompactor toolResultCompactor;
    private final ExecutorService titleExecutor = Executors.newSingleThreadExecutor(r -> {
        var t = new Thread(r, "SessionTitle");
        t.setDaemon(true);
        return t;
    });

    private @Nullable Session current;
    private TokenEstimator estimator;

    public SessionManager(SessionStore store, SessionIndex index, SessionHooks hooks, SessionKeeperConfig config) {
        this(store, index, hooks, config, null);
    }

    public SessionManager(
            SessionStore store,
            SessionIndex index,
            SessionHooks hooks,
            SessionKeeperConfig config,
            @Nullable SummaryModel titleModel) {
        this.store = Objects.requireNonNull(store);
        this.index = Objects.requireNonNull(index);
        this.hooks = Objects.requireNonNull(hooks);
        this.config = Objects.requireNonNull(config);
        this.titleModel = titleModel;
        this.checkpoint = new AutoCheckpoint(config.checkpointInterval(), this::persist);
        this.toolResultCompactor = new ToolResultCompactor(config.toolResultMaxTokens());
        this.estimator = new CachingTokenEstimator(new ApproximateTokenEstimator(
                config.tokensPerWord(), ApproximateTokenEstimator.DEFAULT_TOKENS_PER_CHAR));
    }

    /** Wires store, index and hooks over the sessions directory named by {@code config}. */
    @Blocking
    public static SessionManager open(SessionKeeperConfig config, SessionKeeperPaths paths) throws IOException {
        var store = new SessionStore(config.resolveSessionsDir(paths));
        Files.createDirectories(store.getSessionsDir());
        return new SessionManager(store, new SessionIndex(store), new SessionHooks(), config);
    }

    public SessionStore getStore() {
        return store;
    }

    public SessionIndex getIndex() {
        return index;
    }

    public SessionHooks getHooks() {
        return hooks;
    }

    public SessionKeeperConfig getConfig() {
        return config;
    }

    /* ───────────────────────── lifecycle ─────────────────────────── */

    /**
     * Creates, persists and activates a new session, closing the current one first. A blank title is replaced by
     * one generated from the conversation.
     */
    @Blocking
    public synchronized Session create(
            @Nullable String title, String workingDir, String model, Collection<String> tags) throws SessionException {
        closeCurrentQuietly();
        var session = new Session("", workingDir, model);
        session.setTitle(title == null || title.isBlank() ? generateTitle(session) : title.strip());
        tags.forEach(session::addTag);

        persist(session);
        activate(session);
        logger.info("Created session {} ('{}') in {}", session.getId(), session.getTitle(), workingDir);
        return session;
    }

    public synchronized Session create(@Nullable String title, String workingDir, String model)
            throws SessionException {
        return create(title, workingDir, model, List.of());
    }

    /**
     * Loads and activates a stored session. A corrupted file is restored from its backup once before giving up.
     *
     * @throws SessionException.NotFound if no such session exists
     * @throws SessionException.Corrupted if neither the file nor its backup can be read
     */
    @Blocking
    public synchronized Session resume(String sessionId) throws SessionException {
        if (current != null && current.getId().equals(sessionId)) {
            return current;
        }
        Session session;
        try {
            session = store.load(sessionId);
        } catch (SessionException.Corrupted e) {
            logger.warn("Session {} is corrupted ({}); trying backup", sessionId, e.getMessage());
            if (!store.recoverFromBackup(sessionId)) {
                throw e;
            }
            session = store.load(sessionId);
        }
        closeCurrentQuietly();
        index.update(session);
        index.saveIfDirty();
        activate(session);
        logger.info("Resumed session {} ('{}', {} messages)", sessionId, session.getTitle(), session.messageCount());
        return session;
    }

    /** Resumes the most recently updated session, or returns null when there is none. */
    @Blocking
    public synchronized @Nullable Session resumeLatest() throws SessionException {
        for (var summary : index.list()) {
            try {
                return resume(summary.id());
            } catch (SessionException.NotFound e) {
                logger.warn("Indexed session {} no longer exists; dropping it from the index", summary.id());
                index.remove(summary.id());
            }
        }
        index.saveIfDirty();
        return null;
    }

    /** Resumes {@code sessionId} when given and present, otherwise creates a new session. */
    @Blocking
    public synchronized Session resumeOrCreate(
            @Nullable String sessionId,
            @Nullable String title,
            String workingDir,
            String model,
            Collection<String> tags)
            throws SessionException {
        if (sessionId != null) {
            try {
                return resume(sessionId);
            } catch (SessionException.NotFound e) {
                logger.info("Session {} not found; creating a new one", sessionId);
            }
        }
        return create(title, workingDir, model, tags);
    }

    private void activate(Session session) {
        current = session;
        estimator = TokenEstimators.forModel(session.getModel(), config.tokensPerWord());
        checkpoint.start(session);
        hooks.fire(SessionEvent.SESSION_START, session);
    }

    /** Saves the current session. */
    @Blocking
    public synchronized void save() throws SessionException {
        save(requireCurrent("save"));
    }

    @Blocking
    public synchronized void save(Session session) throws SessionException {
        persist(session);
        hooks.fire(SessionEvent.SESSION_SAVE, session);
    }

    /** Writes the session and refreshes its index entry. Called from the checkpoint thread too. */
    @Blocking
    void persist(Session session) throws SessionException.StorageFailure {
        store.save(session);
        index.update(session);
        index.saveIfDirty();
    }

    /** Closes the current session, if any. */
    @Blocking
    public synchronized void closeSession() throws SessionException {
        if (current != null) {
            closeSession(current);
        }
    }

    /**
     * Stops checkpointing, saves the session a final time and fires {@link SessionEvent#SESSION_END}. The session
     * stops being current even when the final save fails.
     */
    @Blocking
    public synchronized void closeSession(Session session) throws SessionException {
        boolean isCurrent = current != null && current.getId().equals(session.getId());
        if (isCurrent) {
            checkpoint.stop();
        }
        try {
            persist(session);
        } finally {
            hooks.fire(SessionEvent.SESSION_END, session);
            if (isCurrent) {
                current = null;
            }
            logger.info("Closed session {}", session.getId());
        }
    }

    private void closeCurrentQuietly() {
        if (current == null) {
            return;
        }
        try {
            closeSession(current);
        } catch (SessionException e) {
            logger.error("Final save of session {} failed: {}", e.getSessionId(), e.getMessage());
        }
    }

    /** Deletes a session from disk and index; deleting the current session deactivates it without saving. */
    @Blocking
    public synchronized boolean delete(String sessionId) throws SessionException {
        if (current != null && current.getId().equals(sessionId)) {
            checkpoint.stop();
            current = null;
        }
        boolean existed = store.delete(sessionId);
        index.remove(sessionId);
        index.saveIfDirty();
        return existed;
    }

    /* ───────────────────────── mutation ─────────────────────────── */

    public Message addMessage(Role role, String content) {
        return addMessage(Message.of(role, content));
    }

    /**
     * Appends to the current session. Tool results over the configured ceiling are truncated first.
     *
     * @return the message as stored
     * @throws NoActiveSessionException if no session is current
     */
    public synchronized Message addMessage(Message message) {
        var session = requireCurrent("add message");
        var stored = toolResultCompactor.compactMessage(message, estimator);
        session.addMessage(stored);
        hooks.fire(SessionEvent.SESSION_MESSAGE, session, stored);
        return stored;
    }

    public synchronized ToolInvocation recordToolCall(
            String toolName,
            Map<String, Object> arguments,
            @Nullable String result,
            Duration duration,
            boolean success,
            @Nullable String error) {
        var session = requireCurrent("record tool call");
        var invocation = new ToolInvocation(
                Session.newId(),
                toolName,
                arguments,
                result == null ? null : toolResultCompactor.compactResult(result, estimator),
                Instant.now(),
                duration.toNanos() / 1_000_000_000d,
                success,
                error);
        session.recordToolInvocation(invocation);
        return invocation;
    }

    public synchronized void updateUsage(long promptTokens, long completionTokens) {
        requireCurrent("update usage").updateUsage(promptTokens, completionTokens);
    }

    public synchronized void setTitle(String title) {
        var session = requireCurrent("set title");
        session.setTitle(title);
        index.update(session);
    }

    public synchronized boolean addTag(String tag) {
        var session = requireCurrent("add tag");
        boolean added = session.addTag(tag);
        if (added) {
            index.update(session);
        }
        return added;
    }

    public synchronized boolean removeTag(String tag) {
        var session = requireCurrent("remove tag");
        boolean removed = session.removeTag(tag);
        if (removed) {
            index.update(session);
        }
        return removed;
    }

    /* ───────────────────────── titles ─────────────────────────── */

    public String generateTitle(Session session) {
        return TitleGenerator.fromMessages(session.getMessages(), session.getCreatedAt(), config.titleMaxLength());
    }

    /**
     * Asks the title model for a title, falling back to {@link #generateTitle(Session)} when there is no model, no
     * user message, or the model fails or times out. Never completes exceptionally.
     */
    public CompletableFuture<String> generateTitleAsync(Session session) {
        var fallback = generateTitle(session);
        var firstUser = session.getMessages().stream()
                .filter(m -> m.role() == Role.USER && !m.content().isBlank())
                .findFirst();
        if (titleModel == null || firstUser.isEmpty()) {
            return CompletableFuture.completedFuture(fallback);
        }
        var request = firstUser.get().content();
        if (request.length() > TITLE_PROMPT_CHARS) {
            request = request.substring(0, TITLE_PROMPT_CHARS);
        }
        var prompt = TITLE_PROMPT.formatted(config.titleMaxLength(), request);
        return titleModel.completeAsync(List.of(), prompt, titleExecutor, config.compactionTimeout())
                .handle((reply, error) -> {
                    if (error != null) {
                        logger.warn("Title generation failed for session {}: {}", session.getId(), error.toString());
                        return fallback;
                    }
                    var title = TitleGenerator.cleanModelTitle(reply, config.titleMaxLength());
                    return title == null ? fallback : title;
                });
    }

    /* ───────────────────────── queries ─────────────────────────── */

    public List<SessionSummary> listSessions(ListQuery query) {
        return index.list(query);
    }

    public List<SessionSummary> listSessions() {
        return index.list();
    }

    public synchronized @Nullable Session getCurrentSession() {
        return current;
    }

    public synchronized boolean hasCurrentSession() {
        return current != null;
    }

    public boolean isCheckpointing() {
        return checkpoint.isRunning();
    }

    /** Deletes sessions past the configured age, keeping the configured minimum and the current session. */
    @Blocking
    public synchronized List<String> cleanupOldSessions() {
        var keep = current == null ? Set.<String>of() : Set.of(current.getId());
        var deleted = store.cleanupOlderThan(config.cleanupMaxAge(), config.cleanupKeepMinimum(), keep);
        deleted.forEach(index::remove);
        index.saveIfDirty();
        return deleted;
    }

    private Session requireCurrent(String operation) {
        if (current == null) {
            throw new NoActiveSessionException(operation);
        }
        return current;
    }

    /** Closes the current session, then stops background work. */
    @Override
    public synchronized void close() {
        closeCurrentQuietly();
        checkpoint.close();
        titleExecutor.shutdownNow();
        index.saveIfDirty();
    }
}
