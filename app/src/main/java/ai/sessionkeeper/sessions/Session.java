package ai.sessionkeeper.sessions;

import ai.sessionkeeper.util.JsonValues;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Aggregate root for one conversation: ordered messages, tool log, usage counters and metadata.
 *
 * <p>All methods are {@code synchronized}: the owning {@link SessionManager} mutates from the foreground while the
 * checkpoint task serializes from a background thread. Accessors return immutable copies.
 *
 * <p>Invariants: the id never changes, {@code updatedAt} never moves backwards and is refreshed by every mutation,
 * messages stay in insertion order, and token counters only grow until {@link #resetUsage()}.
 */
public final class Session {
    private final String id;
    private final Instant createdAt;
    private String title;
    private Instant updatedAt;
    private String workingDirectory;
    private String model;
    private final List<Message> messages = new ArrayList<>();
    private final List<ToolInvocation> toolHistory = new ArrayList<>();
    private long totalPromptTokens;
    private long totalCompletionTokens;
    private final Set<String> tags = new LinkedHashSet<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public Session(String title, String workingDirectory, String model) {
        this(newId(), title, workingDirectory, model, Instant.now());
    }

    public Session(String id, String title, String workingDirectory, String model, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.model = Objects.requireNonNull(model, "model");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    /** Time-ordered identifiers sort by creation time, which keeps directory listings readable. */
    public static String newId() {
        return UuidCreator.getTimeOrderedEpoch().toString();
    }

    static Session fromDto(SessionDto dto) {
        var session = new Session(dto.id(), dto.title(), dto.workingDir(), dto.model(), dto.createdAt());
        session.messages.addAll(dto.messages());
        session.toolHistory.addAll(dto.toolHistory());
        session.totalPromptTokens = dto.totalPromptTokens();
        session.totalCompletionTokens = dto.totalCompletionTokens();
        session.tags.addAll(dto.tags());
        session.metadata.putAll(dto.metadata());
        session.updatedAt = dto.updatedAt().isBefore(dto.createdAt()) ? dto.createdAt() : dto.updatedAt();
        return session;
    }

    synchronized SessionDto toDto() {
        return new SessionDto(
                id,
                title,
                createdAt,
                updatedAt,
                workingDirectory,
                model,
                List.copyOf(messages),
                List.copyOf(toolHistory),
                totalPromptTokens,
                totalCompletionTokens,
                List.copyOf(tags),
                new LinkedHashMap<>(metadata));
    }

    /** Deep enough copy for callers that need a stable snapshot; messages themselves are immutable. */
    public Session copy() {
        return fromDto(toDto());
    }

    private void touch() {
        var now = Instant.now();
        if (now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    /* ───────────────────────── messages ─────────────────────────── */

    public synchronized void addMessage(Message message) {
        messages.add(Objects.requireNonNull(message));
        touch();
    }

    public synchronized void addMessages(Collection<Message> newMessages) {
        newMessages.forEach(Objects::requireNonNull);
        messages.addAll(newMessages);
        touch();
    }

    /** Replaces the whole message list, e.g. with the output of a compaction. */
    public synchronized void replaceMessages(List<Message> replacement) {
        replacement.forEach(Objects::requireNonNull);
        messages.clear();
        messages.addAll(replacement);
        touch();
    }

    public synchronized void clearMessages() {
        messages.clear();
        touch();
    }

    public synchronized List<Message> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized int messageCount() {
        return messages.size();
    }

    /* ───────────────────────── tools & usage ─────────────────────────── */

    public synchronized void recordToolInvocation(ToolInvocation invocation) {
        toolHistory.add(Objects.requireNonNull(invocation));
        touch();
    }

    public synchronized List<ToolInvocation> getToolHistory() {
        return List.copyOf(toolHistory);
    }

    public synchronized void updateUsage(long promptTokens, long completionTokens) {
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException(
                    "Token usage deltas must be >= 0, got prompt=%d completion=%d"
                            .formatted(promptTokens, completionTokens));
        }
        totalPromptTokens += promptTokens;
        totalCompletionTokens += completionTokens;
        touch();
    }

    public synchronized void resetUsage() {
        totalPromptTokens = 0;
        totalCompletionTokens = 0;
        touch();
    }

    public synchronized long getTotalPromptTokens() {
        return totalPromptTokens;
    }

    public synchronized long getTotalCompletionTokens() {
        return totalCompletionTokens;
    }

    public synchronized long totalTokens() {
        return totalPromptTokens + totalCompletionTokens;
    }

    /* ───────────────────────── metadata ─────────────────────────── */

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized String getTitle() {
        return title;
    }

    public synchronized void setTitle(String title) {
        this.title = Objects.requireNonNull(title);
        touch();
    }

    public synchronized String getWorkingDirectory() {
        return workingDirectory;
    }

    public synchronized void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory);
        touch();
    }

    public synchronized String getModel() {
        return model;
    }

    public synchronized void setModel(String model) {
        this.model = Objects.requireNonNull(model);
        touch();
    }

    public synchronized Set<String> getTags() {
        return Set.copyOf(tags);
    }

    /** Tags in the order they were added. */
    public synchronized List<String> getTagList() {
        return List.copyOf(tags);
    }

    public synchronized boolean addTag(String tag) {
        boolean added = tags.add(Objects.requireNonNull(tag));
        if (added) {
            touch();
        }
        return added;
    }

    public synchronized boolean removeTag(String tag) {
        boolean removed = tags.remove(tag);
        if (removed) {
            touch();
        }
        return removed;
    }

    public synchronized Map<String, Object> getMetadata() {
        return new LinkedHashMap<>(metadata);
    }

    public synchronized @Nullable Object getMetadata(String key) {
        return metadata.get(key);
    }

    public synchronized void setMetadata(String key, @Nullable Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, JsonValues.normalize(value));
        }
        touch();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Session other)) {
            return false;
        }
        return toDto().equals(other.toDto());
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Session[%s '%s', %d messages]".formatted(id, getTitle(), messageCount());
    }
}
