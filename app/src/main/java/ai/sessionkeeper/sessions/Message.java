package ai.sessionkeeper.sessions;

import ai.sessionkeeper.util.JsonValues;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One conversation turn. Immutable: compaction and truncation replace messages, they never edit them.
 *
 * <p>{@code pinned} marks a message that eviction policies must keep regardless of its position.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        Role role,
        String content,
        @Nullable List<ToolCall> toolCalls,
        @Nullable String toolCallId,
        @Nullable String name,
        Instant timestamp,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean pinned,
        @Nullable Map<String, Object> metadata) {

    public static final String OMITTED_KEY = "omitted";
    public static final String SUMMARY_KEY = "summary";

    public Message {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = metadata == null ? null : JsonValues.normalizeMap(metadata);
    }

    public static Message system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return of(Role.USER, content);
    }

    public static Message assistant(String content) {
        return of(Role.ASSISTANT, content);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return new Message(Role.ASSISTANT, content, toolCalls, null, null, Instant.now(), false, null);
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return new Message(Role.TOOL, content, null, toolCallId, toolName, Instant.now(), false, null);
    }

    public static Message of(Role role, String content) {
        return new Message(role, content, null, null, null, Instant.now(), false, null);
    }

    /** The clearly marked placeholder that stands in for dropped messages. */
    public static Message omissionMarker(int omittedCount) {
        return new Message(
                Role.SYSTEM,
                "[%d messages omitted]".formatted(omittedCount),
                null,
                null,
                null,
                Instant.now(),
                false,
                Map.of(OMITTED_KEY, omittedCount));
    }

    public Message withContent(String newContent) {
        return new Message(role, newContent, toolCalls, toolCallId, name, timestamp, pinned, metadata);
    }

    public Message withPinned(boolean newPinned) {
        return new Message(role, content, toolCalls, toolCallId, name, timestamp, newPinned, metadata);
    }

    public Message withMetadata(String key, Object value) {
        var copy = metadata == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Message(role, content, toolCalls, toolCallId, name, timestamp, pinned, copy);
    }

    @JsonIgnore
    public boolean isSystem() {
        return role == Role.SYSTEM;
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean isOmissionMarker() {
        return metadata != null && metadata.containsKey(OMITTED_KEY);
    }

    @JsonIgnore
    public boolean isSummary() {
        return metadata != null && Boolean.TRUE.equals(metadata.get(SUMMARY_KEY));
    }
}
