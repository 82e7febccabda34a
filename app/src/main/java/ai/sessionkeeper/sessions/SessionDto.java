package ai.sessionkeeper.sessions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** On-disk shape of a session file. Field names are part of the file format. */
@JsonIgnoreProperties(ignoreUnknown = true)
record SessionDto(
        String id,
        String title,
        Instant createdAt,
        Instant updatedAt,
        String workingDir,
        String model,
        List<Message> messages,
        List<ToolInvocation> toolHistory,
        long totalPromptTokens,
        long totalCompletionTokens,
        List<String> tags,
        Map<String, Object> metadata) {

    SessionDto {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        title = title == null ? "" : title;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
        workingDir = workingDir == null ? "" : workingDir;
        model = model == null ? "" : model;
        messages = messages == null ? List.of() : messages;
        toolHistory = toolHistory == null ? List.of() : toolHistory;
        tags = tags == null ? List.of() : tags;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
