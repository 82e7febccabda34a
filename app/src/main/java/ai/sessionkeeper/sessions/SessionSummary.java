package ai.sessionkeeper.sessions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

/** Message-free projection of a {@link Session}; the unit stored in the {@link SessionIndex}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSummary(
        String id,
        String title,
        Instant createdAt,
        Instant updatedAt,
        int messageCount,
        long totalTokens,
        List<String> tags,
        String workingDir,
        String model) {

    public SessionSummary {
        tags = tags == null ? List.of() : List.copyOf(tags);
        title = title == null ? "" : title;
        workingDir = workingDir == null ? "" : workingDir;
        model = model == null ? "" : model;
    }

    public static SessionSummary from(Session session) {
        var dto = session.toDto();
        return new SessionSummary(
                dto.id(),
                dto.title(),
                dto.createdAt(),
                dto.updatedAt(),
                dto.messages().size(),
                dto.totalPromptTokens() + dto.totalCompletionTokens(),
                dto.tags(),
                dto.workingDir(),
                dto.model());
    }
}
