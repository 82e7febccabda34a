package ai.sessionkeeper.sessions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/** A tool invocation requested by the assistant. {@code arguments} is the raw JSON argument string. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(String id, String name, String arguments) {
    public ToolCall {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? "" : arguments;
    }
}
