package ai.sessionkeeper.sessions;

import ai.sessionkeeper.util.JsonValues;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Record of one executed tool call. {@code duration} is wall-clock seconds. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolInvocation(
        String id,
        String toolName,
        Map<String, Object> arguments,
        @Nullable String result,
        Instant timestamp,
        double duration,
        boolean success,
        @Nullable String error) {

    public ToolInvocation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(toolName, "toolName");
        arguments = arguments == null ? Map.of() : JsonValues.normalizeMap(arguments);
        timestamp = timestamp == null ? Instant.now() : timestamp;
        if (duration < 0) {
            throw new IllegalArgumentException("duration must be >= 0");
        }
    }

    @JsonIgnore
    public Duration asDuration() {
        return Duration.ofNanos(Math.round(duration * 1_000_000_000d));
    }
}
