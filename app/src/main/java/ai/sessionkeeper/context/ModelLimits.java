package ai.sessionkeeper.context;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Context window and output reservation of a model. */
public record ModelLimits(String model, int contextWindow, int reservedOutput) {
    private static final Logger logger = LogManager.getLogger(ModelLimits.class);

    public static final int DEFAULT_CONTEXT_WINDOW = 32_768;
    public static final int DEFAULT_RESERVED_OUTPUT = 4_096;

    // more specific prefixes precede their parents
    private static final List<Map.Entry<String, int[]>> KNOWN = List.of(
            Map.entry("claude", new int[] {200_000, 8_192}),
            Map.entry("gpt-4o", new int[] {128_000, 16_384}),
            Map.entry("gpt-4-turbo", new int[] {128_000, 4_096}),
            Map.entry("gpt-4", new int[] {8_192, 4_096}),
            Map.entry("gpt-3.5-turbo", new int[] {16_385, 4_096}),
            Map.entry("o1", new int[] {200_000, 32_768}),
            Map.entry("o3", new int[] {200_000, 32_768}));

    public ModelLimits {
        if (contextWindow <= 0) {
            throw new IllegalArgumentException("contextWindow must be > 0");
        }
        if (reservedOutput < 0 || reservedOutput >= contextWindow) {
            throw new IllegalArgumentException("reservedOutput must be in [0, contextWindow)");
        }
    }

    /** Case-insensitive prefix lookup; unknown models get a conservative default. */
    public static ModelLimits forModel(String modelId) {
        var id = modelId.toLowerCase(Locale.ROOT).strip();
        var key = id.startsWith("anthropic/") ? id.substring("anthropic/".length()) : id;
        for (var entry : KNOWN) {
            if (key.startsWith(entry.getKey())) {
                var limits = entry.getValue();
                return new ModelLimits(modelId, limits[0], limits[1]);
            }
        }
        logger.warn(
                "Unknown model {}; assuming {} token window with {} reserved for output",
                modelId,
                DEFAULT_CONTEXT_WINDOW,
                DEFAULT_RESERVED_OUTPUT);
        return new ModelLimits(modelId, DEFAULT_CONTEXT_WINDOW, DEFAULT_RESERVED_OUTPUT);
    }
}
