package ai.sessionkeeper.config;

import ai.sessionkeeper.util.AtomicWrites;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables for session persistence and context management, loaded from {@code sessionkeeper.properties}.
 *
 * <p>Missing keys take their defaults; values that do not parse or fall outside the key's range are logged and
 * replaced by the default.
 */
public record SessionKeeperConfig(
        @Nullable Path sessionsDir,
        Duration checkpointInterval,
        int titleMaxLength,
        int compactionMinMessages,
        int compactionPreserveLast,
        int compactionMaxSummaryTokens,
        Duration compactionTimeout,
        int toolResultMaxTokens,
        double tokensPerWord,
        Duration cleanupMaxAge,
        int cleanupKeepMinimum) {
    private static final Logger logger = LogManager.getLogger(SessionKeeperConfig.class);

    public static final String SESSIONS_DIR = "sessions.dir";
    public static final String CHECKPOINT_INTERVAL_SECONDS = "checkpoint.intervalSeconds";
    public static final String TITLE_MAX_LENGTH = "title.maxLength";
    public static final String COMPACTION_MIN_MESSAGES = "compaction.minMessages";
    public static final String COMPACTION_PRESERVE_LAST = "compaction.preserveLast";
    public static final String COMPACTION_MAX_SUMMARY_TOKENS = "compaction.maxSummaryTokens";
    public static final String COMPACTION_TIMEOUT_SECONDS = "compaction.timeoutSeconds";
    public static final String TOOL_RESULT_MAX_TOKENS = "toolResult.maxTokens";
    public static final String TOKENS_PER_WORD = "tokens.perWord";
    public static final String CLEANUP_MAX_AGE_DAYS = "cleanup.maxAgeDays";
    public static final String CLEANUP_KEEP_MINIMUM = "cleanup.keepMinimum";

    public SessionKeeperConfig {
        if (checkpointInterval.isNegative() || checkpointInterval.isZero()) {
            throw new IllegalArgumentException("checkpointInterval must be > 0");
        }
        if (titleMaxLength < 4) {
            throw new IllegalArgumentException("titleMaxLength must be >= 4");
        }
        if (compactionMinMessages < 1 || compactionPreserveLast < 0) {
            throw new IllegalArgumentException("invalid compaction message bounds");
        }
        if (toolResultMaxTokens <= 0 || tokensPerWord <= 0) {
            throw new IllegalArgumentException("token limits must be > 0");
        }
    }

    public static SessionKeeperConfig defaults() {
        return new SessionKeeperConfig(
                null,
                Duration.ofSeconds(60),
                50,
                5,
                10,
                500,
                Duration.ofSeconds(30),
                1000,
                1.3,
                Duration.ofDays(30),
                10);
    }

    public SessionKeeperConfig withSessionsDir(Path dir) {
        return new SessionKeeperConfig(
                dir,
                checkpointInterval,
                titleMaxLength,
                compactionMinMessages,
                compactionPreserveLast,
                compactionMaxSummaryTokens,
                compactionTimeout,
                toolResultMaxTokens,
                tokensPerWord,
                cleanupMaxAge,
                cleanupKeepMinimum);
    }

    public SessionKeeperConfig withCheckpointInterval(Duration interval) {
        return new SessionKeeperConfig(
                sessionsDir,
                interval,
                titleMaxLength,
                compactionMinMessages,
                compactionPreserveLast,
                compactionMaxSummaryTokens,
                compactionTimeout,
                toolResultMaxTokens,
                tokensPerWord,
                cleanupMaxAge,
                cleanupKeepMinimum);
    }

    public SessionKeeperConfig withCompactionTimeout(Duration timeout) {
        return new SessionKeeperConfig(
                sessionsDir,
                checkpointInterval,
                titleMaxLength,
                compactionMinMessages,
                compactionPreserveLast,
                compactionMaxSummaryTokens,
                timeout,
                toolResultMaxTokens,
                tokensPerWord,
                cleanupMaxAge,
                cleanupKeepMinimum);
    }

    public SessionKeeperConfig withToolResultMaxTokens(int maxTokens) {
        return new SessionKeeperConfig(
                sessionsDir,
                checkpointInterval,
                titleMaxLength,
                compactionMinMessages,
                compactionPreserveLast,
                compactionMaxSummaryTokens,
                compactionTimeout,
                maxTokens,
                tokensPerWord,
                cleanupMaxAge,
                cleanupKeepMinimum);
    }

    /** The configured sessions directory, or the platform default under {@code paths}. */
    public Path resolveSessionsDir(SessionKeeperPaths paths) {
        return sessionsDir != null ? sessionsDir : paths.getDefaultSessionsDir();
    }

    /** Loads the config file, returning defaults when it is absent or unreadable. */
    public static SessionKeeperConfig load(Path configFile) {
        var props = new Properties();
        if (Files.exists(configFile)) {
            try (var reader = Files.newBufferedReader(configFile)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Failed to load configuration from {}: {}", configFile, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    public static SessionKeeperConfig fromProperties(Properties props) {
        var d = defaults();
        String dir = props.getProperty(SESSIONS_DIR);
        return new SessionKeeperConfig(
                dir == null || dir.isBlank() ? null : Path.of(dir.trim()),
                Duration.ofSeconds(
                        intValue(props, CHECKPOINT_INTERVAL_SECONDS, (int) d.checkpointInterval.toSeconds(), 1)),
                intValue(props, TITLE_MAX_LENGTH, d.titleMaxLength, 4),
                intValue(props, COMPACTION_MIN_MESSAGES, d.compactionMinMessages, 1),
                intValue(props, COMPACTION_PRESERVE_LAST, d.compactionPreserveLast, 0),
                intValue(props, COMPACTION_MAX_SUMMARY_TOKENS, d.compactionMaxSummaryTokens, 1),
                Duration.ofSeconds(
                        intValue(props, COMPACTION_TIMEOUT_SECONDS, (int) d.compactionTimeout.toSeconds(), 1)),
                intValue(props, TOOL_RESULT_MAX_TOKENS, d.toolResultMaxTokens, 1),
                positiveDouble(props, TOKENS_PER_WORD, d.tokensPerWord),
                Duration.ofDays(intValue(props, CLEANUP_MAX_AGE_DAYS, (int) d.cleanupMaxAge.toDays(), 1)),
                intValue(props, CLEANUP_KEEP_MINIMUM, d.cleanupKeepMinimum, 0));
    }

    public Properties toProperties() {
        var props = new Properties();
        if (sessionsDir != null) {
            props.setProperty(SESSIONS_DIR, sessionsDir.toString());
        }
        props.setProperty(CHECKPOINT_INTERVAL_SECONDS, Long.toString(checkpointInterval.toSeconds()));
        props.setProperty(TITLE_MAX_LENGTH, Integer.toString(titleMaxLength));
        props.setProperty(COMPACTION_MIN_MESSAGES, Integer.toString(compactionMinMessages));
        props.setProperty(COMPACTION_PRESERVE_LAST, Integer.toString(compactionPreserveLast));
        props.setProperty(COMPACTION_MAX_SUMMARY_TOKENS, Integer.toString(compactionMaxSummaryTokens));
        props.setProperty(COMPACTION_TIMEOUT_SECONDS, Long.toString(compactionTimeout.toSeconds()));
        props.setProperty(TOOL_RESULT_MAX_TOKENS, Integer.toString(toolResultMaxTokens));
        props.setProperty(TOKENS_PER_WORD, Double.toString(tokensPerWord));
        props.setProperty(CLEANUP_MAX_AGE_DAYS, Long.toString(cleanupMaxAge.toDays()));
        props.setProperty(CLEANUP_KEEP_MINIMUM, Integer.toString(cleanupKeepMinimum));
        return props;
    }

    public void save(Path configFile) throws IOException {
        AtomicWrites.atomicSaveProperties(configFile, toProperties(), "SessionKeeper configuration");
    }

    /** Parses an int in {@code [min, Integer.MAX_VALUE]}; anything else is logged and replaced by the default. */
    private static int intValue(Properties props, String key, int defaultValue, int min) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value >= min && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            logger.warn("Ignoring out-of-range value '{}' for {} (minimum {}), using {}", raw, key, min, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable value '{}' for {}, using {}", raw, key, defaultValue);
        }
        return defaultValue;
    }

    private static double positiveDouble(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value > 0 && Double.isFinite(value)) {
                return value;
            }
            logger.warn("Ignoring out-of-range value '{}' for {}, using {}", raw, key, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable value '{}' for {}, using {}", raw, key, defaultValue);
        }
        return defaultValue;
    }
}
