package ai.sessionkeeper.sessions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** Derives session titles from the conversation. */
public final class TitleGenerator {
    private static final DateTimeFormatter FALLBACK_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final String ELLIPSIS = "...";

    private TitleGenerator() {}

    /**
     * First non-blank line of the first user message, shortened to {@code maxLength} characters with a trailing
     * ellipsis; {@code Session yyyy-MM-dd HH:mm} (UTC, from {@code createdAt}) when there is no user text.
     */
    public static String fromMessages(List<Message> messages, Instant createdAt, int maxLength) {
        for (var message : messages) {
            if (message.role() != Role.USER) {
                continue;
            }
            var line = firstNonBlankLine(message.content());
            if (line != null) {
                return shorten(line, maxLength);
            }
            break;
        }
        return fallback(createdAt);
    }

    public static String fallback(Instant createdAt) {
        return "Session " + FALLBACK_FORMAT.format(createdAt);
    }

    static String shorten(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /** Normalizes a model-suggested title; null when nothing usable remains. */
    static @Nullable String cleanModelTitle(String reply, int maxLength) {
        var line = firstNonBlankLine(reply);
        if (line == null) {
            return null;
        }
        if (line.regionMatches(true, 0, "title:", 0, 6)) {
            line = line.substring(6).strip();
        }
        while (line.length() >= 2 && isQuote(line.charAt(0)) && isQuote(line.charAt(line.length() - 1))) {
            line = line.substring(1, line.length() - 1).strip();
        }
        return line.isEmpty() ? null : shorten(line, maxLength);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static @Nullable String firstNonBlankLine(String text) {
        return text.lines().map(String::strip).filter(s -> !s.isEmpty()).findFirst().orElse(null);
    }
}
