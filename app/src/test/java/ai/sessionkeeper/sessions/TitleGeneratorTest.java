package ai.sessionkeeper.sessions;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TitleGeneratorTest {
    private static final Instant CREATED = Instant.parse("2024-03-05T14:07:00Z");

    @Test
    public void usesFirstLineOfFirstUserMessage() {
        var messages = List.of(
                Message.system("rules"),
                Message.user("\n  Fix the login bug  \nit fails on Safari"),
                Message.user("x"));
        assertEquals("Fix the login bug", TitleGenerator.fromMessages(messages, CREATED, 50));
    }

    @Test
    public void longTitlesAreShortenedWithEllipsis() {
        var text = "a".repeat(80);
        var title = TitleGenerator.fromMessages(List.of(Message.user(text)), CREATED, 50);
        assertEquals(50, title.length());
        assertEquals("a".repeat(47) + "...", title);
    }

    @Test
    public void fallsBackToTimestamp() {
        assertEquals("Session 2024-03-05 14:07", TitleGenerator.fromMessages(List.of(), CREATED, 50));
        assertEquals(
                "Session 2024-03-05 14:07",
                TitleGenerator.fromMessages(List.of(Message.user("   ")), CREATED, 50));
    }

    @Test
    public void modelRepliesAreCleaned() {
        assertEquals("Fix login bug", TitleGenerator.cleanModelTitle("\"Fix login bug\"", 50));
        assertEquals("Refactor parser", TitleGenerator.cleanModelTitle("Title: Refactor parser\nextra", 50));
        assertNull(TitleGenerator.cleanModelTitle("  \n ", 50));
    }
}
