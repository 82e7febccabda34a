package ai.sessionkeeper.context;

import static org.junit.jupiter.api.Assertions.*;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.testutil.WordCountEstimator;
import org.junit.jupiter.api.Test;

public class ToolResultCompactorTest {
    private static final WordCountEstimator estimator = WordCountEstimator.INSTANCE;

    private static String words(int count) {
        var sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(i % 10 == 9 ? "line\n" : "word ");
        }
        return sb.toString();
    }

    @Test
    public void smallResultIsUntouched() {
        var compactor = new ToolResultCompactor(100);
        var text = words(50);
        assertSame(text, compactor.compactResult(text, estimator));
    }

    @Test
    public void largeResultIsCutAtABreakWithNotice() {
        var compactor = new ToolResultCompactor(100);
        var text = words(1000);

        var compacted = compactor.compactResult(text, estimator);

        assertTrue(compacted.length() < text.length());
        assertTrue(compacted.matches("(?s).*\\n\\[Output truncated - \\d+ tokens removed]$"), compacted);
        var kept = compacted.substring(0, compacted.indexOf("\n[Output truncated"));
        assertTrue(text.startsWith(kept));
        assertTrue(estimator.count(kept) <= 100);
        int removed = Integer.parseInt(compacted.replaceAll("(?s).*- (\\d+) tokens removed]$", "$1"));
        assertEquals(1000 - estimator.count(kept), removed);
    }

    @Test
    public void onlyToolMessagesAreCompacted() {
        var compactor = new ToolResultCompactor(100);
        var user = Message.user(words(1000));
        assertSame(user, compactor.compactMessage(user, estimator));

        var tool = Message.tool("c1", "bash", words(1000));
        var compacted = compactor.compactMessage(tool, estimator);
        assertNotSame(tool, compacted);
        assertEquals("c1", compacted.toolCallId());
        assertTrue(compacted.content().contains("[Output truncated"));
    }
}
