package ai.sessionkeeper.context;

import static org.junit.jupiter.api.Assertions.*;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.testutil.WordCountEstimator;
import java.util.List;
import org.junit.jupiter.api.Test;

public class BudgetTrackerTest {
    private static final WordCountEstimator estimator = WordCountEstimator.INSTANCE;

    private static BudgetTracker tracker() {
        return new BudgetTracker(new ModelLimits("test", 100, 20), estimator);
    }

    @Test
    public void currentTokensIsSumOfParts() {
        var tracker = tracker();
        tracker.setSystemPrompt("be brief"); // 2 + 5
        tracker.setToolSchemas(List.of("{\"name\": \"ls\"}", "{\"name\": \"cat\"}")); // 2 + 2
        tracker.add(Message.user("hello there")); // 7
        tracker.addAll(List.of(Message.assistant("hi"))); // 6

        assertEquals(7, tracker.systemTokens());
        assertEquals(4, tracker.toolTokens());
        assertEquals(13, tracker.messageTokens());
        assertEquals(24, tracker.currentTokens());
        assertEquals(56, tracker.available());
        assertEquals(69, tracker.messageBudget());
        assertEquals(24 / 80.0, tracker.utilization(), 1e-9);
        assertFalse(tracker.exceedsLimit());
    }

    @Test
    public void exceedingTheLimitIsReportedNotThrown() {
        var tracker = tracker();
        tracker.setMessages(WordCountEstimator.users(12)); // 84

        assertTrue(tracker.exceedsLimit());
        assertEquals(0, tracker.available());
        assertTrue(tracker.utilization() > 1.0);
    }

    @Test
    public void resetKeepsOverhead() {
        var tracker = tracker();
        tracker.setSystemPrompt("be brief");
        tracker.addAll(WordCountEstimator.users(3));

        tracker.reset();

        assertEquals(0, tracker.messageTokens());
        assertEquals(7, tracker.currentTokens());
        assertTrue(tracker.messages().isEmpty());
    }

    @Test
    public void emptySystemPromptCostsNothing() {
        var tracker = tracker();
        tracker.setSystemPrompt("");
        assertEquals(0, tracker.currentTokens());
    }
}
