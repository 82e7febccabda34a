package ai.sessionkeeper.context.policy;

import static org.junit.jupiter.api.Assertions.*;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.Role;
import ai.sessionkeeper.sessions.ToolCall;
import ai.sessionkeeper.testutil.WordCountEstimator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TokenBudgetPolicyTest {
    private static final WordCountEstimator estimator = WordCountEstimator.INSTANCE;

    private static List<Message> conversation() {
        var messages = new ArrayList<Message>();
        messages.add(Message.system("You are helpful")); // 8 tokens
        messages.addAll(WordCountEstimator.users(10)); // 7 tokens each
        return messages;
    }

    @Test
    public void dropsOldestUntilWithinBudget() {
        var messages = conversation();
        assertEquals(81, estimator.countMessages(messages));

        var result = new TokenBudgetPolicy().truncate(messages, 40, estimator);

        assertTrue(estimator.countMessages(result) <= 40);
        assertEquals(5, result.size());
        assertEquals(messages.get(0), result.get(0));
        assertEquals(messages.subList(7, 11), result.subList(1, 5));
    }

    @Test
    public void systemMessagesSurviveEvenOverBudget() {
        var messages = conversation();

        var result = new TokenBudgetPolicy().truncate(messages, 5, estimator);

        assertEquals(List.of(messages.get(0)), result);
    }

    @Test
    public void systemMessagesMayGoWhenNotPreserved() {
        var result = new TokenBudgetPolicy(false).truncate(conversation(), 40, estimator);

        assertTrue(result.stream().noneMatch(m -> m.role() == Role.SYSTEM));
        assertTrue(estimator.countMessages(result) <= 40);
    }

    @Test
    public void toolCallGroupIsEvictedWhole() {
        var messages = List.of(
                Message.user("look around"),
                Message.assistant("", List.of(new ToolCall("c1", "ls", "{}"))),
                Message.tool("c1", "ls", "a.txt b.txt c.txt"),
                Message.user("now summarize them please"));
        // drop the first user message only: still too big, so the whole call group goes next
        int budget = estimator.countMessages(List.of(messages.get(3))) + 5;

        var result = new TokenBudgetPolicy().truncate(messages, budget, estimator);

        assertEquals(List.of(messages.get(3)), result);
    }

    @Test
    public void idempotentOnSatisfyingInput() {
        var policy = new TokenBudgetPolicy();
        var messages = conversation();

        assertSame(messages, policy.truncate(messages, 1000, estimator));
        var once = policy.truncate(messages, 40, estimator);
        assertSame(once, policy.truncate(once, 40, estimator));
    }
}
