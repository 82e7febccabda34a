package ai.sessionkeeper.context.policy;

import static org.junit.jupiter.api.Assertions.*;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.testutil.WordCountEstimator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SmartTruncationPolicyTest {
    private static final WordCountEstimator estimator = WordCountEstimator.INSTANCE;

    @Test
    public void keepsHeadAndTailWithOneMarker() {
        var messages = WordCountEstimator.users(10);

        var result = new SmartTruncationPolicy(2, 3).truncate(messages, 60, estimator);

        assertEquals(6, result.size());
        assertEquals(messages.subList(0, 2), result.subList(0, 2));
        assertEquals(messages.subList(7, 10), result.subList(3, 6));
        var marker = result.get(2);
        assertTrue(marker.isOmissionMarker());
        assertTrue(marker.isSystem());
        assertEquals("[5 messages omitted]", marker.content());
        assertEquals(1, result.stream().filter(Message::isOmissionMarker).count());
        assertTrue(estimator.countMessages(result) <= 60);
    }

    @Test
    public void systemMessagesAreAlwaysKept() {
        var messages = new ArrayList<Message>();
        messages.add(Message.system("rules"));
        messages.addAll(WordCountEstimator.users(10));

        var result = new SmartTruncationPolicy(1, 1).truncate(messages, 40, estimator);

        assertEquals(messages.get(0), result.get(0));
        assertEquals(messages.get(1), result.get(1));
        assertTrue(result.get(2).isOmissionMarker());
        assertEquals(messages.get(10), result.get(3));
    }

    @Test
    public void shrinksFurtherWhenHeadAndTailStillTooBig() {
        var messages = WordCountEstimator.users(10);

        var result = new SmartTruncationPolicy(2, 3).truncate(messages, 40, estimator);

        assertTrue(estimator.countMessages(result) <= 40);
        var markers = result.stream().filter(Message::isOmissionMarker).toList();
        assertEquals(1, markers.size());
        assertEquals("[6 messages omitted]", markers.get(0).content());
        assertEquals(messages.get(9), result.get(result.size() - 1));
    }

    @Test
    public void placesMarkerEvenWhenInputFits() {
        var messages = WordCountEstimator.users(10);

        var result = new SmartTruncationPolicy(2, 3).truncate(messages, 100_000, estimator);

        assertEquals(6, result.size());
        assertEquals(messages.subList(0, 2), result.subList(0, 2));
        assertEquals("[5 messages omitted]", result.get(2).content());
        assertEquals(messages.subList(7, 10), result.subList(3, 6));
    }

    @Test
    public void shortInputIsReturnedAsIs() {
        var messages = WordCountEstimator.users(5);

        assertSame(messages, new SmartTruncationPolicy(2, 3).truncate(messages, 100_000, estimator));
    }

    @Test
    public void secondPassChangesNothing() {
        var policy = new SmartTruncationPolicy(2, 3);
        var messages = WordCountEstimator.users(10);

        var once = policy.truncate(messages, 1000, estimator);
        assertEquals(1, once.stream().filter(Message::isOmissionMarker).count());
        assertSame(once, policy.truncate(once, 1000, estimator));

        var tight = policy.truncate(messages, 60, estimator);
        assertSame(tight, policy.truncate(tight, 60, estimator));
    }

    @Test
    public void earlierMarkerIsMergedIntoNewOne() {
        var policy = new SmartTruncationPolicy(1, 1, false);
        var once = policy.truncate(WordCountEstimator.users(6), 1000, estimator);
        assertEquals("[4 messages omitted]", once.get(1).content());

        var again = new SmartTruncationPolicy(0, 1, false).truncate(once, 1000, estimator);

        assertEquals(2, again.size());
        assertEquals("[5 messages omitted]", again.get(0).content());
        assertEquals("message 5", again.get(1).content());
    }

    @Test
    public void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> new SmartTruncationPolicy(-1, 2));
    }

    @Test
    public void dropsMarkerAsLastResort() {
        List<Message> messages = WordCountEstimator.users(3);

        var result = new SmartTruncationPolicy(1, 1).truncate(messages, 0, estimator);

        assertTrue(result.isEmpty());
    }
}
