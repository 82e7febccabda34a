package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.Role;
import ai.sessionkeeper.sessions.ToolCall;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * Splits a conversation into eviction units. An assistant message carrying tool calls forms one unit with the tool
 * results that immediately follow it and answer one of its calls; every other message is its own unit. Evicting
 * whole units means a tool result never survives without the call that produced it.
 */
public final class MessageGroups {
    private MessageGroups() {}

    /** Half-open index range {@code [start, end)} into the partitioned list. */
    public record Group(int start, int end) {
        public int size() {
            return end - start;
        }

        public List<Message> of(List<Message> messages) {
            return messages.subList(start, end);
        }

        public boolean anyMatch(List<Message> messages, Predicate<Message> predicate) {
            for (int i = start; i < end; i++) {
                if (predicate.test(messages.get(i))) {
                    return true;
                }
            }
            return false;
        }
    }

    public static List<Group> partition(List<Message> messages) {
        var groups = new ArrayList<Group>();
        int i = 0;
        while (i < messages.size()) {
            var message = messages.get(i);
            int end = i + 1;
            if (message.role() == Role.ASSISTANT && message.hasToolCalls()) {
                var ids = new HashSet<String>();
                for (ToolCall call : message.toolCalls()) {
                    ids.add(call.id());
                }
                while (end < messages.size()) {
                    var next = messages.get(end);
                    if (next.role() != Role.TOOL || next.toolCallId() == null || !ids.contains(next.toolCallId())) {
                        break;
                    }
                    end++;
                }
            }
            groups.add(new Group(i, end));
            i = end;
        }
        return groups;
    }

    static boolean fits(List<Message> messages, int budget, TokenEstimator estimator) {
        return estimator.countMessages(messages) <= budget;
    }

    /**
     * Drops unprotected groups oldest-first until the conversation fits {@code budget}, or nothing evictable is
     * left. Returns {@code messages} itself when it already fits.
     */
    static List<Message> evictOldest(
            List<Message> messages, int budget, TokenEstimator estimator, Predicate<Message> isProtected) {
        if (fits(messages, budget, estimator)) {
            return messages;
        }
        var groups = partition(messages);
        var kept = new boolean[groups.size()];
        int total = 0;
        int keptCount = 0;
        for (int g = 0; g < groups.size(); g++) {
            kept[g] = true;
            for (var message : groups.get(g).of(messages)) {
                total += estimator.countMessage(message);
            }
            keptCount += groups.get(g).size();
        }

        for (int g = 0; g < groups.size() && cost(total, keptCount) > budget; g++) {
            var group = groups.get(g);
            if (group.anyMatch(messages, isProtected)) {
                continue;
            }
            kept[g] = false;
            for (var message : group.of(messages)) {
                total -= estimator.countMessage(message);
            }
            keptCount -= group.size();
        }

        var result = new ArrayList<Message>(keptCount);
        for (int g = 0; g < groups.size(); g++) {
            if (kept[g]) {
                result.addAll(groups.get(g).of(messages));
            }
        }
        return result.size() == messages.size() ? messages : List.copyOf(result);
    }

    private static int cost(int messageTokens, int messageCount) {
        return messageCount == 0 ? 0 : messageTokens + TokenEstimator.REPLY_PRIMER;
    }
}
