package ai.sessionkeeper.context.policy;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.Role;
import ai.sessionkeeper.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Keeps the last {@code windowSize} messages regardless of token cost. With {@code preserveSystem}, system messages
 * are kept in place and do not count toward the window. Tool results left at the front of the window without their
 * originating call are dropped as well.
 */
public final class SlidingWindowPolicy implements TruncationPolicy {
    private final int windowSize;
    private final boolean preserveSystem;

    public SlidingWindowPolicy(int windowSize) {
        this(windowSize, true);
    }

    public SlidingWindowPolicy(int windowSize, boolean preserveSystem) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got " + windowSize);
        }
        this.windowSize = windowSize;
        this.preserveSystem = preserveSystem;
    }

    public int windowSize() {
        return windowSize;
    }

    @Override
    public List<Message> truncate(List<Message> messages, int budget, TokenEstimator estimator) {
        var keep = new boolean[messages.size()];
        int windowed = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            var message = messages.get(i);
            if (preserveSystem && message.isSystem()) {
                keep[i] = true;
            } else if (windowed < windowSize) {
                keep[i] = true;
                windowed++;
            }
        }

        // a tool result whose call fell outside the window is an orphan
        var droppedCallIds = new HashSet<String>();
        for (int i = 0; i < messages.size(); i++) {
            var message = messages.get(i);
            if (message.hasToolCalls() && !keep[i]) {
                message.toolCalls().forEach(call -> droppedCallIds.add(call.id()));
            } else if (keep[i]
                    && message.role() == Role.TOOL
                    && message.toolCallId() != null
                    && droppedCallIds.contains(message.toolCallId())) {
                keep[i] = false;
            }
        }

        var result = new ArrayList<Message>();
        for (int i = 0; i < messages.size(); i++) {
            if (keep[i]) {
                result.add(messages.get(i));
            }
        }
        return result.size() == messages.size() ? messages : List.copyOf(result);
    }

    @Override
    public String name() {
        return "sliding_window";
    }
}
