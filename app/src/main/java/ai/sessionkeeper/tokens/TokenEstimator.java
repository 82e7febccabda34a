package ai.sessionkeeper.tokens;

import ai.sessionkeeper.sessions.Message;
import ai.sessionkeeper.sessions.ToolCall;
import java.util.List;

/**
 * Counts tokens for text and chat messages. Implementations are deterministic and thread-safe.
 *
 * <p>Message cost is content + {@value #MESSAGE_OVERHEAD} framing tokens + the role name, plus the optional
 * {@code name} (one extra token), each tool call ({@value #TOOL_CALL_OVERHEAD} + name + arguments) and the tool
 * result id. A non-empty conversation adds {@value #REPLY_PRIMER} tokens priming the reply.
 */
public interface TokenEstimator {
    int MESSAGE_OVERHEAD = 4;
    int TOOL_CALL_OVERHEAD = 3;
    int REPLY_PRIMER = 3;

    /** Tokens in {@code text}; zero for null or empty text. */
    int count(String text);

    default int countMessage(Message message) {
        int tokens = MESSAGE_OVERHEAD + count(message.role().wireName()) + count(message.content());
        if (message.name() != null) {
            tokens += count(message.name()) + 1;
        }
        if (message.toolCalls() != null) {
            for (ToolCall call : message.toolCalls()) {
                tokens += TOOL_CALL_OVERHEAD + count(call.name()) + count(call.arguments());
            }
        }
        if (message.toolCallId() != null) {
            tokens += count(message.toolCallId());
        }
        return tokens;
    }

    default int countMessages(List<Message> messages) {
        if (messages.isEmpty()) {
            return 0;
        }
        int total = REPLY_PRIMER;
        for (var message : messages) {
            total += countMessage(message);
        }
        return total;
    }
}
