package ai.sessionkeeper.llm;

import ai.sessionkeeper.sessions.Message;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link SummaryModel} backed by a langchain4j {@link ChatModel}.
 *
 * <p>Tool results are sent as user turns tagged with the tool name, since the summary request carries no tool
 * specifications for the provider to match them against.
 */
public class ChatModelSummaryModel implements SummaryModel {
    private static final Logger logger = LogManager.getLogger(ChatModelSummaryModel.class);

    private final ChatModel model;

    public ChatModelSummaryModel(ChatModel model) {
        this.model = Objects.requireNonNull(model);
    }

    @Override
    public String complete(List<Message> context, String instruction) throws SummaryModelException {
        var request = new ArrayList<ChatMessage>(context.size() + 1);
        for (var message : context) {
            // langchain4j rejects blank text content
            if (message.content().isBlank()) {
                continue;
            }
            request.add(toChatMessage(message));
        }
        request.add(UserMessage.from(instruction));

        try {
            var response = model.chat(request);
            var text = response.aiMessage() == null ? null : response.aiMessage().text();
            if (text == null || text.isBlank()) {
                throw new SummaryModelException("Model returned an empty reply");
            }
            return text.strip();
        } catch (RuntimeException e) {
            logger.debug("Chat model request failed", e);
            throw new SummaryModelException("Chat model request failed: " + e.getMessage(), e);
        }
    }

    static ChatMessage toChatMessage(Message message) {
        return switch (message.role()) {
            case SYSTEM -> SystemMessage.from(message.content());
            case USER -> UserMessage.from(message.content());
            case ASSISTANT -> AiMessage.from(message.content());
            case TOOL -> UserMessage.from("[tool result%s]\n%s"
                    .formatted(message.name() == null ? "" : " " + message.name(), message.content()));
        };
    }
}
