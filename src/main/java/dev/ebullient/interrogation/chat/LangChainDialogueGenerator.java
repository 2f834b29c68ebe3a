package dev.ebullient.interrogation.chat;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import dev.ebullient.interrogation.AgentException;
import dev.ebullient.interrogation.model.Turn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;

@ApplicationScoped
public class LangChainDialogueGenerator implements DialogueGenerator {
    private static final Logger log = Logger.getLogger(LangChainDialogueGenerator.class);

    @Inject
    ChatModel chatModel;

    @Override
    public String generate(List<Turn> turns, boolean structured) {
        List<ChatMessage> messages = toMessages(turns);
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("No turns to send");
        }
        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (structured) {
            request.responseFormat(ResponseFormat.JSON);
        }
        ChatResponse response;
        try {
            response = chatModel.chat(request.build());
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Generator call failed: " + e.getMessage(), e);
        }
        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        log.debugf("Generator returned %d chars for %d turns", text == null ? 0 : text.length(), messages.size());
        return text == null ? "" : text;
    }

    static List<ChatMessage> toMessages(List<Turn> turns) {
        List<ChatMessage> messages = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            if (turn.isBlank()) {
                // generators reject empty content
                continue;
            }
            messages.add(switch (turn.role()) {
                case INSTRUCTION -> SystemMessage.from(turn.fullText());
                case USER -> UserMessage.from(turn.fullText());
                case CHARACTER -> AiMessage.from(turn.fullText());
            });
        }
        return messages;
    }
}
