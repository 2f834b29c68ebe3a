package dev.ebullient.interrogation.chat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@ApplicationScoped
public class ReplyParser {

    // ```json ... ``` wrapped output, common even when JSON mode is requested
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

    @Inject
    ObjectMapper objectMapper;

    /**
     * Decode the generator's structured output.
     *
     * @throws MalformedReplyException if the text is not a JSON object of the expected shape
     */
    public CharacterReply parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new MalformedReplyException("Empty reply");
        }
        String text = rawText.trim();
        Matcher fence = CODE_FENCE.matcher(text);
        if (fence.matches()) {
            text = fence.group(1);
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || !node.isObject()) {
                throw new MalformedReplyException("Reply is not a JSON object");
            }
            return objectMapper.treeToValue(node, CharacterReply.class);
        } catch (JsonProcessingException e) {
            throw new MalformedReplyException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
