package dev.ebullient.interrogation.chat;

import java.util.List;

import dev.ebullient.interrogation.model.Turn;

/**
 * The language model, seen as: ordered turns in, text out.
 */
public interface DialogueGenerator {

    /**
     * @param turns ordered conversation, instruction turn first; no turn may have blank text
     * @param structured ask for a JSON object reply
     * @return the generated text, which may not be valid JSON even when {@code structured} is set
     * @throws dev.ebullient.interrogation.AgentException of kind {@code UNAVAILABLE} if the model cannot be reached
     */
    String generate(List<Turn> turns, boolean structured);
}
