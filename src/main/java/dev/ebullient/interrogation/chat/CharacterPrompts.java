package dev.ebullient.interrogation.chat;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import dev.ebullient.interrogation.StringUtils;
import dev.ebullient.interrogation.model.Evidence;
import dev.ebullient.interrogation.model.Location;
import dev.ebullient.interrogation.model.Story;
import dev.ebullient.interrogation.model.StoryCharacter;

/**
 * Instruction and clarification text sent to the generator.
 */
public final class CharacterPrompts {

    /** Separates the character instruction from the story it is grounded in. */
    public static final String STORY_CONTEXT_HEADER = "[STORY CONTEXT FOR REFERENCE]:";

    private static final String JSON_SHAPE = """
            JSON RESPONSE FORMAT:
            You must ALWAYS respond with a JSON object:
            {
              "reply": "Your character's spoken dialogue, with [actions] in brackets",
              "revealed_evidences": ["IDs of evidence you are handing over in this reply"],
              "revealed_locations": ["IDs of locations you are granting access to in this reply"]
            }
            Use empty arrays when you reveal nothing.""";

    public static final String CONTINUATION = """
            You are a character in an ongoing investigation story. Continue the conversation
            naturally based on your character and everything said so far.
            Stay in character and respond as your character would.
            You may only hand over evidence or grant access to locations you were given earlier
            in this conversation. Mentioning something is not the same as revealing it.

            """ + JSON_SHAPE;

    public static final String RETRY_CLARIFICATION = """
            Please respond in valid JSON format:
            {
              "reply": "your spoken dialogue with [actions] in brackets",
              "revealed_evidences": ["evidence IDs you're giving"],
              "revealed_locations": ["location IDs you're granting access to"]
            }
            """;

    public static final String FORMAT_REMINDER = """
            [Reminder: stay in character. Respond ONLY with a JSON object with the fields
            "reply", "revealed_evidences" and "revealed_locations".]
            """;

    private CharacterPrompts() {
    }

    /**
     * Build the grounding instruction for a character: who they are, what they
     * hold and know, how mentioning differs from revealing, and the reply shape.
     */
    public static String instruction(StoryCharacter character, Story story) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are %s.\n\n".formatted(character.name()));
        appendSection(sb, "APPEARANCE", character.appearance());
        appendSection(sb, "PERSONALITY", character.personality());
        appendSection(sb, "YOUR KNOWLEDGE AND BACKGROUND", character.knowledge());

        if (!character.holdsEvidence().isEmpty()) {
            sb.append("Evidence you possess:\n");
            for (Evidence evidence : character.holdsEvidence()) {
                sb.append("- %s (ID: %s): %s\n".formatted(evidence.title(), evidence.id(),
                        StringUtils.valueOrEmpty(evidence.description())));
                if (evidence.visualDescription() != null && !evidence.visualDescription().isBlank()) {
                    sb.append("  (Visual: %s)\n".formatted(evidence.visualDescription()));
                }
            }
            sb.append('\n');
        }

        List<Location> known = character.knowsLocationIds().stream()
                .map(story::location)
                .flatMap(Optional::stream)
                .toList();
        if (!known.isEmpty()) {
            sb.append("Locations you are familiar with and can grant access to:\n");
            for (Location location : known) {
                sb.append("- %s (ID: %s): %s\n".formatted(location.name(), location.id(),
                        StringUtils.valueOrEmpty(location.description())));
            }
            sb.append('\n');
        }

        sb.append("""
                MENTIONING vs REVEALING:
                - You can MENTION any location or evidence you know about from the story.
                - You can only REVEAL (hand over, grant access to) items from your own lists above.
                - When asked about something you cannot give, say so in character:
                  "I know where the lab is, but I don't have clearance."
                - Never pretend to have access or items you don't possess.
                - Only reference characters, events and locations that exist in the story.

                INTERROGATION BEHAVIOR:
                - You start with %s willingness to cooperate.
                - Be defensive or evasive at first; specific questions and presented evidence earn more.
                - Never confess unless confronted with overwhelming evidence.

                """.formatted(cooperationLevel(character.personality())));
        sb.append(JSON_SHAPE);

        if (story.fullStory() != null && !story.fullStory().isBlank()) {
            sb.append("\n\n").append(STORY_CONTEXT_HEADER).append('\n').append(story.fullStory().trim());
        }
        return sb.toString();
    }

    /** Bullet list of candidate locations for the reveal classifier. */
    public static String locationCandidates(List<Location> candidates) {
        StringBuilder sb = new StringBuilder();
        for (Location location : candidates) {
            sb.append("- %s (ID: %s)\n".formatted(location.name(), location.id()));
        }
        return sb.toString();
    }

    static String cooperationLevel(String personality) {
        String p = personality == null ? "" : personality.toLowerCase(Locale.ROOT);
        if (containsAny(p, "naive", "trusting", "innocent child", "eager to please")) {
            return "HIGH";
        }
        if (containsAny(p, "helpful", "friendly", "honest", "open")) {
            return "MEDIUM";
        }
        return "LOW";
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static void appendSection(StringBuilder sb, String title, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(title).append(": ").append(value.trim()).append("\n\n");
        }
    }
}
