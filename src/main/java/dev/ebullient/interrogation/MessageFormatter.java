package dev.ebullient.interrogation;

import java.util.List;
import java.util.regex.Pattern;

import dev.ebullient.interrogation.model.Evidence;
import dev.ebullient.interrogation.model.Location;
import dev.ebullient.interrogation.model.Role;

/**
 * Pure-function utilities for the context wrapped around a player's message,
 * and for deriving the text a player is allowed to see.
 */
public class MessageFormatter {

    public static final String EVIDENCE_HEADER = "[USER IS PRESENTING THE FOLLOWING EVIDENCE TO YOU]:";

    private static final String RULE = "========================================";
    private static final String ITEM_RULE = "----------------------------------------";

    private static final Pattern LOCATION_MARKER = Pattern.compile("\\[CURRENT LOCATION:[^\\]]*\\]\\s*");
    private static final Pattern EVIDENCE_BLOCK = Pattern.compile(
            "\\n*(?:" + RULE + "\\n)?" + Pattern.quote(EVIDENCE_HEADER) + "[\\s\\S]*$");

    private static final List<String> INSTRUCTION_INDICATORS = List.of(
            "You are",
            "PERSONALITY:",
            "Continue the conversation naturally based on your character",
            "Stay in character and respond as your character would",
            "MENTIONING vs REVEALING",
            "JSON RESPONSE FORMAT:");

    private MessageFormatter() {
    }

    public static String locationMarker(Location location) {
        return "[CURRENT LOCATION: %s - %s]".formatted(location.name(),
                StringUtils.valueOrEmpty(location.description()));
    }

    public static String evidenceBlock(List<Evidence> presented) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append(EVIDENCE_HEADER).append('\n');
        sb.append(RULE).append('\n');
        for (Evidence evidence : presented) {
            sb.append("EVIDENCE: ").append(evidence.title()).append('\n');
            sb.append("Description: ").append(StringUtils.valueOrEmpty(evidence.description())).append('\n');
            sb.append("Visual: ").append(StringUtils.valueOrEmpty(evidence.visualDescription())).append('\n');
            if (!StringUtils.isBlank(evidence.imageUrl())) {
                sb.append("Image: ").append(evidence.imageUrl()).append('\n');
            }
            sb.append(ITEM_RULE).append('\n');
        }
        return sb.toString();
    }

    /**
     * Wrap the player's text with the optional location marker (prefix) and
     * evidence block (suffix).
     *
     * @param location current location, or null
     * @param presented evidence shown by the player, possibly empty
     */
    public static String augment(String message, Location location, List<Evidence> presented) {
        String text = message == null ? "" : message.trim();
        StringBuilder sb = new StringBuilder();
        if (location != null) {
            sb.append(locationMarker(location)).append("\n\n");
        }
        sb.append(text);
        if (presented != null && !presented.isEmpty()) {
            sb.append("\n\n").append(evidenceBlock(presented));
        }
        return sb.toString().trim();
    }

    /**
     * Text of a turn that is safe to show the player. Injected context is removed
     * from user turns; instruction text is never shown.
     */
    public static String clientText(Role role, String fullText) {
        if (fullText == null) {
            return "";
        }
        return switch (role) {
            case INSTRUCTION -> "";
            case CHARACTER -> isInstructionText(fullText) ? "" : fullText;
            case USER -> {
                String content = LOCATION_MARKER.matcher(fullText).replaceAll("");
                content = EVIDENCE_BLOCK.matcher(content).replaceAll("");
                yield content.trim();
            }
        };
    }

    /**
     * True if the text reads like a grounding instruction rather than dialogue:
     * at least two of the usual instruction phrases are present.
     */
    public static boolean isInstructionText(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        int matches = 0;
        for (String indicator : INSTRUCTION_INDICATORS) {
            if (text.contains(indicator)) {
                matches++;
            }
        }
        return matches >= 2;
    }
}
