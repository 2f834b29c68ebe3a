package dev.ebullient.interrogation.chat;

import java.util.Locale;

/**
 * Canned in-character lines used when the generator cannot produce a usable reply.
 */
public final class FallbackLines {

    public static final String NERVOUS = "I-I'm sorry, I'm having trouble understanding... Could you repeat that?";
    public static final String ARROGANT = "Speak clearly. I don't have time for your mumbling.";
    public static final String PROFESSIONAL = "I apologize, could you please rephrase your question?";
    public static final String NEUTRAL = "I'm having trouble understanding. Could you rephrase that?";

    /** Substituted for a blank reply. */
    public static final String EMPTY_REPLY = "I apologize, but I couldn't formulate a proper response. Could you please rephrase your question?";

    private FallbackLines() {
    }

    /**
     * First matching keyword wins: nervous, arrogant, professional.
     */
    public static String forPersonality(String personality) {
        String p = personality == null ? "" : personality.toLowerCase(Locale.ROOT);
        if (p.contains("nervous")) {
            return NERVOUS;
        }
        if (p.contains("arrogant")) {
            return ARROGANT;
        }
        if (p.contains("professional")) {
            return PROFESSIONAL;
        }
        return NEUTRAL;
    }
}
