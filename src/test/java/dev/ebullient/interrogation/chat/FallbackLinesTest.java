package dev.ebullient.interrogation.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FallbackLinesTest {

    @Test
    void forPersonality_keywords() {
        assertEquals(FallbackLines.NERVOUS, FallbackLines.forPersonality("A NERVOUS young sailor"));
        assertEquals(FallbackLines.ARROGANT, FallbackLines.forPersonality("arrogant and cold"));
        assertEquals(FallbackLines.PROFESSIONAL, FallbackLines.forPersonality("Calm, professional detective"));
        assertEquals(FallbackLines.NEUTRAL, FallbackLines.forPersonality("cheerful"));
        assertEquals(FallbackLines.NEUTRAL, FallbackLines.forPersonality(null));
    }

    @Test
    void forPersonality_firstKeywordWins() {
        assertEquals(FallbackLines.NERVOUS, FallbackLines.forPersonality("professional but nervous"));
    }
}
