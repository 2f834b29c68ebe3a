package dev.ebullient.interrogation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.ebullient.interrogation.model.Role;

class MessageFormatterTest {

    @Test
    void augment_prefixesLocationMarker() {
        String text = MessageFormatter.augment("What happened here?", TestStories.DOCKS, List.of());
        assertTrue(text.startsWith("[CURRENT LOCATION: The Docks - Harbor loading area]\n\nWhat happened here?"));
    }

    @Test
    void augment_appendsEvidenceBlock() {
        String text = MessageFormatter.augment("Explain this.", null, List.of(TestStories.KEYCARD));
        assertTrue(text.startsWith("Explain this."));
        assertTrue(text.contains(MessageFormatter.EVIDENCE_HEADER));
        assertTrue(text.contains("EVIDENCE: Lab Keycard"));
        assertTrue(text.contains("Description: A keycard with a scratched magnetic strip"));
        assertTrue(text.contains("Visual: White plastic card"));
        assertTrue(text.contains("Image: https://example.com/keycard.png"));
    }

    @Test
    void augment_noImageLineWithoutUrl() {
        String text = MessageFormatter.augment("And this?", null, List.of(TestStories.LOGBOOK));
        assertFalse(text.contains("Image:"));
    }

    @Test
    void clientText_removesInjectedContext() {
        String full = MessageFormatter.augment("  Explain this.  ", TestStories.DOCKS,
                List.of(TestStories.KEYCARD, TestStories.LOGBOOK));
        assertEquals("Explain this.", MessageFormatter.clientText(Role.USER, full));
    }

    @Test
    void clientText_evidenceOnlyMessage_isEmpty() {
        String full = MessageFormatter.augment("", null, List.of(TestStories.KEYCARD));
        assertEquals("", MessageFormatter.clientText(Role.USER, full));
    }

    @Test
    void clientText_byRole() {
        assertEquals("", MessageFormatter.clientText(Role.INSTRUCTION, "You are Ensign Pell."));
        assertEquals("[shrugs] No idea.", MessageFormatter.clientText(Role.CHARACTER, "[shrugs] No idea."));
        assertEquals("", MessageFormatter.clientText(Role.CHARACTER,
                "You are Ensign Pell.\n\nStay in character and respond as your character would."));
        assertEquals("", MessageFormatter.clientText(Role.USER, null));
    }

    @Test
    void isInstructionText_needsTwoIndicators() {
        assertFalse(MessageFormatter.isInstructionText("You are very rude."));
        assertTrue(MessageFormatter.isInstructionText(
                "You are Captain Voss.\nPERSONALITY: Arrogant"));
        assertFalse(MessageFormatter.isInstructionText(""));
    }
}
