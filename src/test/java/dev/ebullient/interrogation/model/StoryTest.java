package dev.ebullient.interrogation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class StoryTest {

    final StoryCharacter unnamed = new StoryCharacter(null, "Stowaway", null, null, null, null, null);
    final StoryCharacter pell = new StoryCharacter("char_pell", "Ensign Pell", null, "Nervous", null, null,
            List.of("loc_1"));
    final Story story = new Story("harbor", "Harbor", null, List.of(unnamed, pell),
            List.of(new Location(null, "Nowhere", null), new Location("loc_1", "Secret Lab", null)));

    @Test
    void character_skipsEntriesWithoutId() {
        assertEquals("Ensign Pell", story.character("char_pell").orElseThrow().name());
        assertTrue(story.character("char_voss").isEmpty());
        assertTrue(story.character(null).isEmpty());
    }

    @Test
    void location_skipsEntriesWithoutId() {
        assertEquals("Secret Lab", story.location("loc_1").orElseThrow().name());
        assertTrue(story.location("loc_9").isEmpty());
        assertTrue(story.location(null).isEmpty());
    }
}
