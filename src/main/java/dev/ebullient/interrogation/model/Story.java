package dev.ebullient.interrogation.model;

import java.util.List;
import java.util.Optional;

public record Story(
        String id,
        String title,
        String fullStory,
        List<StoryCharacter> characters,
        List<Location> locations) {

    public Story {
        characters = characters == null ? List.of() : List.copyOf(characters);
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public Optional<StoryCharacter> character(String characterId) {
        return characters.stream()
                .filter(c -> characterId != null && characterId.equals(c.id()))
                .findFirst();
    }

    public Optional<Location> location(String locationId) {
        return locations.stream()
                .filter(l -> locationId != null && locationId.equals(l.id()))
                .findFirst();
    }
}
