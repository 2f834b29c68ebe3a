package dev.ebullient.interrogation;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import dev.ebullient.interrogation.model.Evidence;
import dev.ebullient.interrogation.model.Location;
import dev.ebullient.interrogation.model.Story;
import dev.ebullient.interrogation.model.StoryCharacter;

/**
 * Read-only access to story data.
 */
public interface StoryProvider {

    Optional<Story> findStory(String storyId);

    default Optional<StoryCharacter> findCharacter(String storyId, String characterId) {
        return findStory(storyId).flatMap(s -> s.character(characterId));
    }

    default Optional<Location> findLocation(String storyId, String locationId) {
        return findStory(storyId).flatMap(s -> s.location(locationId));
    }

    /**
     * Evidence items of the story matching the given IDs, in request order.
     * IDs that match nothing are skipped.
     */
    default List<Evidence> findEvidence(String storyId, Collection<String> evidenceIds) {
        if (evidenceIds == null || evidenceIds.isEmpty()) {
            return List.of();
        }
        return findStory(storyId)
                .map(story -> evidenceIds.stream()
                        .filter(Objects::nonNull)
                        .distinct()
                        .flatMap(id -> story.characters().stream()
                                .flatMap(c -> c.holdsEvidence().stream())
                                .filter(e -> id.equals(e.id()))
                                .limit(1))
                        .toList())
                .orElse(List.of());
    }
}
